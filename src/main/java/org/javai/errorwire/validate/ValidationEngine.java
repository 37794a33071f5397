package org.javai.errorwire.validate;

import org.javai.errorwire.ErrorWireConfig;
import org.javai.errorwire.FieldViolation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Validates a value by running the validators named in its fields' {@link Validate} tags.
 *
 * <p>Every named validator runs, so all problems with a value surface in one pass.
 * Violations come back in field order, then tag order, with the violations of a nested
 * ({@value #STRUCT}) field spliced in where the tag names it.
 *
 * <p>Values that are not struct-shaped (see {@link TypeSchema#isStructShaped}) have nothing
 * to validate and yield no violations. One level of {@link Optional} is unwrapped.
 *
 * <p>A tag naming a validator missing from the table yields a violation rather than an
 * exception. A nested value that is already being validated further up the current path is
 * reported once on the field that refers back to it and not entered again. Nested validation
 * also stops at {@link ErrorWireConfig#maxValidationDepth()} levels and reports a violation on
 * the field where it stopped.
 */
public class ValidationEngine {

    /**
     * Reserved tag name that validates a field's own fields.
     */
    public static final String STRUCT = "struct";

    private static final Logger logger = LoggerFactory.getLogger(ValidationEngine.class);

    private final ErrorWireConfig config;

    public ValidationEngine() {
        this(ErrorWireConfig.defaults());
    }

    public ValidationEngine(ErrorWireConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /**
     * Validates a value against the table.
     *
     * @param validators The validators tags may name
     * @param value The value to validate, may be null
     * @return All violations found, empty if the value is valid or has no fields to validate
     */
    public List<FieldViolation> validate(ValidatorTable validators, Object value) {
        Objects.requireNonNull(validators, "validators must not be null");
        List<FieldViolation> violations = new ArrayList<>();
        Set<Object> path = Collections.newSetFromMap(new IdentityHashMap<>());
        collect(validators, value, 0, path, violations);
        return List.copyOf(violations);
    }

    private void collect(ValidatorTable validators, Object value, int depth, Set<Object> path,
                         List<FieldViolation> violations) {
        Object target = unwrap(value);
        if (target == null || !TypeSchema.isStructShaped(target.getClass())) {
            return;
        }

        path.add(target);
        try {
            collectFields(validators, target, depth, path, violations);
        } finally {
            path.remove(target);
        }
    }

    private void collectFields(ValidatorTable validators, Object target, int depth, Set<Object> path,
                               List<FieldViolation> violations) {
        for (FieldSchema field : TypeSchema.of(target.getClass()).fields()) {
            Object fieldValue = field.read(target);

            for (String name : field.validatorNames()) {
                if (STRUCT.equals(name)) {
                    descend(validators, field, fieldValue, depth, path, violations);
                    continue;
                }

                Optional<Validator> validator = validators.lookup(name);
                if (validator.isEmpty()) {
                    violations.add(FieldViolation.of(field.name(), "undefined validator: \"" + name + "\"", config));
                    continue;
                }

                validator.get().validate(fieldValue)
                        .ifPresent(message -> violations.add(FieldViolation.of(field.displayName(), message, config)));
            }
        }
    }

    private void descend(ValidatorTable validators, FieldSchema field, Object fieldValue, int depth,
                         Set<Object> path, List<FieldViolation> violations) {
        Object nested = unwrap(fieldValue);
        if (nested == null || !TypeSchema.isStructShaped(nested.getClass())) {
            return;
        }
        if (path.contains(nested)) {
            logger.warn("Nested validation skipped field [{}]: cyclic reference to {}",
                    field.name(), nested.getClass().getName());
            violations.add(FieldViolation.of(field.displayName(),
                    "cyclic reference to " + nested.getClass().getSimpleName() + " not validated again", config));
            return;
        }
        if (depth >= config.maxValidationDepth()) {
            logger.warn("Nested validation stopped at field [{}]: maximum depth {} exceeded",
                    field.name(), config.maxValidationDepth());
            violations.add(FieldViolation.of(field.displayName(),
                    "maximum validation depth " + config.maxValidationDepth() + " exceeded", config));
            return;
        }
        collect(validators, nested, depth + 1, path, violations);
    }

    private static Object unwrap(Object value) {
        if (value instanceof Optional<?> optional) {
            return optional.orElse(null);
        }
        return value;
    }
}
