package org.javai.errorwire.validate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Caller-supplied validators, keyed by the names used in {@link Validate} tags.
 * Immutable once built.
 */
public final class ValidatorTable {

    private static final ValidatorTable EMPTY = new ValidatorTable(Map.of());

    private final Map<String, Validator> validators;

    private ValidatorTable(Map<String, Validator> validators) {
        this.validators = validators;
    }

    public static ValidatorTable empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a table from an existing name-to-validator map.
     *
     * @throws IllegalArgumentException if a name is reserved or cannot appear in a tag
     */
    public static ValidatorTable of(Map<String, Validator> validators) {
        Builder builder = builder();
        validators.forEach(builder::register);
        return builder.build();
    }

    public Optional<Validator> lookup(String name) {
        return Optional.ofNullable(validators.get(name));
    }

    public Set<String> names() {
        return validators.keySet();
    }

    public static class Builder {
        private final Map<String, Validator> validators = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Registers a validator, replacing any earlier one with the same name.
         */
        public Builder register(String name, Validator validator) {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(validator, "validator must not be null");
            if (name.isBlank()) {
                throw new IllegalArgumentException("name must not be blank");
            }
            if (name.contains(",") || !name.equals(name.trim())) {
                throw new IllegalArgumentException("name cannot be used in a tag: '" + name + "'");
            }
            if (ValidationEngine.STRUCT.equals(name)) {
                throw new IllegalArgumentException("'" + ValidationEngine.STRUCT + "' is reserved for nested validation");
            }
            validators.put(name, validator);
            return this;
        }

        public ValidatorTable build() {
            return new ValidatorTable(Collections.unmodifiableMap(new LinkedHashMap<>(validators)));
        }
    }
}
