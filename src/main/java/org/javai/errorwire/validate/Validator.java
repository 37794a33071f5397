package org.javai.errorwire.validate;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Checks a single field value. Receives {@code null} for unset fields.
 */
@FunctionalInterface
public interface Validator {

    /**
     * @param value The field value, possibly null
     * @return empty if the value is valid, otherwise a description of the problem
     */
    Optional<String> validate(Object value);

    /**
     * Creates a validator that reports {@code message} whenever {@code valid} rejects the value.
     */
    static Validator check(Predicate<Object> valid, String message) {
        Objects.requireNonNull(valid, "valid must not be null");
        Objects.requireNonNull(message, "message must not be null");
        return value -> valid.test(value) ? Optional.empty() : Optional.of(message);
    }
}
