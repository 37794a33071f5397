package org.javai.errorwire;

import java.util.Objects;

/**
 * A single field-level validation failure.
 *
 * @param field The field name as seen by clients (serialization name when overridden)
 * @param description What was wrong with the field
 * @param errorName The configured validation error name
 * @param errorCode The configured validation error code
 */
public record FieldViolation(String field, String description, String errorName, int errorCode) {

    public FieldViolation {
        Objects.requireNonNull(field, "field must not be null");
        Objects.requireNonNull(description, "description must not be null");
        Objects.requireNonNull(errorName, "errorName must not be null");
        if (field.isEmpty()) {
            throw new IllegalArgumentException("field must not be empty");
        }
    }

    /**
     * Creates a violation stamped with the validation error name and code from the given config.
     */
    public static FieldViolation of(String field, String description, ErrorWireConfig config) {
        return new FieldViolation(field, description, config.validationErrorName(), config.validationErrorCode());
    }

    @Override
    public String toString() {
        return "field " + field + " is invalid: " + description;
    }
}
