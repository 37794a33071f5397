package org.javai.errorwire.validate;

import java.lang.reflect.Field;
import java.util.List;
import java.util.Objects;

/**
 * A validated field of a type, as declared.
 *
 * @param field The reflected field, already made accessible
 * @param name The declared field name
 * @param displayName The serialization name if overridden, otherwise the declared name
 * @param validatorNames Validator names from the tag, in order
 */
public record FieldSchema(Field field, String name, String displayName, List<String> validatorNames) {

    public FieldSchema {
        Objects.requireNonNull(field, "field must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(displayName, "displayName must not be null");
        validatorNames = List.copyOf(validatorNames);
    }

    /**
     * Whether the tag asks for the field's own fields to be validated.
     */
    public boolean nested() {
        return validatorNames.contains(ValidationEngine.STRUCT);
    }

    /**
     * Reads this field from an instance of its declaring type.
     */
    public Object read(Object target) {
        try {
            return field.get(target);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Field " + name + " was accessible when the schema was built", e);
        }
    }
}
