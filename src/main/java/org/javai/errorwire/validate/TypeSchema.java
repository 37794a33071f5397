package org.javai.errorwire.validate;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The validated fields of a type, in declaration order. Built once per class by reflection
 * and cached for the lifetime of the class.
 *
 * <p>Records contribute their components. Other classes contribute their instance fields,
 * superclass fields first. Fields without a {@link Validate} tag, static or synthetic
 * fields, and fields that cannot be made accessible are left out.
 *
 * @param type The described type
 * @param fields The validated fields
 */
public record TypeSchema(Class<?> type, List<FieldSchema> fields) {

    private static final Logger logger = LoggerFactory.getLogger(TypeSchema.class);

    private static final ClassValue<TypeSchema> CACHE = new ClassValue<>() {
        @Override
        protected TypeSchema computeValue(Class<?> type) {
            return build(type);
        }
    };

    public TypeSchema {
        Objects.requireNonNull(type, "type must not be null");
        fields = List.copyOf(fields);
    }

    /**
     * Returns the cached schema of a type, building it on first use.
     */
    public static TypeSchema of(Class<?> type) {
        return CACHE.get(type);
    }

    /**
     * Whether values of the type have fields worth walking. Platform types, primitives,
     * arrays, enums, collections and maps do not.
     */
    public static boolean isStructShaped(Class<?> type) {
        if (type.isPrimitive() || type.isArray() || type.isInterface() || type.isAnnotation()) {
            return false;
        }
        if (Enum.class.isAssignableFrom(type)
                || Iterable.class.isAssignableFrom(type)
                || Map.class.isAssignableFrom(type)) {
            return false;
        }
        return !isPlatformType(type);
    }

    private static TypeSchema build(Class<?> type) {
        List<FieldSchema> fields = new ArrayList<>();
        for (Field field : declaredFieldsInOrder(type)) {
            if (Modifier.isStatic(field.getModifiers()) || field.isSynthetic()) {
                continue;
            }
            Validate tag = field.getAnnotation(Validate.class);
            if (tag == null) {
                continue;
            }
            List<String> validatorNames = parseTag(tag.value());
            if (validatorNames.isEmpty()) {
                continue;
            }
            if (!field.trySetAccessible()) {
                logger.debug("Skipping field {}.{}: not accessible", type.getName(), field.getName());
                continue;
            }
            fields.add(new FieldSchema(field, field.getName(), displayName(field), validatorNames));
        }
        logger.debug("Built validation schema for {} with {} validated fields", type.getName(), fields.size());
        return new TypeSchema(type, fields);
    }

    private static List<Field> declaredFieldsInOrder(Class<?> type) {
        if (type.isRecord()) {
            List<Field> fields = new ArrayList<>();
            for (RecordComponent component : type.getRecordComponents()) {
                try {
                    fields.add(type.getDeclaredField(component.getName()));
                } catch (NoSuchFieldException e) {
                    throw new IllegalStateException("Record " + type.getName()
                            + " has no field for component " + component.getName(), e);
                }
            }
            return fields;
        }

        Deque<Class<?>> hierarchy = new ArrayDeque<>();
        for (Class<?> current = type; current != null && !isPlatformType(current); current = current.getSuperclass()) {
            hierarchy.push(current);
        }
        List<Field> fields = new ArrayList<>();
        for (Class<?> declaring : hierarchy) {
            fields.addAll(Arrays.asList(declaring.getDeclaredFields()));
        }
        return fields;
    }

    static List<String> parseTag(String tag) {
        List<String> names = new ArrayList<>();
        for (String part : tag.split(",")) {
            String name = part.trim();
            if (!name.isEmpty()) {
                names.add(name);
            }
        }
        return names;
    }

    private static String displayName(Field field) {
        JsonProperty property = field.getAnnotation(JsonProperty.class);
        if (property != null && !property.value().isEmpty()) {
            return property.value();
        }
        return field.getName();
    }

    private static boolean isPlatformType(Class<?> type) {
        String packageName = type.getPackageName();
        return packageName.startsWith("java.") || packageName.startsWith("javax.");
    }
}
