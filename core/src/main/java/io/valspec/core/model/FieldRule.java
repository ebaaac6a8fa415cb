package io.valspec.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One field of a {@link ValidationDescriptor}: the value type and constraints the validation
 * engine enforces. Documentation-only options ({@code example}, {@code description}, ...) never
 * appear in {@link #constraints()}.
 *
 * @param name        field name
 * @param type        value type
 * @param itemType    item type for {@link ValueType#ARRAY}, otherwise null
 * @param required    whether the field must be present
 * @param constraints ordered constraint map ({@code minimum}, {@code included}, {@code default}, ...)
 * @param nested      descriptor for object values or object array items, or null
 */
public record FieldRule(
        String name,
        ValueType type,
        ValueType itemType,
        boolean required,
        Map<String, Object> constraints,
        ValidationDescriptor nested) {

    public FieldRule {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        constraints = constraints == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(constraints));
    }

    public Object constraint(String key) {
        return constraints.get(key);
    }

    public boolean hasConstraint(String key) {
        return constraints.containsKey(key);
    }
}
