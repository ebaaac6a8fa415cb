package io.valspec.core.compile;

import io.valspec.core.error.UnresolvedOptionValueError;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.temporal.Temporal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Option key vocabulary and compile-time literal resolution.
 *
 * <p>A literal is a string, boolean, character, boxed number, {@link BigDecimal}, {@link
 * BigInteger}, enum constant, {@link UUID}, {@code java.time} value, or a list, array or map of
 * literals. Enum constants resolve to their {@code name()}; UUIDs and temporals resolve to their
 * string form. Anything else is rejected.
 */
final class OptionValues {

    /** Keys that only document and never constrain. */
    static final Set<String> DOCUMENTATION_ONLY =
            Set.of("example", "description", "title", "deprecated", "readOnly", "writeOnly");

    /** Keys that only constrain and never appear verbatim in documentation nodes. */
    static final Set<String> VALIDATION_ONLY = Set.of("values", "included", "excluded");

    private static final Set<String> KNOWN_KEYS = Set.of(
            "example",
            "format",
            "minimum",
            "maximum",
            "exclusiveMinimum",
            "exclusiveMaximum",
            "values",
            "description",
            "title",
            "nullable",
            "default",
            "included",
            "excluded",
            "pattern",
            "minLength",
            "maxLength",
            "minItems",
            "maxItems",
            "deprecated",
            "readOnly",
            "writeOnly");

    private static final Map<String, String> SNAKE_CASE_ALIASES = Map.of(
            "exclusive_minimum", "exclusiveMinimum",
            "exclusive_maximum", "exclusiveMaximum",
            "min_length", "minLength",
            "max_length", "maxLength",
            "min_items", "minItems",
            "max_items", "maxItems",
            "read_only", "readOnly",
            "write_only", "writeOnly");

    private static final Set<Class<?>> PLAIN_NUMBERS =
            Set.of(Integer.class, Long.class, Short.class, Byte.class, Double.class, Float.class);

    private OptionValues() {
        // utility class
    }

    /**
     * Maps an option key to its canonical spelling.
     *
     * @return the canonical key, or null if the key is not recognized
     */
    static String canonicalKey(String key) {
        if (key == null) {
            return null;
        }
        if (KNOWN_KEYS.contains(key)) {
            return key;
        }
        return SNAKE_CASE_ALIASES.get(key);
    }

    /**
     * Resolves an option value to a literal.
     *
     * @throws UnresolvedOptionValueError if the value, or any element of it, is not a literal
     */
    static Object resolve(Object value, String schemaName, String field, String key) {
        if (value == null || value instanceof String || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Character) {
            return value.toString();
        }
        if (PLAIN_NUMBERS.contains(value.getClass()) || value instanceof BigDecimal || value instanceof BigInteger) {
            return value;
        }
        if (value instanceof Enum<?> constant) {
            return constant.name();
        }
        if (value instanceof UUID || value instanceof Temporal) {
            return value.toString();
        }
        if (value instanceof Collection<?> collection) {
            List<Object> resolved = new ArrayList<>();
            for (Object element : collection) {
                resolved.add(resolve(element, schemaName, field, key));
            }
            return resolved;
        }
        if (value instanceof Object[] array) {
            List<Object> resolved = new ArrayList<>();
            for (Object element : array) {
                resolved.add(resolve(element, schemaName, field, key));
            }
            return resolved;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> resolved = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                resolved.put(String.valueOf(entry.getKey()), resolve(entry.getValue(), schemaName, field, key));
            }
            return resolved;
        }
        throw new UnresolvedOptionValueError(
                "Option '" + key + "' of field '" + field + "' is not a compile-time literal: "
                        + value.getClass().getName(),
                schemaName,
                field);
    }

    /** String form of a resolved literal; decimals are written without exponent. */
    static String asString(Object literal) {
        if (literal instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        return String.valueOf(literal);
    }

    /** True for arbitrary-precision value objects. */
    static boolean isArbitraryPrecision(Object literal) {
        return literal instanceof BigDecimal || literal instanceof BigInteger;
    }
}
