package io.valspec.core.config;

import io.valspec.core.model.SemanticType;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Settings that shape compiled documentation schemas.
 *
 * <p>Options for one field are merged with this precedence, highest first: values forced by the
 * type mapping, the field's explicit options, {@link #typeDefaults()} for the field's semantic
 * type, then the built-in examples below.
 *
 * @param dateExample     example injected into {@code date} fields that declare none
 * @param dateTimeExample example injected into {@code datetime} fields that declare none
 * @param typeDefaults    per-type default options supplied by the application
 */
public record CompilerConfig(String dateExample, String dateTimeExample, Map<SemanticType, Map<String, Object>> typeDefaults) {

    public static final String DEFAULT_DATE_EXAMPLE = "2024-08-12";

    /** RFC 3339 §5.6 date-time notation without offset. */
    public static final String DEFAULT_DATETIME_EXAMPLE = "2024-08-12T21:00:39";

    public CompilerConfig {
        Objects.requireNonNull(dateExample, "dateExample must not be null");
        Objects.requireNonNull(dateTimeExample, "dateTimeExample must not be null");
        Map<SemanticType, Map<String, Object>> copy = new EnumMap<>(SemanticType.class);
        if (typeDefaults != null) {
            typeDefaults.forEach((type, options) ->
                    copy.put(type, Collections.unmodifiableMap(new LinkedHashMap<>(options))));
        }
        typeDefaults = Collections.unmodifiableMap(copy);
    }

    public static CompilerConfig defaults() {
        return new CompilerConfig(DEFAULT_DATE_EXAMPLE, DEFAULT_DATETIME_EXAMPLE, Map.of());
    }

    /** Default options for a semantic type, empty if none were configured. */
    public Map<String, Object> defaultsFor(SemanticType type) {
        return typeDefaults.getOrDefault(type, Map.of());
    }
}
