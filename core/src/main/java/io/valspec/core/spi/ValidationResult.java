package io.valspec.core.spi;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of validating one input map: either the validated values or per-field error messages.
 * Field errors are ordinary data, not exceptions.
 */
public final class ValidationResult {

    private final Map<String, Object> values;
    private final Map<String, List<String>> errors;

    private ValidationResult(Map<String, Object> values, Map<String, List<String>> errors) {
        this.values = values;
        this.errors = errors;
    }

    /**
     * A successful result.
     *
     * @param values the validated values, in declaration order
     */
    public static ValidationResult ok(Map<String, Object> values) {
        Objects.requireNonNull(values, "values must not be null");
        return new ValidationResult(Collections.unmodifiableMap(new LinkedHashMap<>(values)), null);
    }

    /**
     * A failed result.
     *
     * @param errors field name (dotted for nested fields) to error messages; must not be empty
     */
    public static ValidationResult errors(Map<String, List<String>> errors) {
        Objects.requireNonNull(errors, "errors must not be null");
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("a failed result needs at least one field error");
        }
        Map<String, List<String>> copy = new LinkedHashMap<>();
        errors.forEach((field, messages) -> copy.put(field, List.copyOf(messages)));
        return new ValidationResult(null, Collections.unmodifiableMap(copy));
    }

    public boolean isValid() {
        return errors == null;
    }

    /**
     * The validated values.
     *
     * @throws IllegalStateException if the result carries errors
     */
    public Map<String, Object> values() {
        if (values == null) {
            throw new IllegalStateException("validation failed: " + errors);
        }
        return values;
    }

    /** Field errors; empty for a successful result. */
    public Map<String, List<String>> fieldErrors() {
        return errors == null ? Map.of() : errors;
    }

    @Override
    public String toString() {
        return isValid() ? "ValidationResult.ok" + values : "ValidationResult.errors" + errors;
    }
}
