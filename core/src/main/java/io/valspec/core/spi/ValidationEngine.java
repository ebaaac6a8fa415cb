package io.valspec.core.spi;

import io.valspec.core.model.ValidationDescriptor;
import java.util.Map;

/**
 * Pluggable validation engine SPI. Consumes the {@link ValidationDescriptor} of a compiled schema
 * and checks raw request input against it.
 *
 * <p>Implementations MUST be thread-safe: they are called concurrently from request-handling
 * threads.
 */
public interface ValidationEngine {

    /**
     * Validates raw input.
     *
     * @param descriptor the compiled descriptor
     * @param input      raw input, typically decoded request parameters
     * @return the validated values, or the field errors; never throws for invalid input
     */
    ValidationResult validate(ValidationDescriptor descriptor, Map<String, Object> input);
}
