package io.valspec.core.model;

import java.util.Objects;

/**
 * The immutable pair produced for one named declaration block. Created once per compilation by
 * {@code SchemaCompiler} and shared read-only for the lifetime of the process.
 *
 * @param name                 registry name
 * @param validationDescriptor descriptor consumed by the validation engine
 * @param documentationSchema  root {@code object} node of the documentation tree
 */
public record CompiledSchema(String name, ValidationDescriptor validationDescriptor, SchemaNode documentationSchema) {

    public CompiledSchema {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(validationDescriptor, "validationDescriptor must not be null");
        Objects.requireNonNull(documentationSchema, "documentationSchema must not be null");
    }
}
