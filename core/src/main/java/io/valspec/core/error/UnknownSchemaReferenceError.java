package io.valspec.core.error;

/** Thrown when an embedding refers to a schema that has not been compiled yet. */
public final class UnknownSchemaReferenceError extends SchemaCompileException {

    private static final long serialVersionUID = 1L;

    public UnknownSchemaReferenceError(String message, String schemaName, String field) {
        super(message, schemaName, field);
    }

    public UnknownSchemaReferenceError(String message, Throwable cause, String schemaName, String field) {
        super(message, cause, schemaName, field);
    }
}
