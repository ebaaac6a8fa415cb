package io.valspec.core.error;

/** Thrown when an array declares an item type other than string, integer or object. */
public final class UnsupportedSubtypeError extends SchemaCompileException {

    private static final long serialVersionUID = 1L;

    public UnsupportedSubtypeError(String message, String schemaName, String field) {
        super(message, schemaName, field);
    }

    public UnsupportedSubtypeError(String message, Throwable cause, String schemaName, String field) {
        super(message, cause, schemaName, field);
    }
}
