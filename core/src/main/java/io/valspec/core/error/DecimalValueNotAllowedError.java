package io.valspec.core.error;

/** Thrown when a decimal field documents an arbitrary-precision value instead of a plain numeric literal. */
public final class DecimalValueNotAllowedError extends SchemaCompileException {

    private static final long serialVersionUID = 1L;

    public DecimalValueNotAllowedError(String message, String schemaName, String field) {
        super(message, schemaName, field);
    }

    public DecimalValueNotAllowedError(String message, Throwable cause, String schemaName, String field) {
        super(message, cause, schemaName, field);
    }
}
