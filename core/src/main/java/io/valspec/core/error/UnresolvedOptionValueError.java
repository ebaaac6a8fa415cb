package io.valspec.core.error;

/** Thrown when an option value is not a literal that can be resolved at compile time. */
public final class UnresolvedOptionValueError extends SchemaCompileException {

    private static final long serialVersionUID = 1L;

    public UnresolvedOptionValueError(String message, String schemaName, String field) {
        super(message, schemaName, field);
    }

    public UnresolvedOptionValueError(String message, Throwable cause, String schemaName, String field) {
        super(message, cause, schemaName, field);
    }
}
