package io.valspec.core.error;

/**
 * Abstract parent for compile-time configuration errors. Thrown while a declaration block is
 * compiled into a {@code CompiledSchema}, always during application startup and never while
 * serving requests. Carries the offending field name when one is known.
 */
public abstract class SchemaCompileException extends ValspecException {

    private static final long serialVersionUID = 1L;

    private final String field;

    protected SchemaCompileException(String message, String schemaName, String field) {
        super(message, schemaName, Phase.COMPILE);
        this.field = field;
    }

    protected SchemaCompileException(String message, Throwable cause, String schemaName, String field) {
        super(message, cause, schemaName, Phase.COMPILE);
        this.field = field;
    }

    /** The declared field that caused the error, or {@code null} for block-level errors. */
    public String field() {
        return field;
    }
}
