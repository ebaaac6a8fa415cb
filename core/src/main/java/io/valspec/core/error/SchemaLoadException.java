package io.valspec.core.error;

/**
 * Thrown when a schema definition file cannot be read or does not have the expected structure.
 * Carries an additional {@code source} field identifying the file that caused the error.
 */
public final class SchemaLoadException extends SchemaCompileException {

    private static final long serialVersionUID = 1L;

    private final String source;

    public SchemaLoadException(String message, String schemaName, String source) {
        super(message, schemaName, null);
        this.source = source;
    }

    public SchemaLoadException(String message, Throwable cause, String schemaName, String source) {
        super(message, cause, schemaName, null);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error. */
    public String source() {
        return source;
    }
}
