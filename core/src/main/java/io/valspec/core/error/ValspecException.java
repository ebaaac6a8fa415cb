package io.valspec.core.error;

/**
 * Abstract base for all valspec exceptions. Never thrown directly; use the concrete subclasses
 * under {@link SchemaCompileException} or {@link SchemaNotFoundException}.
 */
public abstract class ValspecException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        COMPILE,
        LOOKUP
    }

    private final String schemaName;
    private final Phase phase;

    protected ValspecException(String message, String schemaName, Phase phase) {
        super(message);
        this.schemaName = schemaName;
        this.phase = phase;
    }

    protected ValspecException(String message, Throwable cause, String schemaName, Phase phase) {
        super(message, cause);
        this.schemaName = schemaName;
        this.phase = phase;
    }

    /** The schema that triggered the error, or {@code null} if not yet identified. */
    public String schemaName() {
        return schemaName;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
