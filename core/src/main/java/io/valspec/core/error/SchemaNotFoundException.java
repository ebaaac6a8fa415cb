package io.valspec.core.error;

/** Thrown by a registry lookup for a name that was never compiled. */
public final class SchemaNotFoundException extends ValspecException {

    private static final long serialVersionUID = 1L;

    public SchemaNotFoundException(String message, String schemaName) {
        super(message, schemaName, Phase.LOOKUP);
    }
}
