package io.valspec.core.error;

/** Thrown when a declaration is missing positional parts, has an unknown tag or type, or breaks a structural rule. */
public final class MalformedDeclarationError extends SchemaCompileException {

    private static final long serialVersionUID = 1L;

    public MalformedDeclarationError(String message, String schemaName, String field) {
        super(message, schemaName, field);
    }

    public MalformedDeclarationError(String message, Throwable cause, String schemaName, String field) {
        super(message, cause, schemaName, field);
    }
}
