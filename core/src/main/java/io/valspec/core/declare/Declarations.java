package io.valspec.core.declare;

import io.valspec.core.error.MalformedDeclarationError;
import io.valspec.core.model.FieldType;
import io.valspec.core.model.Requiredness;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Java declaration surface, intended for static import:
 *
 * <pre>{@code
 * registry.compile("create_user", List.of(
 *         required("first_name", "string", Map.of("example", "Greg")),
 *         required("role", "enum", Map.of("values", List.of("admin", "normal"))),
 *         optional("age", FieldType.INTEGER, Map.of("minimum", 18)),
 *         embedsOne("address", "address")));
 * }</pre>
 *
 * <p>Structural checks (duplicate names, inline block rules, enum values) run when the block is
 * compiled, so a block built here fails the same way as one read from YAML.
 */
public final class Declarations {

    private Declarations() {
        // utility class
    }

    public static Declaration required(String name, FieldType type) {
        return required(name, type, Map.of());
    }

    public static Declaration required(String name, String typeTag) {
        return required(name, typeTag, Map.of());
    }

    public static Declaration required(String name, String typeTag, Map<String, ?> options) {
        return required(name, resolveTag(name, typeTag), options);
    }

    public static Declaration required(String name, FieldType type, Map<String, ?> options, Declaration... fields) {
        return new Declaration.Required(fieldSpec(name, type, Requiredness.REQUIRED, options, fields));
    }

    public static Declaration optional(String name, FieldType type) {
        return optional(name, type, Map.of());
    }

    public static Declaration optional(String name, String typeTag) {
        return optional(name, typeTag, Map.of());
    }

    public static Declaration optional(String name, String typeTag, Map<String, ?> options) {
        return optional(name, resolveTag(name, typeTag), options);
    }

    public static Declaration optional(String name, FieldType type, Map<String, ?> options, Declaration... fields) {
        return new Declaration.Optional(fieldSpec(name, type, Requiredness.OPTIONAL, options, fields));
    }

    public static Declaration field(String name, FieldType type) {
        return field(name, type, Map.of());
    }

    public static Declaration field(String name, String typeTag) {
        return field(name, typeTag, Map.of());
    }

    public static Declaration field(String name, String typeTag, Map<String, ?> options) {
        return field(name, resolveTag(name, typeTag), options);
    }

    public static Declaration field(String name, FieldType type, Map<String, ?> options, Declaration... fields) {
        return new Declaration.PlainField(fieldSpec(name, type, Requiredness.PLAIN, options, fields));
    }

    public static Declaration embedsOne(String name, String schemaRef) {
        return new Declaration.EmbedsOne(name, schemaRef);
    }

    public static Declaration embedsMany(String name, String schemaRef) {
        return new Declaration.EmbedsMany(name, schemaRef);
    }

    /** Groups declarations into a block. */
    public static List<Declaration> block(Declaration... declarations) {
        return List.of(declarations);
    }

    @SuppressWarnings("unchecked")
    private static FieldSpec fieldSpec(
            String name, FieldType type, Requiredness requiredness, Map<String, ?> options, Declaration[] fields) {
        return new FieldSpec(name, type, requiredness, (Map<String, Object>) options, Arrays.asList(fields));
    }

    private static FieldType resolveTag(String name, String typeTag) {
        return FieldType.fromTag(typeTag)
                .orElseThrow(() -> new MalformedDeclarationError(
                        "Unrecognized type '" + typeTag + "' for field '" + name + "'", null, name));
    }
}
