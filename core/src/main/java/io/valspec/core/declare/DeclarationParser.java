package io.valspec.core.declare;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.valspec.core.error.MalformedDeclarationError;
import io.valspec.core.model.FieldType;
import io.valspec.core.model.SemanticType;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Normalizes raw declarations into the {@link Declaration} variant tree.
 *
 * <p>Raw declarations are a list of single-key entries, as read from a YAML or JSON schema file:
 *
 * <pre>
 * - required: [first_name, string, {example: Greg}]
 * - optional: [tags, array&lt;string&gt;]
 * - field: [address, object, {fields: [ {required: [city, string]} ]}]
 * - embeds_many: [users, user]
 * </pre>
 *
 * <p>Both this tree form and blocks built with {@link Declarations} pass through {@link
 * #normalize(String, List)}, which enforces the structural rules shared by every input shape.
 *
 * <p>Stateless and thread-safe.
 */
public final class DeclarationParser {

    /** Option key holding an inline nested declaration block. */
    public static final String FIELDS_OPTION = "fields";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * Parses a raw declaration list and normalizes the result.
     *
     * @param schemaName schema being declared, for error context
     * @param node       a JSON/YAML array of declaration entries
     * @return the normalized declaration block
     * @throws MalformedDeclarationError if any entry is malformed
     */
    public List<Declaration> parse(String schemaName, JsonNode node) {
        return normalize(schemaName, parseBlock(schemaName, node, ""));
    }

    /**
     * Checks a declaration block against the structural rules: non-blank unique names, a
     * declarable type, {@code values} on enums, inline blocks only on {@code object} and {@code
     * array<object>} (where the latter requires one), and a target for every embedding. Nested
     * blocks are checked recursively.
     *
     * @param schemaName   schema being declared, for error context
     * @param declarations the block to check
     * @return an immutable copy of the block
     * @throws MalformedDeclarationError on the first violated rule
     */
    public List<Declaration> normalize(String schemaName, List<Declaration> declarations) {
        checkBlock(schemaName, declarations, "");
        return List.copyOf(declarations);
    }

    private void checkBlock(String schemaName, List<Declaration> declarations, String prefix) {
        if (declarations == null) {
            throw new MalformedDeclarationError("Declaration block must not be null", schemaName, emptyToNull(prefix));
        }
        Set<String> seen = new HashSet<>();
        for (Declaration declaration : declarations) {
            if (declaration == null) {
                throw new MalformedDeclarationError(
                        "Declaration block contains a null entry", schemaName, emptyToNull(prefix));
            }
            String name = declaration.name();
            if (name == null || name.isBlank()) {
                throw new MalformedDeclarationError(
                        "Declaration '" + declaration.kind().tag() + "' is missing a field name",
                        schemaName,
                        emptyToNull(prefix));
            }
            String path = prefix + name;
            if (!seen.add(name)) {
                throw new MalformedDeclarationError("Duplicate field name '" + name + "'", schemaName, path);
            }
            if (declaration.kind().isEmbedding()) {
                checkEmbedding(schemaName, declaration, path);
            } else {
                checkField(schemaName, Declaration.fieldOf(declaration), path);
            }
        }
    }

    private void checkEmbedding(String schemaName, Declaration declaration, String path) {
        String ref = null;
        if (declaration instanceof Declaration.EmbedsOne one) {
            ref = one.schemaRef();
        } else if (declaration instanceof Declaration.EmbedsMany many) {
            ref = many.schemaRef();
        }
        if (ref == null || ref.isBlank()) {
            throw new MalformedDeclarationError(
                    "'" + declaration.kind().tag() + "' for field '" + declaration.name() + "' is missing a schema reference",
                    schemaName,
                    path);
        }
    }

    private void checkField(String schemaName, FieldSpec field, String path) {
        FieldType type = field.type();
        if (type == null) {
            throw new MalformedDeclarationError("Field '" + path + "' is missing a type", schemaName, path);
        }
        if (type.semanticType() == SemanticType.REFERENCE) {
            throw new MalformedDeclarationError(
                    "Field '" + path + "' cannot be declared as 'reference'; use embeds_one or embeds_many",
                    schemaName,
                    path);
        }
        if (field.hasInlineFields() && !type.acceptsInlineFields()) {
            throw new MalformedDeclarationError(
                    "Field '" + path + "' of type '" + type + "' cannot declare nested fields; only object and"
                            + " array<object> take an inline block",
                    schemaName,
                    path);
        }
        if (type.isArray() && type.subtype() == SemanticType.OBJECT && !field.hasInlineFields()) {
            throw new MalformedDeclarationError(
                    "Field '" + path + "' of type 'array<object>' requires an inline block of nested fields",
                    schemaName,
                    path);
        }
        if (type.semanticType() == SemanticType.ENUM && field.options().get("values") == null) {
            throw new MalformedDeclarationError(
                    "Enum field '" + path + "' requires a 'values' option", schemaName, path);
        }
        if (field.hasInlineFields()) {
            checkBlock(schemaName, field.fields(), path + ".");
        }
    }

    // --- Raw tree parsing ---

    private List<Declaration> parseBlock(String schemaName, JsonNode node, String prefix) {
        if (node == null || node.isNull() || !node.isArray()) {
            throw new MalformedDeclarationError(
                    "Declaration block must be a list, got: " + describe(node), schemaName, emptyToNull(prefix));
        }
        List<Declaration> declarations = new ArrayList<>();
        int index = 0;
        for (JsonNode entry : node) {
            declarations.add(parseEntry(schemaName, entry, prefix, index++));
        }
        return declarations;
    }

    private Declaration parseEntry(String schemaName, JsonNode entry, String prefix, int index) {
        String position = prefix + "[" + index + "]";
        if (!entry.isObject() || entry.size() != 1) {
            throw new MalformedDeclarationError(
                    "Declaration " + position + " must be a single-key entry such as"
                            + " '{required: [name, type]}', got: " + entry,
                    schemaName,
                    emptyToNull(prefix));
        }
        Map.Entry<String, JsonNode> only = entry.properties().iterator().next();
        Declaration.Kind kind = Declaration.Kind.fromTag(only.getKey());
        if (kind == null) {
            throw new MalformedDeclarationError(
                    "Unknown declaration tag '" + only.getKey() + "' at " + position
                            + "; expected one of: required, optional, field, embeds_one, embeds_many",
                    schemaName,
                    emptyToNull(prefix));
        }
        JsonNode args = only.getValue();
        if (!args.isArray()) {
            throw new MalformedDeclarationError(
                    "'" + kind.tag() + "' at " + position + " expects a positional list, got: " + args,
                    schemaName,
                    emptyToNull(prefix));
        }
        String name = requireName(schemaName, kind, args, position, prefix);
        return switch (kind) {
            case EMBEDS_ONE -> new Declaration.EmbedsOne(name, requireSchemaRef(schemaName, kind, args, prefix + name));
            case EMBEDS_MANY -> new Declaration.EmbedsMany(name, requireSchemaRef(schemaName, kind, args, prefix + name));
            case REQUIRED -> new Declaration.Required(parseField(schemaName, kind, name, args, prefix));
            case OPTIONAL -> new Declaration.Optional(parseField(schemaName, kind, name, args, prefix));
            case PLAIN_FIELD -> new Declaration.PlainField(parseField(schemaName, kind, name, args, prefix));
        };
    }

    private String requireName(String schemaName, Declaration.Kind kind, JsonNode args, String position, String prefix) {
        JsonNode nameNode = args.get(0);
        if (nameNode == null || !nameNode.isTextual() || nameNode.asText().isBlank()) {
            throw new MalformedDeclarationError(
                    "'" + kind.tag() + "' at " + position + " is missing a field name", schemaName, emptyToNull(prefix));
        }
        return nameNode.asText();
    }

    private String requireSchemaRef(String schemaName, Declaration.Kind kind, JsonNode args, String path) {
        if (args.size() != 2 || !args.get(1).isTextual()) {
            throw new MalformedDeclarationError(
                    "'" + kind.tag() + "' for field '" + path + "' expects [name, schemaReference], got: " + args,
                    schemaName,
                    path);
        }
        return args.get(1).asText();
    }

    private FieldSpec parseField(String schemaName, Declaration.Kind kind, String name, JsonNode args, String prefix) {
        String path = prefix + name;
        if (args.size() < 2 || args.size() > 3) {
            throw new MalformedDeclarationError(
                    "'" + kind.tag() + "' for field '" + path + "' expects [name, type, options?], got: " + args,
                    schemaName,
                    path);
        }
        FieldType type = parseType(schemaName, args.get(1), path);

        Map<String, Object> options = new LinkedHashMap<>();
        List<Declaration> fields = List.of();
        if (args.size() == 3) {
            JsonNode optionsNode = args.get(2);
            if (!optionsNode.isObject()) {
                throw new MalformedDeclarationError(
                        "Options for field '" + path + "' must be a map, got: " + optionsNode, schemaName, path);
            }
            for (Map.Entry<String, JsonNode> option : optionsNode.properties()) {
                if (FIELDS_OPTION.equals(option.getKey())) {
                    fields = parseBlock(schemaName, option.getValue(), path + ".");
                } else {
                    options.put(option.getKey(), MAPPER.convertValue(option.getValue(), Object.class));
                }
            }
        }
        return new FieldSpec(name, type, Declaration.requirednessOf(kind), options, fields);
    }

    private FieldType parseType(String schemaName, JsonNode typeNode, String path) {
        if (typeNode.isTextual()) {
            return FieldType.fromTag(typeNode.asText())
                    .orElseThrow(() -> new MalformedDeclarationError(
                            "Unrecognized type '" + typeNode.asText() + "' for field '" + path + "'", schemaName, path));
        }
        // {array: subtype}
        if (typeNode.isObject() && typeNode.size() == 1 && typeNode.has("array") && typeNode.get("array").isTextual()) {
            String subtype = typeNode.get("array").asText();
            return FieldType.itemType(subtype)
                    .map(FieldType::arrayOf)
                    .orElseThrow(() -> new MalformedDeclarationError(
                            "Unrecognized array item type '" + subtype + "' for field '" + path + "'", schemaName, path));
        }
        throw new MalformedDeclarationError(
                "Type of field '" + path + "' must be a type name or {array: type}, got: " + typeNode, schemaName, path);
    }

    private static String describe(JsonNode node) {
        return node == null ? "nothing" : node.getNodeType().toString().toLowerCase();
    }

    private static String emptyToNull(String prefix) {
        if (prefix.isEmpty()) {
            return null;
        }
        return prefix.endsWith(".") ? prefix.substring(0, prefix.length() - 1) : prefix;
    }
}
