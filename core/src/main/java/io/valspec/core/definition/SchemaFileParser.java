package io.valspec.core.definition;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.valspec.core.declare.Declaration;
import io.valspec.core.declare.DeclarationParser;
import io.valspec.core.error.SchemaLoadException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/**
 * Parses YAML schema definition files into {@link SchemaDefinition}s.
 *
 * <pre>
 * name: user
 * description: A user as returned by the API
 * fields:
 *   - field: [first_name, string]
 *   - field: [age, integer, {minimum: 0}]
 * </pre>
 *
 * <p>Thread-safe.
 */
public final class SchemaFileParser {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /** Recognized top-level keys; anything else is rejected. */
    private static final Set<String> KNOWN_ROOT_KEYS = Set.of("name", "description", "fields");

    private final DeclarationParser declarationParser;

    public SchemaFileParser(DeclarationParser declarationParser) {
        this.declarationParser = Objects.requireNonNull(declarationParser, "declarationParser must not be null");
    }

    public SchemaFileParser() {
        this(new DeclarationParser());
    }

    /**
     * Parses the YAML file at the given path.
     *
     * @param path path to the schema definition file
     * @return the parsed definition
     * @throws SchemaLoadException if the file is unreadable or its root structure is invalid
     * @throws io.valspec.core.error.MalformedDeclarationError if a declaration is malformed
     */
    public SchemaDefinition parse(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        String source = path.toString();
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(path.toFile());
        } catch (IOException e) {
            throw new SchemaLoadException("Failed to read or parse YAML: " + e.getMessage(), e, null, source);
        }
        return parse(root, source);
    }

    /**
     * Parses an already loaded YAML/JSON tree.
     *
     * @param root   the document root
     * @param source identifier of the document, for error context
     * @return the parsed definition
     */
    public SchemaDefinition parse(JsonNode root, String source) {
        if (root == null || !root.isObject()) {
            throw new SchemaLoadException("Schema definition must be a YAML map", null, source);
        }
        JsonNode nameNode = root.get("name");
        if (nameNode == null || !nameNode.isTextual() || nameNode.asText().isBlank()) {
            throw new SchemaLoadException("Missing or invalid required field: 'name'", null, source);
        }
        String name = nameNode.asText();

        List<String> unknown = StreamSupport.stream(((Iterable<String>) root::fieldNames).spliterator(), false)
                .filter(key -> !KNOWN_ROOT_KEYS.contains(key))
                .collect(Collectors.toList());
        if (!unknown.isEmpty()) {
            throw new SchemaLoadException(
                    "Unknown key" + (unknown.size() > 1 ? "s" : "") + " in schema definition: " + unknown
                            + "; recognized keys are: " + KNOWN_ROOT_KEYS,
                    name,
                    source);
        }

        JsonNode fields = root.get("fields");
        if (fields == null || fields.isNull()) {
            throw new SchemaLoadException("Missing required field: 'fields'", name, source);
        }
        JsonNode description = root.get("description");
        List<Declaration> declarations = declarationParser.parse(name, fields);
        return new SchemaDefinition(
                name, description != null && !description.isNull() ? description.asText() : null, declarations, source);
    }
}
