package io.valspec.core.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.UncheckedIOException;
import java.util.Map;

/**
 * Renders {@link SchemaNode} trees as Jackson JSON trees. Keys are written in a fixed order:
 * {@code type, format, enum, items, properties, required, example, description}, then the
 * remaining keywords in insertion order.
 */
public final class SchemaNodes {

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private SchemaNodes() {
        // utility class
    }

    public static ObjectNode toJson(SchemaNode node) {
        ObjectNode json = MAPPER.createObjectNode();
        json.put("type", node.type());
        if (node.format() != null) {
            json.put("format", node.format());
        }
        if (node.enumValues() != null) {
            ArrayNode values = json.putArray("enum");
            node.enumValues().forEach(values::add);
        }
        if (node.items() != null) {
            json.set("items", toJson(node.items()));
        }
        if (node.properties() != null) {
            ObjectNode properties = json.putObject("properties");
            for (Map.Entry<String, SchemaNode> entry : node.properties().entrySet()) {
                properties.set(entry.getKey(), toJson(entry.getValue()));
            }
        }
        json.put("required", node.required());
        if (node.example() != null) {
            json.set("example", MAPPER.valueToTree(node.example()));
        }
        if (node.description() != null) {
            json.put("description", node.description());
        }
        for (Map.Entry<String, Object> keyword : node.keywords().entrySet()) {
            json.set(keyword.getKey(), MAPPER.valueToTree(keyword.getValue()));
        }
        return json;
    }

    /** Pretty-printed JSON text of the node. */
    public static String toJsonString(SchemaNode node) {
        try {
            return MAPPER.writeValueAsString(toJson(node));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize schema node", e);
        }
    }
}
