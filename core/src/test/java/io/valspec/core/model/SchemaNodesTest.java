package io.valspec.core.model;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests for the JSON rendering of documentation nodes. */
class SchemaNodesTest {

    @Test
    void requiredIsAlwaysWritten() {
        ObjectNode json = SchemaNodes.toJson(SchemaNode.builder("string").build());

        assertThat(json.get("required").isBoolean()).isTrue();
        assertThat(json.get("required").booleanValue()).isFalse();
    }

    @Test
    void keysFollowFixedOrder() {
        SchemaNode node = SchemaNode.builder("string")
                .keyword("nullable", true)
                .description("role of the user")
                .enumValues(List.of("admin", "normal"))
                .required(true)
                .build();

        List<String> keys = List.copyOf(iterable(SchemaNodes.toJson(node)));

        assertThat(keys).containsExactly("type", "enum", "required", "description", "nullable");
    }

    @Test
    void rendersNestedPropertiesAndItems() {
        SchemaNode user = SchemaNode.object(Map.of("name", SchemaNode.builder("string").build()));
        SchemaNode list = SchemaNode.object(
                Map.of("data", SchemaNode.builder("array").items(user).build()));

        JsonNode json = SchemaNodes.toJson(list);

        assertThat(json.at("/properties/data/type").asText()).isEqualTo("array");
        assertThat(json.at("/properties/data/items/properties/name/type").asText()).isEqualTo("string");
    }

    @Test
    void examplesKeepTheirLiteralType() {
        SchemaNode node = SchemaNode.builder("integer").example(42).keyword("minimum", 18).build();

        JsonNode json = SchemaNodes.toJson(node);

        assertThat(json.get("example").isInt()).isTrue();
        assertThat(json.get("minimum").intValue()).isEqualTo(18);
    }

    @Test
    void jsonStringIsParseable() {
        String text = SchemaNodes.toJsonString(SchemaNode.builder("boolean").required(true).build());

        assertThat(text).contains("\"type\" : \"boolean\"").contains("\"required\" : true");
    }

    private static List<String> iterable(ObjectNode node) {
        List<String> keys = new java.util.ArrayList<>();
        node.fieldNames().forEachRemaining(keys::add);
        return keys;
    }
}
