package io.valspec.jsonschema;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.valspec.core.model.FieldRule;
import io.valspec.core.model.ValidationDescriptor;
import io.valspec.core.model.ValueType;
import java.util.Map;
import java.util.Set;

/**
 * Translates a {@link ValidationDescriptor} into a JSON Schema (draft 2020-12) document.
 *
 * <p>Constraint mapping: {@code included} becomes {@code enum}, {@code excluded} becomes {@code
 * not: {enum: [...]}}; numeric, length and item-count bounds and {@code pattern} are copied
 * as-is. {@code format} is copied for string-valued fields only. {@code default} is not a
 * validation keyword and is applied by the engine instead.
 *
 * <p>{@code datetime} fields are checked against {@link #DATE_TIME_PATTERN} rather than the
 * {@code date-time} format, which demands an offset: values without one, such as the built-in
 * documentation example, are accepted.
 */
final class ValidationSchemaTranslator {

    static final String DIALECT = "https://json-schema.org/draft/2020-12/schema";

    /** RFC 3339 date-time with optional fraction and optional offset. */
    static final String DATE_TIME_PATTERN = "^\\d{4}-(0[1-9]|1[0-2])-(0[1-9]|[12]\\d|3[01])"
            + "[Tt ]([01]\\d|2[0-3]):[0-5]\\d:([0-5]\\d|60)(\\.\\d+)?([Zz]|[+-]([01]\\d|2[0-3]):[0-5]\\d)?$";

    private static final Set<String> COPIED_KEYWORDS = Set.of(
            "minimum",
            "maximum",
            "exclusiveMinimum",
            "exclusiveMaximum",
            "pattern",
            "minLength",
            "maxLength",
            "minItems",
            "maxItems");

    private final ObjectMapper mapper;

    ValidationSchemaTranslator(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /** Root schema: a closed-world {@code object} listing every declared field. */
    ObjectNode translate(ValidationDescriptor descriptor) {
        ObjectNode root = objectSchema(descriptor);
        root.put("$schema", DIALECT);
        return root;
    }

    private ObjectNode objectSchema(ValidationDescriptor descriptor) {
        ObjectNode schema = mapper.createObjectNode();
        schema.put("type", "object");
        ObjectNode properties = schema.putObject("properties");
        ArrayNode required = mapper.createArrayNode();
        for (FieldRule rule : descriptor) {
            properties.set(rule.name(), fieldSchema(rule));
            if (rule.required()) {
                required.add(rule.name());
            }
        }
        if (!required.isEmpty()) {
            schema.set("required", required);
        }
        return schema;
    }

    private ObjectNode fieldSchema(FieldRule rule) {
        ObjectNode schema = valueSchema(rule.type(), rule.nested());
        if (rule.type() == ValueType.ARRAY) {
            ValueType itemType = rule.itemType() == null ? ValueType.STRING : rule.itemType();
            schema.set("items", valueSchema(itemType, rule.nested()));
        }
        applyConstraints(schema, rule);
        return schema;
    }

    private ObjectNode valueSchema(ValueType type, ValidationDescriptor nested) {
        if (type == ValueType.OBJECT && nested != null) {
            return objectSchema(nested);
        }
        ObjectNode schema = mapper.createObjectNode();
        switch (type) {
            case STRING -> schema.put("type", "string");
            case INTEGER -> schema.put("type", "integer");
            case NUMBER, DECIMAL -> schema.put("type", "number");
            case BOOLEAN -> schema.put("type", "boolean");
            case DATE -> schema.put("type", "string").put("format", "date");
            case DATETIME -> schema.put("type", "string").put("pattern", DATE_TIME_PATTERN);
            case OBJECT -> schema.put("type", "object");
            case ARRAY -> schema.put("type", "array");
        }
        return schema;
    }

    private void applyConstraints(ObjectNode schema, FieldRule rule) {
        for (Map.Entry<String, Object> constraint : rule.constraints().entrySet()) {
            String key = constraint.getKey();
            Object value = constraint.getValue();
            if ("pattern".equals(key) && schema.has("pattern")) {
                schema.withArrayProperty("allOf").addObject().put("pattern", String.valueOf(value));
            } else if (COPIED_KEYWORDS.contains(key)) {
                schema.set(key, mapper.valueToTree(value));
            } else if ("included".equals(key)) {
                schema.set("enum", mapper.valueToTree(value));
            } else if ("excluded".equals(key)) {
                schema.putObject("not").set("enum", mapper.valueToTree(value));
            } else if ("format".equals(key) && rule.type() == ValueType.STRING) {
                schema.put("format", String.valueOf(value));
            }
        }
    }
}
