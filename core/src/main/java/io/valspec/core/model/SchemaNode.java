package io.valspec.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One node of a documentation schema tree (JSON Schema / OpenAPI compatible). Immutable,
 * thread-safe, compared structurally.
 *
 * <p>{@code required} is a per-node boolean that is always present; it is never hoisted into a
 * list on the parent. Keywords without a dedicated component ({@code minimum}, {@code nullable},
 * {@code default}, ...) live in {@link #keywords()} in insertion order.
 *
 * @param type        JSON Schema type name ({@code string}, {@code integer}, {@code number},
 *                    {@code boolean}, {@code array}, {@code object})
 * @param format      format annotation, or null
 * @param enumValues  allowed values (always strings), or null
 * @param items       item schema for arrays, or null
 * @param properties  ordered property schemas for objects with declared fields, or null
 * @param required    whether the field this node describes is required
 * @param example     example literal, or null
 * @param description human-readable description, or null
 * @param keywords    further JSON Schema keywords, never null
 */
public record SchemaNode(
        String type,
        String format,
        List<String> enumValues,
        SchemaNode items,
        Map<String, SchemaNode> properties,
        boolean required,
        Object example,
        String description,
        Map<String, Object> keywords) {

    public SchemaNode {
        Objects.requireNonNull(type, "type must not be null");
        enumValues = enumValues == null ? null : List.copyOf(enumValues);
        properties = properties == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        keywords = keywords == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(keywords));
    }

    /** True if this node declares its own {@code properties}. */
    public boolean hasProperties() {
        return properties != null;
    }

    /** Copy of this node with a different {@code required} flag. */
    public SchemaNode withRequired(boolean required) {
        return toBuilder().required(required).build();
    }

    public Builder toBuilder() {
        Builder builder = new Builder(type)
                .format(format)
                .items(items)
                .required(required)
                .example(example)
                .description(description);
        builder.enumValues = enumValues == null ? null : new ArrayList<>(enumValues);
        builder.properties = properties == null ? null : new LinkedHashMap<>(properties);
        builder.keywords.putAll(keywords);
        return builder;
    }

    /** Starts a node of the given JSON Schema type. */
    public static Builder builder(String type) {
        return new Builder(type);
    }

    /** An {@code object} node holding the given properties, not required. */
    public static SchemaNode object(Map<String, SchemaNode> properties) {
        return builder("object").properties(properties).build();
    }

    /** Builder for {@link SchemaNode}. */
    public static final class Builder {

        private final String type;
        private String format;
        private List<String> enumValues;
        private SchemaNode items;
        private Map<String, SchemaNode> properties;
        private boolean required;
        private Object example;
        private String description;
        private final Map<String, Object> keywords = new LinkedHashMap<>();

        Builder(String type) {
            this.type = type;
        }

        public Builder format(String format) {
            this.format = format;
            return this;
        }

        public Builder enumValues(List<String> enumValues) {
            this.enumValues = enumValues == null ? null : new ArrayList<>(enumValues);
            return this;
        }

        public Builder items(SchemaNode items) {
            this.items = items;
            return this;
        }

        public Builder properties(Map<String, SchemaNode> properties) {
            this.properties = properties == null ? null : new LinkedHashMap<>(properties);
            return this;
        }

        public Builder required(boolean required) {
            this.required = required;
            return this;
        }

        public Builder example(Object example) {
            this.example = example;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder keyword(String name, Object value) {
            keywords.put(name, value);
            return this;
        }

        public SchemaNode build() {
            return new SchemaNode(type, format, enumValues, items, properties, required, example, description, keywords);
        }
    }
}
