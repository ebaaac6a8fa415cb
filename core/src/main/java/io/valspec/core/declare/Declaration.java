package io.valspec.core.declare;

import io.valspec.core.model.Requiredness;

/**
 * One entry of a declaration block. A closed set of variants; compile steps dispatch on {@link
 * #kind()} so that every variant is handled explicitly.
 */
public sealed interface Declaration
        permits Declaration.Required,
                Declaration.Optional,
                Declaration.PlainField,
                Declaration.EmbedsOne,
                Declaration.EmbedsMany {

    /** Declaration tags, as written in schema definition files. */
    enum Kind {
        REQUIRED("required"),
        OPTIONAL("optional"),
        PLAIN_FIELD("field"),
        EMBEDS_ONE("embeds_one"),
        EMBEDS_MANY("embeds_many");

        private final String tag;

        Kind(String tag) {
            this.tag = tag;
        }

        public String tag() {
            return tag;
        }

        /** Returns the kind for a tag, or null if the tag is unknown. */
        public static Kind fromTag(String tag) {
            for (Kind kind : values()) {
                if (kind.tag.equals(tag)) {
                    return kind;
                }
            }
            return null;
        }

        public boolean isEmbedding() {
            return this == EMBEDS_ONE || this == EMBEDS_MANY;
        }
    }

    /** The declared field name. */
    String name();

    Kind kind();

    /** A field that must be present; documented with {@code required: true}. */
    record Required(FieldSpec field) implements Declaration {
        @Override
        public String name() {
            return field.name();
        }

        @Override
        public Kind kind() {
            return Kind.REQUIRED;
        }
    }

    /** A field that may be absent. */
    record Optional(FieldSpec field) implements Declaration {
        @Override
        public String name() {
            return field.name();
        }

        @Override
        public Kind kind() {
            return Kind.OPTIONAL;
        }
    }

    /** A schema-only field; requiredness defaults to false. */
    record PlainField(FieldSpec field) implements Declaration {
        @Override
        public String name() {
            return field.name();
        }

        @Override
        public Kind kind() {
            return Kind.PLAIN_FIELD;
        }
    }

    /** Splices a compiled schema in as a nested object. */
    record EmbedsOne(String name, String schemaRef) implements Declaration {
        @Override
        public Kind kind() {
            return Kind.EMBEDS_ONE;
        }
    }

    /** Splices a compiled schema in as the item type of an array. */
    record EmbedsMany(String name, String schemaRef) implements Declaration {
        @Override
        public Kind kind() {
            return Kind.EMBEDS_MANY;
        }
    }

    /**
     * Returns the field payload of a field declaration, or null for embeddings.
     *
     * @param declaration any declaration
     * @return the payload of {@code Required}, {@code Optional} or {@code PlainField}
     */
    static FieldSpec fieldOf(Declaration declaration) {
        return switch (declaration.kind()) {
            case REQUIRED -> ((Required) declaration).field();
            case OPTIONAL -> ((Optional) declaration).field();
            case PLAIN_FIELD -> ((PlainField) declaration).field();
            case EMBEDS_ONE, EMBEDS_MANY -> null;
        };
    }

    /** The requiredness a field declaration of the given kind carries. */
    static Requiredness requirednessOf(Kind kind) {
        return switch (kind) {
            case REQUIRED -> Requiredness.REQUIRED;
            case OPTIONAL -> Requiredness.OPTIONAL;
            case PLAIN_FIELD, EMBEDS_ONE, EMBEDS_MANY -> Requiredness.PLAIN;
        };
    }
}
