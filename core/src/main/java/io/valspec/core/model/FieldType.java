package io.valspec.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * A declared field type: a {@link SemanticType} plus, for arrays, the item subtype.
 *
 * <p>Tags are written either as a plain type name ({@code "uuid"}) or as an array form ({@code
 * "array<string>"}). Subtype restrictions are not checked here; the type mapper rejects item
 * types it cannot document.
 *
 * @param semanticType the declared type, never null
 * @param subtype      the array item type, or {@code null} for non-array types
 */
public record FieldType(SemanticType semanticType, SemanticType subtype) {

    public static final FieldType STRING = of(SemanticType.STRING);
    public static final FieldType INTEGER = of(SemanticType.INTEGER);
    public static final FieldType NUMBER = of(SemanticType.NUMBER);
    public static final FieldType BOOLEAN = of(SemanticType.BOOLEAN);
    public static final FieldType UUID = of(SemanticType.UUID);
    public static final FieldType DATE = of(SemanticType.DATE);
    public static final FieldType DATETIME = of(SemanticType.DATETIME);
    public static final FieldType DECIMAL = of(SemanticType.DECIMAL);
    public static final FieldType ENUM = of(SemanticType.ENUM);
    public static final FieldType OBJECT = of(SemanticType.OBJECT);

    public FieldType {
        Objects.requireNonNull(semanticType, "semanticType must not be null");
        if (semanticType == SemanticType.ARRAY && subtype == null) {
            throw new IllegalArgumentException("array type requires a subtype");
        }
        if (semanticType != SemanticType.ARRAY && subtype != null) {
            throw new IllegalArgumentException("only array types carry a subtype");
        }
    }

    /** A non-array type. */
    public static FieldType of(SemanticType semanticType) {
        return new FieldType(semanticType, null);
    }

    /** An array whose items have the given type. */
    public static FieldType arrayOf(SemanticType subtype) {
        return new FieldType(SemanticType.ARRAY, Objects.requireNonNull(subtype, "subtype must not be null"));
    }

    public boolean isArray() {
        return semanticType == SemanticType.ARRAY;
    }

    /** True for {@code object} and {@code array<object>}, the only types that take an inline block. */
    public boolean acceptsInlineFields() {
        return semanticType == SemanticType.OBJECT || (isArray() && subtype == SemanticType.OBJECT);
    }

    /**
     * Parses a type tag such as {@code "integer"}, {@code "utc_datetime"} or {@code
     * "array<string>"}. The {@code reference} tag and nested arrays are not declarable and parse to
     * empty.
     *
     * @param tag the tag as written in a declaration
     * @return the parsed type, or empty if the tag is not recognized
     */
    public static Optional<FieldType> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        String trimmed = tag.trim();
        int open = trimmed.indexOf('<');
        if (open >= 0) {
            if (!trimmed.endsWith(">")) {
                return Optional.empty();
            }
            Optional<SemanticType> outer = SemanticType.fromTag(trimmed.substring(0, open));
            if (outer.isEmpty() || outer.get() != SemanticType.ARRAY) {
                return Optional.empty();
            }
            return itemType(trimmed.substring(open + 1, trimmed.length() - 1)).map(FieldType::arrayOf);
        }
        return SemanticType.fromTag(trimmed)
                .filter(type -> type != SemanticType.ARRAY && type != SemanticType.REFERENCE)
                .map(FieldType::of);
    }

    /**
     * Resolves an array item tag. Any declarable non-array type is accepted here.
     *
     * @param tag the item tag
     * @return the item type, or empty if not declarable as an item
     */
    public static Optional<SemanticType> itemType(String tag) {
        return SemanticType.fromTag(tag).filter(type -> type != SemanticType.ARRAY && type != SemanticType.REFERENCE);
    }

    /** The canonical tag, e.g. {@code "array<string>"}. */
    public String tag() {
        return isArray() ? "array<" + subtype.tag() + ">" : semanticType.tag();
    }

    @Override
    public String toString() {
        return tag();
    }
}
