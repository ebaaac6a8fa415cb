package io.valspec.core.model;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * The semantic types a field may be declared with. Each type has a canonical tag used in schema
 * definition files; a few legacy tags are accepted as aliases.
 */
public enum SemanticType {
    STRING("string"),
    INTEGER("integer"),
    NUMBER("number"),
    BOOLEAN("boolean"),
    UUID("uuid"),
    DATE("date"),
    DATETIME("datetime"),
    DECIMAL("decimal"),
    ENUM("enum"),
    ARRAY("array"),
    OBJECT("object"),
    /** Type carried by embedding declarations; never declared directly. */
    REFERENCE("reference");

    private static final Map<String, SemanticType> ALIASES = Map.of(
            "utc_datetime", DATETIME,
            "naive_datetime", DATETIME,
            "map", OBJECT,
            "float", NUMBER);

    private final String tag;

    SemanticType(String tag) {
        this.tag = tag;
    }

    /** The canonical lowercase tag, e.g. {@code "datetime"}. */
    public String tag() {
        return tag;
    }

    /**
     * Resolves a tag (canonical or alias, case-insensitive) to a semantic type.
     *
     * @param tag the tag as written in a declaration
     * @return the matching type, or empty if the tag is not recognized
     */
    public static Optional<SemanticType> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        SemanticType alias = ALIASES.get(normalized);
        if (alias != null) {
            return Optional.of(alias);
        }
        for (SemanticType type : values()) {
            if (type.tag.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
