package io.valspec.core.definition;

import io.valspec.core.declare.Declaration;
import java.util.List;
import java.util.Objects;

/**
 * A named declaration block read from a schema definition file.
 *
 * @param name         schema name
 * @param description  free-text description, or null
 * @param declarations normalized declaration block
 * @param source       file the definition was read from
 */
public record SchemaDefinition(String name, String description, List<Declaration> declarations, String source) {

    public SchemaDefinition {
        Objects.requireNonNull(name, "name must not be null");
        declarations = List.copyOf(declarations);
    }
}
