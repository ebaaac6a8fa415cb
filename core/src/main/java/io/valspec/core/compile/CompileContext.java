package io.valspec.core.compile;

import io.valspec.core.config.CompilerConfig;

/**
 * State threaded through one compilation pass: the schema being compiled, compiler settings, the
 * embedding lookup and the dotted path of the enclosing inline block.
 */
record CompileContext(String schemaName, CompilerConfig config, SchemaLookup lookup, String pathPrefix) {

    static CompileContext root(String schemaName, CompilerConfig config, SchemaLookup lookup) {
        return new CompileContext(schemaName, config, lookup, "");
    }

    /** Dotted path of a field in this block, e.g. {@code items.id}. */
    String path(String fieldName) {
        return pathPrefix + fieldName;
    }

    /** Context for the inline block of the given field. */
    CompileContext nested(String fieldName) {
        return new CompileContext(schemaName, config, lookup, path(fieldName) + ".");
    }
}
