package io.valspec.core.registry;

/** Lifecycle of one named schema in a {@link CompiledSchemaRegistry}. */
public enum SchemaState {
    /** Name is known, nothing compiled yet (or the last compilation failed). */
    DECLARED,
    /** Compilation in progress; the name cannot be embedded. */
    COMPILING,
    COMPILED
}
