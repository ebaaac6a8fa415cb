package io.valspec.core.registry;

import io.valspec.core.compile.SchemaCompiler;
import io.valspec.core.compile.SchemaLookup;
import io.valspec.core.declare.Declaration;
import io.valspec.core.error.SchemaNotFoundException;
import io.valspec.core.model.CompiledSchema;
import io.valspec.core.model.SchemaNode;
import io.valspec.core.model.ValidationDescriptor;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds every compiled schema by name and serves lookups to embedding schemas and to the
 * documentation and validation layers.
 *
 * <p>Lifecycle: schemas are compiled once at startup, strictly in dependency order (embedded
 * schemas first), then the registry is {@link #freeze() frozen}. Compiling a name that already
 * exists replaces the previous entry (last write wins).
 *
 * <p>Thread-safety: the build phase is single-threaded. After {@link #freeze()} the registry holds
 * an unmodifiable snapshot and is safe for any number of concurrent readers.
 */
public final class CompiledSchemaRegistry implements SchemaLookup {

    private static final Logger LOG = LoggerFactory.getLogger(CompiledSchemaRegistry.class);

    private final SchemaCompiler compiler;
    private final Map<String, CompiledSchema> schemas = new LinkedHashMap<>();
    private final Map<String, SchemaState> states = new LinkedHashMap<>();
    private volatile Map<String, CompiledSchema> frozen;

    /**
     * Creates an empty registry compiling with the given compiler.
     *
     * @param compiler the schema compiler
     */
    public CompiledSchemaRegistry(SchemaCompiler compiler) {
        this.compiler = Objects.requireNonNull(compiler, "compiler must not be null");
    }

    /** Creates an empty registry with default compiler settings. */
    public CompiledSchemaRegistry() {
        this(new SchemaCompiler());
    }

    /**
     * Registers a name ahead of its compilation. Has no effect on a name that is already known.
     *
     * @param name schema name
     * @throws IllegalStateException if the registry is frozen
     */
    public void declare(String name) {
        requireBuildPhase(name);
        states.putIfAbsent(Objects.requireNonNull(name, "name must not be null"), SchemaState.DECLARED);
    }

    /**
     * Compiles a declaration block and stores it under {@code name}, replacing any previous entry.
     * Embeddings resolve against the schemas already compiled in this registry.
     *
     * @param name         schema name
     * @param declarations declaration block, in order
     * @return the compiled schema
     * @throws io.valspec.core.error.SchemaCompileException if the block does not compile; the
     *     previous entry, if any, is kept
     * @throws IllegalStateException if the registry is frozen
     */
    public CompiledSchema compile(String name, List<Declaration> declarations) {
        requireBuildPhase(name);
        Objects.requireNonNull(name, "name must not be null");
        SchemaState previous = states.get(name);
        states.put(name, SchemaState.COMPILING);
        CompiledSchema compiled;
        try {
            compiled = compiler.compile(name, declarations, this);
        } catch (RuntimeException e) {
            if (previous == null) {
                states.remove(name);
            } else {
                states.put(name, previous);
            }
            throw e;
        }
        if (schemas.put(name, compiled) != null) {
            LOG.warn("Replaced previously compiled schema: name={}", name);
        }
        states.put(name, SchemaState.COMPILED);
        LOG.info("Compiled schema: name={}, fields={}", name, compiled.validationDescriptor().size());
        return compiled;
    }

    /** Compiles a single bare declaration; same result as a one-element block. */
    public CompiledSchema compile(String name, Declaration declaration) {
        return compile(name, List.of(declaration));
    }

    /**
     * Looks up a compiled schema.
     *
     * @param name schema name
     * @return the compiled schema
     * @throws SchemaNotFoundException if no schema has been compiled under that name
     */
    public CompiledSchema lookup(String name) {
        return find(name)
                .orElseThrow(() -> new SchemaNotFoundException("No compiled schema named '" + name + "'", name));
    }

    /**
     * Finds a compiled schema.
     *
     * @param name schema name
     * @return the schema, or empty if none has been compiled under that name
     */
    public Optional<CompiledSchema> find(String name) {
        return Optional.ofNullable(view().get(name));
    }

    /** Excludes a schema that is being recompiled, so a block cannot embed itself. */
    @Override
    public Optional<CompiledSchema> findCompiled(String name) {
        if (states.get(name) == SchemaState.COMPILING) {
            return Optional.empty();
        }
        return find(name);
    }

    /** The documentation tree of a compiled schema. */
    public SchemaNode documentationOf(CompiledSchema schema) {
        return schema.documentationSchema();
    }

    /** The descriptor handed to the validation engine. */
    public ValidationDescriptor validationDescriptorOf(CompiledSchema schema) {
        return schema.validationDescriptor();
    }

    /**
     * Lifecycle state of a name.
     *
     * @param name schema name
     * @return the state, or null if the name was never declared or compiled
     */
    public SchemaState stateOf(String name) {
        return states.get(name);
    }

    /**
     * Ends the build phase. Later {@link #compile} and {@link #declare} calls fail; reads are
     * unaffected. Calling it again has no effect.
     *
     * @return this registry
     */
    public CompiledSchemaRegistry freeze() {
        if (frozen == null) {
            frozen = Collections.unmodifiableMap(new LinkedHashMap<>(schemas));
            LOG.info("Schema registry frozen: schemas={}", frozen.keySet());
        }
        return this;
    }

    public boolean isFrozen() {
        return frozen != null;
    }

    /** Names of all compiled schemas, in first-compilation order. */
    public Set<String> names() {
        return Collections.unmodifiableSet(view().keySet());
    }

    public int size() {
        return view().size();
    }

    private Map<String, CompiledSchema> view() {
        Map<String, CompiledSchema> snapshot = frozen;
        return snapshot != null ? snapshot : schemas;
    }

    private void requireBuildPhase(String name) {
        if (frozen != null) {
            throw new IllegalStateException("Schema registry is frozen; cannot compile or declare '" + name + "'");
        }
    }
}
