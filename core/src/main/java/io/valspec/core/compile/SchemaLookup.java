package io.valspec.core.compile;

import io.valspec.core.model.CompiledSchema;
import java.util.Optional;

/** Read access to already compiled schemas, used to resolve embeddings. */
@FunctionalInterface
public interface SchemaLookup {

    /**
     * Finds a schema whose compilation has completed.
     *
     * @param name schema name
     * @return the compiled schema, or empty if it is unknown or still being compiled
     */
    Optional<CompiledSchema> findCompiled(String name);

    /** A lookup that knows no schemas. */
    static SchemaLookup none() {
        return name -> Optional.empty();
    }
}
