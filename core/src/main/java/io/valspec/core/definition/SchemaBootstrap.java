package io.valspec.core.definition;

import io.valspec.core.compile.SchemaCompiler;
import io.valspec.core.config.ValspecConfig;
import io.valspec.core.registry.CompiledSchemaRegistry;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the application's schema registry at startup: reads every configured schema file in
 * the configured order and compiles each one. The first failure aborts the whole run; a half-built
 * registry is never returned.
 *
 * <p>{@link #load()} leaves the registry open so request schemas that embed the loaded ones can
 * still be compiled into it; the caller freezes it once binding is done. {@link #run()} loads and
 * freezes in one step.
 */
public final class SchemaBootstrap {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaBootstrap.class);

    private final ValspecConfig config;
    private final SchemaFileParser fileParser;

    public SchemaBootstrap(ValspecConfig config, SchemaFileParser fileParser) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.fileParser = Objects.requireNonNull(fileParser, "fileParser must not be null");
    }

    public SchemaBootstrap(ValspecConfig config) {
        this(config, new SchemaFileParser());
    }

    /**
     * Loads and compiles every configured file without freezing.
     *
     * @return an open registry holding every configured schema
     * @throws io.valspec.core.error.SchemaCompileException on the first file that fails
     */
    public CompiledSchemaRegistry load() {
        CompiledSchemaRegistry registry = new CompiledSchemaRegistry(new SchemaCompiler(config.compiler()));
        List<SchemaDefinition> definitions = new ArrayList<>();
        for (Path file : schemaPaths()) {
            SchemaDefinition definition = fileParser.parse(file);
            registry.declare(definition.name());
            definitions.add(definition);
        }
        for (SchemaDefinition definition : definitions) {
            LOG.debug("Compiling schema definition: name={}, source={}", definition.name(), definition.source());
            registry.compile(definition.name(), definition.declarations());
        }
        LOG.info("Schema bootstrap complete: schemas={}, dir={}", registry.size(), config.schemasDir());
        return registry;
    }

    /**
     * Loads, compiles and freezes.
     *
     * @return a frozen registry holding every configured schema
     * @throws io.valspec.core.error.SchemaCompileException on the first file that fails
     */
    public CompiledSchemaRegistry run() {
        return load().freeze();
    }

    /** Configured schema files, resolved against the schemas directory, in compile order. */
    public List<Path> schemaPaths() {
        Path dir = Path.of(config.schemasDir());
        List<Path> paths = new ArrayList<>();
        for (String file : config.schemaFiles()) {
            Path path = Path.of(file);
            paths.add(path.isAbsolute() ? path : dir.resolve(path));
        }
        return paths;
    }
}
