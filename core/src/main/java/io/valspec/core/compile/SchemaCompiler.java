package io.valspec.core.compile;

import io.valspec.core.config.CompilerConfig;
import io.valspec.core.declare.Declaration;
import io.valspec.core.declare.DeclarationParser;
import io.valspec.core.model.CompiledSchema;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles a declaration block into a {@link CompiledSchema}: parser normalization, type mapping,
 * embedding resolution, then assembly. Inline blocks recurse through the same steps and come back
 * as uniform object nodes.
 *
 * <p>Thread-safe: holds no per-compilation state.
 */
public final class SchemaCompiler {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaCompiler.class);

    private final CompilerConfig config;
    private final DeclarationParser parser = new DeclarationParser();
    private final TypeMapper typeMapper = new TypeMapper();
    private final NestedSchemaResolver resolver = new NestedSchemaResolver();
    private final SchemaAssembler assembler = new SchemaAssembler();

    public SchemaCompiler(CompilerConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    public SchemaCompiler() {
        this(CompilerConfig.defaults());
    }

    public CompilerConfig config() {
        return config;
    }

    /**
     * Compiles one named declaration block.
     *
     * @param name         schema name
     * @param declarations the block, in declaration order
     * @param lookup       already compiled schemas available for embedding
     * @return the compiled schema
     * @throws io.valspec.core.error.SchemaCompileException on any declaration defect
     */
    public CompiledSchema compile(String name, List<Declaration> declarations, SchemaLookup lookup) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(lookup, "lookup must not be null");
        List<Declaration> normalized = parser.normalize(name, declarations);
        CompiledBlock block = compileBlock(CompileContext.root(name, config, lookup), normalized);
        LOG.debug("Compiled declaration block: schema={}, fields={}", name, block.validation().fieldNames());
        return new CompiledSchema(name, block.validation(), block.documentation());
    }

    /** Compiles a single bare declaration; equivalent to a one-element block. */
    public CompiledSchema compile(String name, Declaration declaration, SchemaLookup lookup) {
        return compile(name, List.of(declaration), lookup);
    }

    private CompiledBlock compileBlock(CompileContext ctx, List<Declaration> declarations) {
        List<MappedField> fields = new ArrayList<>(declarations.size());
        for (Declaration declaration : declarations) {
            MappedField field = switch (declaration.kind()) {
                case EMBEDS_ONE, EMBEDS_MANY -> resolver.resolve(ctx, declaration);
                case REQUIRED, OPTIONAL, PLAIN_FIELD -> typeMapper.map(
                        ctx,
                        Declaration.fieldOf(declaration),
                        inline -> compileBlock(ctx.nested(declaration.name()), inline));
            };
            fields.add(field);
        }
        return assembler.assemble(fields);
    }
}
