package io.valspec.core.compile;

import io.valspec.core.declare.Declaration;
import io.valspec.core.error.UnknownSchemaReferenceError;
import io.valspec.core.model.CompiledSchema;
import io.valspec.core.model.FieldRule;
import io.valspec.core.model.SchemaNode;
import io.valspec.core.model.ValueType;
import java.util.Map;

/**
 * Splices previously compiled schemas into embedding positions. {@code embeds_one} places the
 * referenced documentation tree as-is; {@code embeds_many} wraps it as the item schema of an
 * array. The referenced schema must already be compiled: there are no forward references.
 */
final class NestedSchemaResolver {

    MappedField resolve(CompileContext ctx, Declaration declaration) {
        String path = ctx.path(declaration.name());
        return switch (declaration.kind()) {
            case EMBEDS_ONE -> embedOne(declaration.name(), lookup(ctx, ((Declaration.EmbedsOne) declaration).schemaRef(), path));
            case EMBEDS_MANY -> embedMany(declaration.name(), lookup(ctx, ((Declaration.EmbedsMany) declaration).schemaRef(), path));
            case REQUIRED, OPTIONAL, PLAIN_FIELD -> throw new IllegalArgumentException(
                    "Not an embedding declaration: " + declaration.kind());
        };
    }

    private MappedField embedOne(String name, CompiledSchema ref) {
        FieldRule rule = new FieldRule(name, ValueType.OBJECT, null, false, Map.of(), ref.validationDescriptor());
        return new MappedField(name, ref.documentationSchema(), rule);
    }

    private MappedField embedMany(String name, CompiledSchema ref) {
        SchemaNode node = SchemaNode.builder("array")
                .items(ref.documentationSchema())
                .required(false)
                .build();
        FieldRule rule =
                new FieldRule(name, ValueType.ARRAY, ValueType.OBJECT, false, Map.of(), ref.validationDescriptor());
        return new MappedField(name, node, rule);
    }

    private CompiledSchema lookup(CompileContext ctx, String ref, String path) {
        return ctx.lookup()
                .findCompiled(ref)
                .orElseThrow(() -> new UnknownSchemaReferenceError(
                        "Field '" + path + "' embeds schema '" + ref + "', which has not been compiled; embedded"
                                + " schemas must be compiled before the schemas that embed them",
                        ctx.schemaName(),
                        path));
    }
}
