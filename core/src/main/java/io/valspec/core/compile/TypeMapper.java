package io.valspec.core.compile;

import io.valspec.core.declare.Declaration;
import io.valspec.core.declare.FieldSpec;
import io.valspec.core.error.DecimalValueNotAllowedError;
import io.valspec.core.error.MalformedDeclarationError;
import io.valspec.core.error.UnsupportedSubtypeError;
import io.valspec.core.model.FieldRule;
import io.valspec.core.model.FieldType;
import io.valspec.core.model.SchemaNode;
import io.valspec.core.model.SemanticType;
import io.valspec.core.model.ValidationDescriptor;
import io.valspec.core.model.ValueType;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps one field declaration to its documentation node and its validation rule.
 *
 * <p>Options are merged before mapping (highest precedence first): explicit field options,
 * configured type defaults, built-in type defaults. Keys the mapping forces ({@code type}, the
 * format of {@code uuid}/{@code date}/{@code datetime}/{@code decimal}, {@code enum}, {@code
 * items}, {@code properties}, {@code required}) override all of them.
 *
 * <p>Stateless and thread-safe.
 */
final class TypeMapper {

    private static final Logger LOG = LoggerFactory.getLogger(TypeMapper.class);

    private static final Set<SemanticType> ARRAY_ITEM_TYPES =
            Set.of(SemanticType.STRING, SemanticType.INTEGER, SemanticType.OBJECT);

    private static final Set<String> DECIMAL_CHECKED_KEYS = Set.of("example", "minimum", "maximum");

    /**
     * Maps a field.
     *
     * @param ctx         compilation context
     * @param field       the field payload
     * @param inlineBlock compiles the inline block of {@code object} and {@code array<object>} fields
     * @return the mapped field
     */
    MappedField map(CompileContext ctx, FieldSpec field, Function<List<Declaration>, CompiledBlock> inlineBlock) {
        String path = ctx.path(field.name());
        FieldType type = field.type();
        Map<String, Object> options = mergeOptions(ctx, field, path);
        boolean required = field.requiredness().isRequired();

        return switch (type.semanticType()) {
            case STRING -> options.containsKey("included")
                    ? mapEnum(ctx, field, path, options, "included", required)
                    : mapScalar(field, "string", ValueType.STRING, options, required);
            case INTEGER -> mapScalar(field, "integer", ValueType.INTEGER, options, required);
            case NUMBER -> mapScalar(field, "number", ValueType.NUMBER, options, required);
            case BOOLEAN -> mapScalar(field, "boolean", ValueType.BOOLEAN, options, required);
            case UUID -> mapFormatted(field, "uuid", ValueType.STRING, options, required);
            case DATE -> mapDated(field, "date", ValueType.DATE, options, required);
            case DATETIME -> mapDated(field, "date-time", ValueType.DATETIME, options, required);
            case DECIMAL -> mapDecimal(ctx, field, path, options, required);
            case ENUM -> mapEnum(ctx, field, path, options, "values", required);
            case ARRAY -> mapArray(ctx, field, path, options, required, inlineBlock);
            case OBJECT -> mapObject(field, options, required, inlineBlock);
            case REFERENCE -> throw new MalformedDeclarationError(
                    "Field '" + path + "' cannot be declared as 'reference'", ctx.schemaName(), path);
        };
    }

    // --- Option merging ---

    private Map<String, Object> mergeOptions(CompileContext ctx, FieldSpec field, String path) {
        Map<String, Object> merged = new LinkedHashMap<>();
        SemanticType semanticType = field.type().semanticType();
        if (semanticType == SemanticType.DATE) {
            merged.put("example", ctx.config().dateExample());
        } else if (semanticType == SemanticType.DATETIME) {
            merged.put("example", ctx.config().dateTimeExample());
        }
        putResolved(ctx, merged, ctx.config().defaultsFor(semanticType), path);
        putResolved(ctx, merged, field.options(), path);
        return merged;
    }

    private void putResolved(CompileContext ctx, Map<String, Object> target, Map<String, Object> source, String path) {
        for (Map.Entry<String, Object> option : source.entrySet()) {
            String key = OptionValues.canonicalKey(option.getKey());
            if (key == null) {
                LOG.debug("Dropping unrecognized option '{}' on field '{}' of schema '{}'",
                        option.getKey(), path, ctx.schemaName());
                continue;
            }
            Object value = OptionValues.resolve(option.getValue(), ctx.schemaName(), path, key);
            if (value != null) {
                target.put(key, value);
            }
        }
    }

    // --- Per-type mappings ---

    private MappedField mapScalar(
            FieldSpec field, String schemaType, ValueType valueType, Map<String, Object> options, boolean required) {
        SchemaNode node = describe(schemaType, options, required, Set.of()).build();
        FieldRule rule = new FieldRule(field.name(), valueType, null, required, constraints(options, Set.of()), null);
        return new MappedField(field.name(), node, rule);
    }

    /** {@code uuid}: documented as a formatted string, validated as an opaque string. */
    private MappedField mapFormatted(
            FieldSpec field, String format, ValueType valueType, Map<String, Object> options, boolean required) {
        SchemaNode node =
                describe("string", options, required, Set.of("format")).format(format).build();
        FieldRule rule =
                new FieldRule(field.name(), valueType, null, required, constraints(options, Set.of("format")), null);
        return new MappedField(field.name(), node, rule);
    }

    /** {@code date}/{@code datetime}: the example is always present and always a string. */
    private MappedField mapDated(
            FieldSpec field, String format, ValueType valueType, Map<String, Object> options, boolean required) {
        SchemaNode node = describe("string", options, required, Set.of("format", "example"))
                .format(format)
                .example(OptionValues.asString(options.get("example")))
                .build();
        FieldRule rule =
                new FieldRule(field.name(), valueType, null, required, constraints(options, Set.of("format")), null);
        return new MappedField(field.name(), node, rule);
    }

    private MappedField mapDecimal(
            CompileContext ctx, FieldSpec field, String path, Map<String, Object> options, boolean required) {
        for (String key : DECIMAL_CHECKED_KEYS) {
            Object value = options.get(key);
            if (OptionValues.isArbitraryPrecision(value)) {
                throw new DecimalValueNotAllowedError(
                        "Option '" + key + "' of decimal field '" + path + "' must be a plain numeric literal, not "
                                + value.getClass().getSimpleName() + " (" + value + ")",
                        ctx.schemaName(),
                        path);
            }
        }
        SchemaNode node =
                describe("number", options, required, Set.of("format")).format("double").build();
        FieldRule rule = new FieldRule(
                field.name(), ValueType.DECIMAL, null, required, constraints(options, Set.of("format")), null);
        return new MappedField(field.name(), node, rule);
    }

    /**
     * {@code enum}, and {@code string} with {@code included}: both produce the same node. A declared
     * {@code format} is dropped so the two shapes stay identical.
     */
    private MappedField mapEnum(
            CompileContext ctx,
            FieldSpec field,
            String path,
            Map<String, Object> options,
            String valuesKey,
            boolean required) {
        Object raw = options.get(valuesKey);
        if (!(raw instanceof Collection<?> declared) || declared.isEmpty()) {
            throw new MalformedDeclarationError(
                    "Option '" + valuesKey + "' of field '" + path + "' must be a non-empty list", ctx.schemaName(), path);
        }
        List<String> values = new ArrayList<>();
        for (Object value : declared) {
            values.add(OptionValues.asString(value));
        }
        Set<String> enumManaged = Set.of("format", "values", "included");
        SchemaNode node =
                describe("string", options, required, enumManaged).enumValues(values).build();
        Map<String, Object> constraints = constraints(options, enumManaged);
        constraints.put("included", values);
        FieldRule rule = new FieldRule(field.name(), ValueType.STRING, null, required, constraints, null);
        return new MappedField(field.name(), node, rule);
    }

    private MappedField mapArray(
            CompileContext ctx,
            FieldSpec field,
            String path,
            Map<String, Object> options,
            boolean required,
            Function<List<Declaration>, CompiledBlock> inlineBlock) {
        SemanticType subtype = field.type().subtype();
        if (!ARRAY_ITEM_TYPES.contains(subtype)) {
            throw new UnsupportedSubtypeError(
                    "Unsupported subtype '" + subtype.tag() + "' in array field '" + path
                            + "'; array items must be string, integer or object",
                    ctx.schemaName(),
                    path);
        }
        SchemaNode items;
        ValidationDescriptor nested = null;
        if (subtype == SemanticType.OBJECT) {
            CompiledBlock block = inlineBlock.apply(field.fields());
            items = block.documentation().withRequired(required);
            nested = block.validation();
        } else {
            items = SchemaNode.builder(subtype.tag()).required(required).build();
        }
        SchemaNode node = describe("array", options, required, Set.of()).items(items).build();
        ValueType itemType = subtype == SemanticType.OBJECT
                ? ValueType.OBJECT
                : subtype == SemanticType.INTEGER ? ValueType.INTEGER : ValueType.STRING;
        FieldRule rule = new FieldRule(
                field.name(), ValueType.ARRAY, itemType, required, constraints(options, Set.of()), nested);
        return new MappedField(field.name(), node, rule);
    }

    private MappedField mapObject(
            FieldSpec field,
            Map<String, Object> options,
            boolean required,
            Function<List<Declaration>, CompiledBlock> inlineBlock) {
        SchemaNode.Builder node = describe("object", options, required, Set.of());
        ValidationDescriptor nested = null;
        if (field.hasInlineFields()) {
            CompiledBlock block = inlineBlock.apply(field.fields());
            node.properties(block.documentation().properties());
            nested = block.validation();
        }
        FieldRule rule = new FieldRule(
                field.name(), ValueType.OBJECT, null, required, constraints(options, Set.of()), nested);
        return new MappedField(field.name(), node.build(), rule);
    }

    // --- Helpers ---

    /** Documentation builder carrying every documentable option except the managed keys. */
    private static SchemaNode.Builder describe(
            String schemaType, Map<String, Object> options, boolean required, Set<String> managed) {
        SchemaNode.Builder builder = SchemaNode.builder(schemaType).required(required);
        for (Map.Entry<String, Object> option : options.entrySet()) {
            String key = option.getKey();
            if (managed.contains(key) || OptionValues.VALIDATION_ONLY.contains(key)) {
                continue;
            }
            switch (key) {
                case "example" -> builder.example(option.getValue());
                case "description" -> builder.description(OptionValues.asString(option.getValue()));
                case "format" -> builder.format(OptionValues.asString(option.getValue()));
                default -> builder.keyword(key, option.getValue());
            }
        }
        return builder;
    }

    /**
     * Validation constraints: every option except documentation-only and managed keys. {@code
     * values} only constrains enums, where it is rewritten to {@code included}.
     */
    private static Map<String, Object> constraints(Map<String, Object> options, Set<String> managed) {
        Map<String, Object> constraints = new LinkedHashMap<>();
        for (Map.Entry<String, Object> option : options.entrySet()) {
            String key = option.getKey();
            if (!managed.contains(key) && !OptionValues.DOCUMENTATION_ONLY.contains(key) && !"values".equals(key)) {
                constraints.put(key, option.getValue());
            }
        }
        return constraints;
    }
}
