package io.valspec.core.compile;

import io.valspec.core.model.FieldRule;
import io.valspec.core.model.SchemaNode;
import io.valspec.core.model.ValidationDescriptor;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds per-field fragments into one object-level block. A single field and a block of many
 * fields yield the same shape, {@code {type: object, properties: {...}}}. Requiredness stays on
 * each property node; no schema-level required list is produced.
 */
final class SchemaAssembler {

    CompiledBlock assemble(List<MappedField> fields) {
        Map<String, SchemaNode> properties = new LinkedHashMap<>();
        List<FieldRule> rules = new ArrayList<>(fields.size());
        for (MappedField field : fields) {
            if (properties.putIfAbsent(field.name(), field.documentation()) != null) {
                throw new IllegalStateException("Field '" + field.name() + "' assembled twice");
            }
            rules.add(field.rule());
        }
        return new CompiledBlock(SchemaNode.object(properties), new ValidationDescriptor(rules));
    }
}
