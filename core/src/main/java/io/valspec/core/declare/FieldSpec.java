package io.valspec.core.declare;

import io.valspec.core.model.FieldType;
import io.valspec.core.model.Requiredness;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Payload of a field declaration. Transient: created by the parser and discarded once the
 * declaration block is compiled.
 *
 * @param name         field name
 * @param type         declared type
 * @param requiredness how the field was declared
 * @param options      caller options in declaration order; values are not yet resolved
 * @param fields       inline nested block for {@code object} and {@code array<object>}, empty
 *                     otherwise
 */
public record FieldSpec(
        String name, FieldType type, Requiredness requiredness, Map<String, Object> options, List<Declaration> fields) {

    public FieldSpec {
        options = options == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(options));
        fields = fields == null ? List.of() : List.copyOf(fields);
    }

    public boolean hasInlineFields() {
        return !fields.isEmpty();
    }
}
