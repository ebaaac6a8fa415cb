package io.valspec.openapi;

import io.valspec.core.model.SchemaNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Documentation metadata for one controller action.
 *
 * @param action            action name ({@code create}, {@code index}, or a custom one)
 * @param summary           operation summary, possibly empty
 * @param tags              tags of the owning binder
 * @param requestSchemaName name of the compiled request schema, or null for body-less actions
 * @param requestBodySchema documentation tree of the request body, or null
 * @param responseSchemas   response documentation by HTTP status code
 * @param callbackSchemas   callback documentation by callback schema name
 * @param openApiOptions    extra operation keys, merged verbatim on rendering
 */
public record EndpointDescriptor(
        String action,
        String summary,
        List<String> tags,
        String requestSchemaName,
        SchemaNode requestBodySchema,
        Map<Integer, SchemaNode> responseSchemas,
        Map<String, SchemaNode> callbackSchemas,
        Map<String, Object> openApiOptions) {

    public EndpointDescriptor {
        Objects.requireNonNull(action, "action must not be null");
        tags = List.copyOf(tags);
        responseSchemas = Collections.unmodifiableMap(new LinkedHashMap<>(responseSchemas));
        callbackSchemas = Collections.unmodifiableMap(new LinkedHashMap<>(callbackSchemas));
        openApiOptions = Collections.unmodifiableMap(new LinkedHashMap<>(openApiOptions));
    }

    public boolean hasRequestBody() {
        return requestBodySchema != null;
    }
}
