package io.valspec.openapi;

import io.valspec.core.declare.Declaration;
import io.valspec.core.error.SchemaNotFoundException;
import io.valspec.core.model.CompiledSchema;
import io.valspec.core.model.SchemaNode;
import io.valspec.core.registry.CompiledSchemaRegistry;
import io.valspec.core.spi.ValidationEngine;
import io.valspec.core.spi.ValidationResult;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Binds request schemas and documentation metadata to the actions of one controller.
 *
 * <pre>{@code
 * EndpointBinder users = EndpointBinder.builder(registry, engine)
 *         .tags("Users")
 *         .defaultResponseSchema("json_response")
 *         .build();
 *
 * users.create("create_user", EndpointOptions.summary("Creates a user"),
 *         required("first_name", "string", Map.of("example", "Greg")),
 *         optional("age", "integer", Map.of("minimum", 18)));
 * users.index(EndpointOptions.builder().summary("Lists users").responseSchema("index_response").build());
 *
 * ValidationResult result = users.validate("create_user", params);
 * }</pre>
 *
 * <p>Actions with a body compile their declarations into the shared registry under the given
 * name, so binding happens during the registry's build phase. Response schemas are documented
 * under status 201; callbacks are keyed by schema name. Binder defaults apply only where the
 * endpoint options leave a value unset. {@code index} and {@code show} never carry callbacks.
 */
public final class EndpointBinder {

    private static final Logger LOG = LoggerFactory.getLogger(EndpointBinder.class);

    /** Status code under which response schemas are documented. */
    public static final int RESPONSE_STATUS = 201;

    private final CompiledSchemaRegistry registry;
    private final ValidationEngine engine;
    private final List<String> tags;
    private final String defaultResponseSchema;
    private final List<String> defaultCallbackSchemas;
    private final Map<String, EndpointDescriptor> endpoints = new LinkedHashMap<>();

    private EndpointBinder(Builder builder) {
        this.registry = builder.registry;
        this.engine = builder.engine;
        this.tags = List.copyOf(builder.tags);
        this.defaultResponseSchema = builder.defaultResponseSchema;
        this.defaultCallbackSchemas = List.copyOf(builder.defaultCallbackSchemas);
    }

    public static Builder builder(CompiledSchemaRegistry registry, ValidationEngine engine) {
        return new Builder(registry, engine);
    }

    // --- Actions with a request body ---

    public EndpointDescriptor create(String name, EndpointOptions options, Declaration... declarations) {
        return custom(name, "create", options, declarations);
    }

    public EndpointDescriptor update(String name, EndpointOptions options, Declaration... declarations) {
        return custom(name, "update", options, declarations);
    }

    /**
     * Compiles a request schema and binds it to an action.
     *
     * @param name         request schema name, also the key for {@link #validate}
     * @param action       controller action
     * @param options      endpoint options
     * @param declarations request body declarations
     * @return the bound endpoint
     * @throws io.valspec.core.error.SchemaCompileException if the declarations do not compile
     * @throws SchemaNotFoundException if a referenced response or callback schema is unknown
     * @throws IllegalStateException if the registry is already frozen
     */
    public EndpointDescriptor custom(String name, String action, EndpointOptions options, Declaration... declarations) {
        Objects.requireNonNull(name, "name must not be null");
        CompiledSchema request = registry.compile(name, List.of(declarations));
        return bind(action, options, request, true);
    }

    // --- Actions without a request body ---

    public EndpointDescriptor index(EndpointOptions options) {
        return bind("index", options, null, false);
    }

    public EndpointDescriptor show(EndpointOptions options) {
        return bind("show", options, null, false);
    }

    public EndpointDescriptor delete(EndpointOptions options) {
        return custom("delete", options);
    }

    /** Binds an action that takes no request body. */
    public EndpointDescriptor custom(String action, EndpointOptions options) {
        return bind(action, options, null, true);
    }

    // --- Validation ---

    /**
     * Validates raw input against a request schema bound by this binder.
     *
     * @param name   request schema name
     * @param params raw input
     * @return the validated values or per-field errors
     * @throws SchemaNotFoundException if no action of this binder declared {@code name}
     */
    public ValidationResult validate(String name, Map<String, Object> params) {
        boolean bound = endpoints.values().stream().anyMatch(e -> name.equals(e.requestSchemaName()));
        if (!bound) {
            throw new SchemaNotFoundException("No request schema named '" + name + "' is bound here", name);
        }
        return engine.validate(registry.lookup(name).validationDescriptor(), params);
    }

    /** Every bound endpoint, in binding order. */
    public List<EndpointDescriptor> endpoints() {
        return Collections.unmodifiableList(new ArrayList<>(endpoints.values()));
    }

    /**
     * Looks up a bound action.
     *
     * @param action action name
     * @return the endpoint, or null if the action was never bound
     */
    public EndpointDescriptor endpoint(String action) {
        return endpoints.get(action);
    }

    public List<String> tags() {
        return tags;
    }

    private EndpointDescriptor bind(
            String action, EndpointOptions options, CompiledSchema request, boolean withCallbacks) {
        Objects.requireNonNull(action, "action must not be null");
        EndpointOptions opts = options == null ? EndpointOptions.none() : options;

        Map<Integer, SchemaNode> responses = new LinkedHashMap<>();
        String responseSchema = opts.responseSchema() != null ? opts.responseSchema() : defaultResponseSchema;
        if (responseSchema != null) {
            responses.put(RESPONSE_STATUS, registry.lookup(responseSchema).documentationSchema());
        }

        Map<String, SchemaNode> callbacks = new LinkedHashMap<>();
        if (withCallbacks) {
            List<String> callbackSchemas =
                    opts.callbackSchemas() != null ? opts.callbackSchemas() : defaultCallbackSchemas;
            for (String callback : callbackSchemas) {
                callbacks.put(callback, registry.lookup(callback).documentationSchema());
            }
        }

        EndpointDescriptor descriptor = new EndpointDescriptor(
                action,
                opts.summary(),
                tags,
                request == null ? null : request.name(),
                request == null ? null : request.documentationSchema(),
                responses,
                callbacks,
                opts.openApiOptions());
        if (endpoints.put(action, descriptor) != null) {
            LOG.warn("Rebound endpoint action: action={}, tags={}", action, tags);
        }
        LOG.debug("Bound endpoint: action={}, request={}, responses={}, callbacks={}",
                action, descriptor.requestSchemaName(), responses.keySet(), callbacks.keySet());
        return descriptor;
    }

    /** Builder for {@link EndpointBinder}: tags and the per-controller defaults. */
    public static final class Builder {

        private final CompiledSchemaRegistry registry;
        private final ValidationEngine engine;
        private final List<String> tags = new ArrayList<>();
        private String defaultResponseSchema;
        private final List<String> defaultCallbackSchemas = new ArrayList<>();

        private Builder(CompiledSchemaRegistry registry, ValidationEngine engine) {
            this.registry = Objects.requireNonNull(registry, "registry must not be null");
            this.engine = Objects.requireNonNull(engine, "engine must not be null");
        }

        public Builder tags(String... tags) {
            this.tags.addAll(List.of(tags));
            return this;
        }

        public Builder defaultResponseSchema(String schemaName) {
            this.defaultResponseSchema = schemaName;
            return this;
        }

        public Builder defaultCallbackSchema(String schemaName) {
            this.defaultCallbackSchemas.add(schemaName);
            return this;
        }

        public EndpointBinder build() {
            return new EndpointBinder(this);
        }
    }
}
