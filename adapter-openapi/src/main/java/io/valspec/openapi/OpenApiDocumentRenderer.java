package io.valspec.openapi;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import io.valspec.core.model.SchemaNode;
import io.valspec.core.model.SchemaNodes;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Renders bound endpoints as an OpenAPI 3.0.3 document.
 *
 * <p>Each route maps a path and HTTP method to an {@link EndpointDescriptor}. Request bodies and
 * responses are published as {@code application/json}; callbacks become a {@code post} operation
 * on the empty path expression, as expected by documentation UIs. The endpoint's {@code
 * openApiOptions} are merged last and may overwrite any generated operation key.
 *
 * <p>Not thread-safe while routes are being added.
 */
public final class OpenApiDocumentRenderer {

    static final String OPENAPI_VERSION = "3.0.3";
    static final String JSON_MEDIA_TYPE = "application/json";
    static final String CALLBACK_ACCEPTED = "Your server returns this code if it accepts the callback";

    private static final Set<String> METHODS = Set.of("get", "put", "post", "delete", "options", "head", "patch", "trace");

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private static final ObjectMapper YAML_MAPPER =
            new ObjectMapper(new YAMLFactory().disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER));

    private final String title;
    private final String version;
    private final List<Route> routes = new ArrayList<>();

    public OpenApiDocumentRenderer(String title, String version) {
        this.title = Objects.requireNonNull(title, "title must not be null");
        this.version = Objects.requireNonNull(version, "version must not be null");
    }

    /**
     * Adds a route.
     *
     * @param path       path template, e.g. {@code /users/{id}}
     * @param method     HTTP method, case-insensitive
     * @param descriptor the bound endpoint
     * @return this renderer
     * @throws IllegalArgumentException for an unknown method or a path/method pair added twice
     */
    public OpenApiDocumentRenderer route(String path, String method, EndpointDescriptor descriptor) {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(descriptor, "descriptor must not be null");
        String normalized = method == null ? "" : method.toLowerCase(Locale.ROOT);
        if (!METHODS.contains(normalized)) {
            throw new IllegalArgumentException("Unsupported HTTP method: " + method);
        }
        for (Route existing : routes) {
            if (existing.path().equals(path) && existing.method().equals(normalized)) {
                throw new IllegalArgumentException("Route already defined: " + method + " " + path);
            }
        }
        routes.add(new Route(path, normalized, descriptor));
        return this;
    }

    /** The document as a Jackson tree. */
    public ObjectNode render() {
        ObjectNode document = JSON_MAPPER.createObjectNode();
        document.put("openapi", OPENAPI_VERSION);
        ObjectNode info = document.putObject("info");
        info.put("title", title);
        info.put("version", version);

        ObjectNode paths = document.putObject("paths");
        for (Route route : routes) {
            ObjectNode pathItem = (ObjectNode) paths.get(route.path());
            if (pathItem == null) {
                pathItem = paths.putObject(route.path());
            }
            pathItem.set(route.method(), operation(route.descriptor()));
        }
        return document;
    }

    public String toJson() {
        return write(JSON_MAPPER);
    }

    public String toYaml() {
        return write(YAML_MAPPER);
    }

    ObjectNode operation(EndpointDescriptor descriptor) {
        ObjectNode operation = JSON_MAPPER.createObjectNode();
        if (!descriptor.tags().isEmpty()) {
            ArrayNode tags = operation.putArray("tags");
            descriptor.tags().forEach(tags::add);
        }
        operation.put("summary", descriptor.summary());
        operation.put("operationId", operationId(descriptor));
        if (descriptor.hasRequestBody()) {
            operation.set("requestBody", jsonBody(descriptor.requestBodySchema()));
        }

        ObjectNode responses = operation.putObject("responses");
        for (Map.Entry<Integer, SchemaNode> response : descriptor.responseSchemas().entrySet()) {
            responses.set(String.valueOf(response.getKey()), jsonBody(response.getValue()));
        }
        if (descriptor.responseSchemas().isEmpty()) {
            responses.putObject("default").put("description", "");
        }

        if (!descriptor.callbackSchemas().isEmpty()) {
            ObjectNode callbacks = operation.putObject("callbacks");
            for (Map.Entry<String, SchemaNode> callback : descriptor.callbackSchemas().entrySet()) {
                ObjectNode post = callbacks.putObject(callback.getKey()).putObject("").putObject("post");
                post.set("requestBody", jsonBody(callback.getValue()));
                post.putObject("responses").putObject("200").put("description", CALLBACK_ACCEPTED);
            }
        }

        for (Map.Entry<String, Object> option : descriptor.openApiOptions().entrySet()) {
            operation.set(option.getKey(), JSON_MAPPER.valueToTree(option.getValue()));
        }
        return operation;
    }

    private static ObjectNode jsonBody(SchemaNode schema) {
        ObjectNode body = JSON_MAPPER.createObjectNode();
        body.put("description", "");
        body.putObject("content").putObject(JSON_MEDIA_TYPE).set("schema", SchemaNodes.toJson(schema));
        return body;
    }

    private static String operationId(EndpointDescriptor descriptor) {
        String prefix = descriptor.tags().isEmpty() ? "" : descriptor.tags().get(0).replaceAll("\\s+", "") + ".";
        return prefix + descriptor.action();
    }

    private String write(ObjectMapper mapper) {
        try {
            return mapper.writeValueAsString(render());
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize OpenAPI document", e);
        }
    }

    private record Route(String path, String method, EndpointDescriptor descriptor) {}
}
