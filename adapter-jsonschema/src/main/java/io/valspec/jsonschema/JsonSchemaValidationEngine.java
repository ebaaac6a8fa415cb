package io.valspec.jsonschema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.PathType;
import com.networknt.schema.SchemaValidatorsConfig;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.valspec.core.model.FieldRule;
import io.valspec.core.model.ValidationDescriptor;
import io.valspec.core.model.ValueType;
import io.valspec.core.spi.ValidationEngine;
import io.valspec.core.spi.ValidationResult;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ValidationEngine} backed by the networknt JSON Schema validator.
 *
 * <p>Each descriptor is translated to a JSON Schema once and the compiled validator is cached.
 * Input values that are {@code null} count as absent. A valid input yields only the declared
 * fields, with {@code default} constraints filled in for absent ones; undeclared keys are
 * dropped at every object level. Failures are reported per field, keyed by dotted path
 * ({@code address.city}, {@code contacts.0.email}); a missing required field reads
 * {@value #BLANK}.
 *
 * <p>Thread-safe.
 */
public final class JsonSchemaValidationEngine implements ValidationEngine {

    private static final Logger LOG = LoggerFactory.getLogger(JsonSchemaValidationEngine.class);

    static final String BLANK = "can't be blank";
    static final String INVALID = "is invalid";
    static final String RESERVED = "is reserved";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);
    private static final SchemaValidatorsConfig CONFIG = SchemaValidatorsConfig.builder()
            .pathType(PathType.JSON_POINTER)
            .formatAssertionsEnabled(true)
            .build();

    private final ValidationSchemaTranslator translator = new ValidationSchemaTranslator(MAPPER);
    private final Map<ValidationDescriptor, JsonSchema> cache = new ConcurrentHashMap<>();

    @Override
    public ValidationResult validate(ValidationDescriptor descriptor, Map<String, Object> input) {
        Map<String, Object> present = withoutNulls(input == null ? Map.of() : input);
        JsonSchema schema = cache.computeIfAbsent(descriptor, this::compile);
        Set<ValidationMessage> messages = schema.validate(MAPPER.valueToTree(present));
        if (messages.isEmpty()) {
            return ValidationResult.ok(declaredValues(descriptor, present));
        }
        Map<String, List<String>> errors = new LinkedHashMap<>();
        for (ValidationMessage message : messages) {
            errors.computeIfAbsent(fieldOf(message), k -> new ArrayList<>()).add(describe(message));
        }
        LOG.debug("Validation failed: fields={}", errors.keySet());
        return ValidationResult.errors(errors);
    }

    /** The JSON Schema a descriptor is validated against. */
    public JsonNode schemaFor(ValidationDescriptor descriptor) {
        return translator.translate(descriptor);
    }

    /** Number of compiled validators held. */
    int cachedSchemas() {
        return cache.size();
    }

    private JsonSchema compile(ValidationDescriptor descriptor) {
        JsonSchema schema = SCHEMA_FACTORY.getSchema(translator.translate(descriptor), CONFIG);
        LOG.debug("Compiled validation schema: fields={}", descriptor.fieldNames());
        return schema;
    }

    // --- Result shaping ---

    private static Map<String, Object> declaredValues(ValidationDescriptor descriptor, Map<String, Object> input) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (FieldRule rule : descriptor) {
            if (input.containsKey(rule.name())) {
                values.put(rule.name(), declaredValue(rule, input.get(rule.name())));
            } else if (rule.hasConstraint("default")) {
                values.put(rule.name(), rule.constraint("default"));
            }
        }
        return values;
    }

    @SuppressWarnings("unchecked")
    private static Object declaredValue(FieldRule rule, Object value) {
        if (rule.nested() == null) {
            return value;
        }
        if (rule.type() == ValueType.OBJECT && value instanceof Map<?, ?> map) {
            return declaredValues(rule.nested(), (Map<String, Object>) map);
        }
        if (rule.type() == ValueType.ARRAY && value instanceof Collection<?> collection) {
            List<Object> items = new ArrayList<>();
            for (Object item : collection) {
                items.add(item instanceof Map<?, ?> ? declaredValues(rule.nested(), (Map<String, Object>) item) : item);
            }
            return items;
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> withoutNulls(Map<String, Object> input) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : input.entrySet()) {
            Object value = entry.getValue();
            if (value instanceof Map<?, ?> map) {
                result.put(entry.getKey(), withoutNulls((Map<String, Object>) map));
            } else if (value != null) {
                result.put(entry.getKey(), value);
            }
        }
        return result;
    }

    // --- Error shaping ---

    private static String fieldOf(ValidationMessage message) {
        String location = dotted(message.getInstanceLocation().toString());
        if ("required".equals(message.getType()) && message.getProperty() != null) {
            return location.isEmpty() ? message.getProperty() : location + "." + message.getProperty();
        }
        return location;
    }

    private static String describe(ValidationMessage message) {
        return switch (message.getType()) {
            case "required" -> BLANK;
            case "type", "enum" -> INVALID;
            case "not" -> RESERVED;
            default -> stripLocation(message);
        };
    }

    /** {@code /address/city} to {@code address.city}. */
    private static String dotted(String pointer) {
        String path = pointer.startsWith("/") ? pointer.substring(1) : pointer;
        return path.replace('/', '.');
    }

    private static String stripLocation(ValidationMessage message) {
        String text = message.getMessage();
        String prefix = message.getInstanceLocation().toString() + ": ";
        return text.startsWith(prefix) ? text.substring(prefix.length()) : text;
    }
}
