package io.valspec.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.valspec.core.model.SemanticType;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Loads {@link ValspecConfig} from a YAML file with an environment variable overlay.
 *
 * <p>Supports two invocation patterns:
 * <ul>
 * <li>Default: loads {@code valspec.yaml} from the current directory</li>
 * <li>{@code --config /path/to/valspec.yaml}: loads from the specified path</li>
 * </ul>
 *
 * <p>Environment variables take precedence over YAML values. A variable counts as set only if it
 * is defined and its trimmed value is non-empty.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final String DEFAULT_CONFIG_FILE = "valspec.yaml";

    static final String ENV_SCHEMAS_DIR = "VALSPEC_SCHEMAS_DIR";
    static final String ENV_DATE_EXAMPLE = "VALSPEC_DATE_EXAMPLE";
    static final String ENV_DATETIME_EXAMPLE = "VALSPEC_DATETIME_EXAMPLE";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads configuration from the given YAML file, applying overrides from {@link System#getenv}.
     *
     * @param configPath path to the YAML configuration file
     * @return the loaded configuration
     * @throws ConfigLoadException if the file is missing or contains invalid YAML
     */
    public static ValspecConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads configuration from the given YAML file, applying overrides from the supplied lookup.
     * Returning {@code null} from {@code envLookup} means the variable is not defined.
     *
     * @param configPath path to the YAML configuration file
     * @param envLookup  environment variable lookup function
     * @return the loaded configuration
     * @throws ConfigLoadException if the file is missing or contains invalid YAML
     */
    public static ValspecConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            if (root == null || root.isMissingNode() || root.isNull()) {
                return overlayEnv(ValspecConfig.builder(), CompilerConfig.defaults(), envLookup);
            }
            return mapToConfig(root, envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
    }

    /**
     * Resolves the config file path from CLI arguments.
     *
     * @param args command-line arguments
     * @return the resolved config file path
     */
    public static Path resolveConfigPath(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--config requires a file path argument");
                }
                return Path.of(args[i + 1]);
            }
        }
        return Path.of(DEFAULT_CONFIG_FILE);
    }

    private static ValspecConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        ValspecConfig.Builder builder = ValspecConfig.builder();

        // Schemas section
        JsonNode schemas = root.path("schemas");
        if (schemas.has("dir")) builder.schemasDir(schemas.get("dir").asText());
        if (schemas.has("files")) builder.schemaFiles(stringList(schemas.get("files"), "schemas.files"));

        // Compiler section
        JsonNode compiler = root.path("compiler");
        String dateExample = textOrDefault(compiler, "date-example", CompilerConfig.DEFAULT_DATE_EXAMPLE);
        String dateTimeExample = textOrDefault(compiler, "datetime-example", CompilerConfig.DEFAULT_DATETIME_EXAMPLE);
        Map<SemanticType, Map<String, Object>> typeDefaults = typeDefaults(compiler.path("type-defaults"));

        return overlayEnv(builder, new CompilerConfig(dateExample, dateTimeExample, typeDefaults), envLookup);
    }

    private static ValspecConfig overlayEnv(
            ValspecConfig.Builder builder, CompilerConfig compiler, Function<String, String> envLookup) {
        String schemasDir = env(envLookup, ENV_SCHEMAS_DIR);
        if (schemasDir != null) builder.schemasDir(schemasDir);

        String dateExample = env(envLookup, ENV_DATE_EXAMPLE);
        String dateTimeExample = env(envLookup, ENV_DATETIME_EXAMPLE);
        builder.compiler(new CompilerConfig(
                dateExample != null ? dateExample : compiler.dateExample(),
                dateTimeExample != null ? dateTimeExample : compiler.dateTimeExample(),
                compiler.typeDefaults()));
        return builder.build();
    }

    private static Map<SemanticType, Map<String, Object>> typeDefaults(JsonNode node) {
        Map<SemanticType, Map<String, Object>> result = new EnumMap<>(SemanticType.class);
        if (node.isMissingNode() || node.isNull()) {
            return result;
        }
        if (!node.isObject()) {
            throw new ConfigLoadException("compiler.type-defaults must be a map of type name to options");
        }
        for (Map.Entry<String, JsonNode> entry : node.properties()) {
            SemanticType type = SemanticType.fromTag(entry.getKey())
                    .orElseThrow(() -> new ConfigLoadException(
                            "Unknown type '" + entry.getKey() + "' in compiler.type-defaults"));
            if (!entry.getValue().isObject()) {
                throw new ConfigLoadException("compiler.type-defaults." + entry.getKey() + " must be a map of options");
            }
            Map<String, Object> options = new LinkedHashMap<>();
            for (Map.Entry<String, JsonNode> option : entry.getValue().properties()) {
                options.put(option.getKey(), YAML_MAPPER.convertValue(option.getValue(), Object.class));
            }
            result.put(type, options);
        }
        return result;
    }

    private static List<String> stringList(JsonNode node, String key) {
        if (!node.isArray()) {
            throw new ConfigLoadException(key + " must be a YAML list of file names");
        }
        List<String> values = new ArrayList<>();
        for (JsonNode item : node) {
            values.add(item.asText());
        }
        return values;
    }

    private static String textOrDefault(JsonNode node, String field, String defaultValue) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull() ? value.asText() : defaultValue;
    }

    private static String env(Function<String, String> envLookup, String name) {
        String value = envLookup.apply(name);
        return value == null || value.trim().isEmpty() ? null : value.trim();
    }
}
