package io.valspec.core.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.valspec.core.model.SemanticType;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Tests for {@link ConfigLoader}: YAML loading, environment overlay and CLI path resolution. */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    private Path writeConfig(String yaml) throws IOException {
        Path path = tempDir.resolve("valspec.yaml");
        Files.writeString(path, yaml);
        return path;
    }

    private static final Map<String, String> NO_ENV = Map.of();

    @Nested
    class YamlLoading {

        @Test
        void loadsAllSections() throws IOException {
            Path path = writeConfig("""
                    schemas:
                      dir: /etc/valspec/schemas
                      files:
                        - user.yaml
                        - json_response.yaml
                    compiler:
                      date-example: "2000-01-01"
                      datetime-example: "2000-01-01T00:00:00Z"
                      type-defaults:
                        string:
                          maxLength: 255
                    """);

            ValspecConfig config = ConfigLoader.load(path, NO_ENV::get);

            assertThat(config.schemasDir()).isEqualTo("/etc/valspec/schemas");
            assertThat(config.schemaFiles()).containsExactly("user.yaml", "json_response.yaml");
            assertThat(config.compiler().dateExample()).isEqualTo("2000-01-01");
            assertThat(config.compiler().dateTimeExample()).isEqualTo("2000-01-01T00:00:00Z");
            assertThat(config.compiler().defaultsFor(SemanticType.STRING)).containsEntry("maxLength", 255);
        }

        @Test
        void missingSectionsFallBackToDefaults() throws IOException {
            Path path = writeConfig("schemas:\n  files: [user.yaml]\n");

            ValspecConfig config = ConfigLoader.load(path, NO_ENV::get);

            assertThat(config.schemasDir()).isEqualTo("schemas");
            assertThat(config.compiler()).isEqualTo(CompilerConfig.defaults());
        }

        @Test
        void emptyFileYieldsDefaults() throws IOException {
            Path path = writeConfig("");

            ValspecConfig config = ConfigLoader.load(path, NO_ENV::get);

            assertThat(config.schemaFiles()).isEmpty();
            assertThat(config.compiler().dateTimeExample()).isEqualTo(CompilerConfig.DEFAULT_DATETIME_EXAMPLE);
        }

        @Test
        void typeDefaultsAcceptAliases() throws IOException {
            Path path = writeConfig("""
                    compiler:
                      type-defaults:
                        utc_datetime:
                          description: timestamp
                    """);

            ValspecConfig config = ConfigLoader.load(path, NO_ENV::get);

            assertThat(config.compiler().defaultsFor(SemanticType.DATETIME)).containsEntry("description", "timestamp");
        }

        @Test
        void missingFile_throws() {
            assertThatThrownBy(() -> ConfigLoader.load(tempDir.resolve("absent.yaml"), NO_ENV::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("Configuration file not found");
        }

        @Test
        void invalidYaml_throws() throws IOException {
            Path path = writeConfig("schemas: [unclosed\n");

            assertThatThrownBy(() -> ConfigLoader.load(path, NO_ENV::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("Failed to parse YAML");
        }

        @Test
        void unknownTypeInDefaults_throws() throws IOException {
            Path path = writeConfig("""
                    compiler:
                      type-defaults:
                        text:
                          maxLength: 10
                    """);

            assertThatThrownBy(() -> ConfigLoader.load(path, NO_ENV::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("Unknown type 'text'");
        }

        @Test
        void filesMustBeAList() throws IOException {
            Path path = writeConfig("schemas:\n  files: user.yaml\n");

            assertThatThrownBy(() -> ConfigLoader.load(path, NO_ENV::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("schemas.files");
        }
    }

    @Nested
    class EnvironmentOverlay {

        @Test
        void envOverridesYaml() throws IOException {
            Path path = writeConfig("schemas:\n  dir: from-yaml\ncompiler:\n  date-example: \"2000-01-01\"\n");
            Map<String, String> env = Map.of(
                    ConfigLoader.ENV_SCHEMAS_DIR, "from-env",
                    ConfigLoader.ENV_DATE_EXAMPLE, "2030-06-30",
                    ConfigLoader.ENV_DATETIME_EXAMPLE, "2030-06-30T12:00:00");

            ValspecConfig config = ConfigLoader.load(path, env::get);

            assertThat(config.schemasDir()).isEqualTo("from-env");
            assertThat(config.compiler().dateExample()).isEqualTo("2030-06-30");
            assertThat(config.compiler().dateTimeExample()).isEqualTo("2030-06-30T12:00:00");
        }

        @Test
        void blankEnvCountsAsUnset() throws IOException {
            Path path = writeConfig("schemas:\n  dir: from-yaml\n");

            ValspecConfig config = ConfigLoader.load(path, Map.of(ConfigLoader.ENV_SCHEMAS_DIR, "  ")::get);

            assertThat(config.schemasDir()).isEqualTo("from-yaml");
        }

        @Test
        void envValuesAreTrimmed() throws IOException {
            Path path = writeConfig("");

            ValspecConfig config = ConfigLoader.load(path, Map.of(ConfigLoader.ENV_SCHEMAS_DIR, " /srv/schemas ")::get);

            assertThat(config.schemasDir()).isEqualTo("/srv/schemas");
        }

        @Test
        void envKeepsTypeDefaults() throws IOException {
            Path path = writeConfig("compiler:\n  type-defaults:\n    integer:\n      minimum: 0\n");

            ValspecConfig config = ConfigLoader.load(path, Map.of(ConfigLoader.ENV_DATE_EXAMPLE, "2030-01-01")::get);

            assertThat(config.compiler().defaultsFor(SemanticType.INTEGER)).containsEntry("minimum", 0);
        }
    }

    @Nested
    class ConfigPathResolution {

        @Test
        void defaultsToValspecYaml() {
            assertThat(ConfigLoader.resolveConfigPath(new String[0])).isEqualTo(Path.of("valspec.yaml"));
        }

        @Test
        void honoursConfigFlag() {
            assertThat(ConfigLoader.resolveConfigPath(new String[] {"--config", "/etc/valspec.yaml"}))
                    .isEqualTo(Path.of("/etc/valspec.yaml"));
        }

        @Test
        void configFlagWithoutValue_throws() {
            assertThatThrownBy(() -> ConfigLoader.resolveConfigPath(new String[] {"--config"}))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
