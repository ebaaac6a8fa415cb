package io.valspec.core.definition;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.valspec.core.compile.SchemaCompiler;
import io.valspec.core.compile.SchemaLookup;
import io.valspec.core.declare.Declaration;
import io.valspec.core.error.DecimalValueNotAllowedError;
import io.valspec.core.error.MalformedDeclarationError;
import io.valspec.core.error.SchemaLoadException;
import io.valspec.core.model.CompiledSchema;
import io.valspec.core.model.FieldRule;
import io.valspec.core.model.SchemaNode;
import io.valspec.core.model.ValueType;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for {@link SchemaFileParser} against the YAML fixtures under {@code schemas/}. */
class SchemaFileParserTest {

    private final SchemaFileParser parser = new SchemaFileParser();

    private static Path fixturePath(String name) {
        return Path.of("src/test/resources/schemas/" + name);
    }

    @Test
    void parseUser_hasNameDescriptionAndFields() {
        SchemaDefinition user = parser.parse(fixturePath("user.yaml"));

        assertThat(user.name()).isEqualTo("user");
        assertThat(user.description()).isEqualTo("A user as returned by the API");
        assertThat(user.declarations()).extracting(Declaration::name).containsExactly("first_name", "last_name", "age");
        assertThat(user.source()).endsWith("user.yaml");
    }

    @Test
    void parseCreateUser_compilesToExpectedDocumentation() {
        SchemaDefinition definition = parser.parse(fixturePath("create_user.yaml"));
        CompiledSchema schema =
                new SchemaCompiler().compile(definition.name(), definition.declarations(), SchemaLookup.none());

        SchemaNode root = schema.documentationSchema();
        assertThat(root.properties().keySet()).containsExactly(
                "first_name", "role", "last_name", "age", "account_id", "updated_at", "tags", "address", "contacts");
        assertThat(root.properties().get("first_name")).isEqualTo(SchemaNode.builder("string")
                .required(true)
                .example("Greg")
                .description("first name of the user")
                .build());
        assertThat(root.properties().get("role").enumValues()).containsExactly("admin", "normal");
        assertThat(root.properties().get("account_id").format()).isEqualTo("uuid");
        assertThat(root.properties().get("updated_at").example()).isEqualTo("2024-08-12T21:00:39");
        assertThat(root.properties().get("tags").example()).isEqualTo(List.of("a", "b"));
        assertThat(root.properties().get("address").properties().get("city").required()).isTrue();
        assertThat(root.properties().get("contacts").items().properties().get("email").format()).isEqualTo("email");
    }

    @Test
    void parseCreateUser_compilesToExpectedValidation() {
        SchemaDefinition definition = parser.parse(fixturePath("create_user.yaml"));
        CompiledSchema schema =
                new SchemaCompiler().compile(definition.name(), definition.declarations(), SchemaLookup.none());

        FieldRule role = schema.validationDescriptor().rule("role");
        assertThat(role.required()).isTrue();
        assertThat(role.constraint("included")).isEqualTo(List.of("admin", "normal"));
        assertThat(role.constraint("default")).isEqualTo("normal");

        FieldRule age = schema.validationDescriptor().rule("age");
        assertThat(age.type()).isEqualTo(ValueType.INTEGER);
        assertThat(age.constraint("minimum")).isEqualTo(18);

        FieldRule contacts = schema.validationDescriptor().rule("contacts");
        assertThat(contacts.itemType()).isEqualTo(ValueType.OBJECT);
        assertThat(contacts.nested().rule("email").required()).isTrue();
    }

    @Test
    void yamlIntegerBeyondLongOnDecimal_rejectedAtCompile() {
        SchemaDefinition definition = parser.parse(fixturePath("invalid/decimal-huge-maximum.yaml"));

        assertThatThrownBy(() -> new SchemaCompiler()
                        .compile(definition.name(), definition.declarations(), SchemaLookup.none()))
                .isInstanceOfSatisfying(DecimalValueNotAllowedError.class, e -> {
                    assertThat(e.schemaName()).isEqualTo("invoice");
                    assertThat(e.field()).isEqualTo("total");
                })
                .hasMessageContaining("maximum")
                .hasMessageContaining("BigInteger");
    }

    @Test
    void unknownRootKey_rejected() {
        assertThatThrownBy(() -> parser.parse(fixturePath("invalid/unknown-root-key.yaml")))
                .isInstanceOfSatisfying(SchemaLoadException.class, e -> {
                    assertThat(e.schemaName()).isEqualTo("broken");
                    assertThat(e.source()).endsWith("unknown-root-key.yaml");
                })
                .hasMessageContaining("extends");
    }

    @Test
    void missingName_rejected() {
        assertThatThrownBy(() -> parser.parse(fixturePath("invalid/missing-name.yaml")))
                .isInstanceOf(SchemaLoadException.class)
                .hasMessageContaining("'name'");
    }

    @Test
    void badType_rejectedAsMalformedDeclaration() {
        assertThatThrownBy(() -> parser.parse(fixturePath("invalid/bad-type.yaml")))
                .isInstanceOfSatisfying(MalformedDeclarationError.class, e -> {
                    assertThat(e.schemaName()).isEqualTo("bad_type");
                    assertThat(e.field()).isEqualTo("first_name");
                });
    }

    @Test
    void invalidYaml_rejected() {
        assertThatThrownBy(() -> parser.parse(fixturePath("invalid/not-yaml.yaml")))
                .isInstanceOf(SchemaLoadException.class)
                .hasMessageContaining("Failed to read or parse YAML");
    }

    @Test
    void missingFile_rejected() {
        assertThatThrownBy(() -> parser.parse(fixturePath("does-not-exist.yaml")))
                .isInstanceOf(SchemaLoadException.class);
    }
}
