package io.valspec.core.declare;

import static io.valspec.core.declare.Declarations.embedsMany;
import static io.valspec.core.declare.Declarations.field;
import static io.valspec.core.declare.Declarations.optional;
import static io.valspec.core.declare.Declarations.required;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.valspec.core.error.MalformedDeclarationError;
import io.valspec.core.model.FieldType;
import io.valspec.core.model.Requiredness;
import io.valspec.core.model.SemanticType;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link DeclarationParser}: the YAML tuple form, the Java DSL, and the structural
 * rules both share.
 */
class DeclarationParserTest {

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private final DeclarationParser parser = new DeclarationParser();

    private static JsonNode yaml(String text) throws Exception {
        return YAML.readTree(text);
    }

    @Nested
    class TupleForm {

        @Test
        void parsesEveryDeclarationKind() throws Exception {
            List<Declaration> block = parser.parse("s", yaml("""
                    - required: [first_name, string, {example: Greg}]
                    - optional: [age, integer]
                    - field: [nickname, string]
                    - embeds_one: [address, address]
                    - embeds_many: [friends, user]
                    """));

            assertThat(block).extracting(Declaration::kind).containsExactly(
                    Declaration.Kind.REQUIRED,
                    Declaration.Kind.OPTIONAL,
                    Declaration.Kind.PLAIN_FIELD,
                    Declaration.Kind.EMBEDS_ONE,
                    Declaration.Kind.EMBEDS_MANY);
            assertThat(block).extracting(Declaration::name)
                    .containsExactly("first_name", "age", "nickname", "address", "friends");
        }

        @Test
        void fieldPayloadCarriesTypeRequirednessAndOptions() throws Exception {
            List<Declaration> block = parser.parse("s", yaml("""
                    - required: [first_name, string, {example: Greg, description: first name}]
                    """));

            FieldSpec field = Declaration.fieldOf(block.get(0));
            assertThat(field.type()).isEqualTo(FieldType.STRING);
            assertThat(field.requiredness()).isEqualTo(Requiredness.REQUIRED);
            assertThat(field.options()).containsExactly(
                    Map.entry("example", "Greg"), Map.entry("description", "first name"));
        }

        @Test
        void plainFieldIsNotRequired() throws Exception {
            List<Declaration> block = parser.parse("s", yaml("- field: [nickname, string]"));

            assertThat(Declaration.fieldOf(block.get(0)).requiredness().isRequired()).isFalse();
        }

        @Test
        void acceptsBothArrayNotations() throws Exception {
            List<Declaration> block = parser.parse("s", yaml("""
                    - optional: [tags, "array<string>"]
                    - optional: [scores, {array: integer}]
                    """));

            assertThat(Declaration.fieldOf(block.get(0)).type()).isEqualTo(FieldType.arrayOf(SemanticType.STRING));
            assertThat(Declaration.fieldOf(block.get(1)).type()).isEqualTo(FieldType.arrayOf(SemanticType.INTEGER));
        }

        @Test
        void inlineFieldsBecomeANestedBlock() throws Exception {
            List<Declaration> block = parser.parse("s", yaml("""
                    - optional:
                        - address
                        - object
                        - fields:
                            - required: [city, string]
                            - optional: [zip, string]
                    """));

            FieldSpec address = Declaration.fieldOf(block.get(0));
            assertThat(address.options()).doesNotContainKey(DeclarationParser.FIELDS_OPTION);
            assertThat(address.fields()).extracting(Declaration::name).containsExactly("city", "zip");
        }

        @Test
        void unknownTag_rejected() {
            assertThatThrownBy(() -> parser.parse("s", yaml("- mandatory: [name, string]")))
                    .isInstanceOf(MalformedDeclarationError.class)
                    .hasMessageContaining("Unknown declaration tag 'mandatory'");
        }

        @Test
        void unknownType_rejectedWithFieldPath() {
            assertThatThrownBy(() -> parser.parse("s", yaml("- required: [first_name, text]")))
                    .isInstanceOfSatisfying(MalformedDeclarationError.class, e -> {
                        assertThat(e.schemaName()).isEqualTo("s");
                        assertThat(e.field()).isEqualTo("first_name");
                    });
        }

        @Test
        void missingName_rejected() {
            assertThatThrownBy(() -> parser.parse("s", yaml("- required: []")))
                    .isInstanceOf(MalformedDeclarationError.class)
                    .hasMessageContaining("missing a field name");
        }

        @Test
        void missingType_rejected() {
            assertThatThrownBy(() -> parser.parse("s", yaml("- required: [first_name]")))
                    .isInstanceOf(MalformedDeclarationError.class)
                    .hasMessageContaining("expects [name, type, options?]");
        }

        @Test
        void nonListBlock_rejected() {
            assertThatThrownBy(() -> parser.parse("s", yaml("required: [first_name, string]")))
                    .isInstanceOf(MalformedDeclarationError.class)
                    .hasMessageContaining("must be a list");
        }

        @Test
        void optionsMustBeAMap() {
            assertThatThrownBy(() -> parser.parse("s", yaml("- required: [age, integer, 18]")))
                    .isInstanceOf(MalformedDeclarationError.class)
                    .hasMessageContaining("must be a map");
        }

        @Test
        void embeddingRequiresSchemaReference() {
            assertThatThrownBy(() -> parser.parse("s", yaml("- embeds_one: [data]")))
                    .isInstanceOf(MalformedDeclarationError.class)
                    .hasMessageContaining("expects [name, schemaReference]");
        }

        @Test
        void nestedErrorsCarryDottedPath() {
            assertThatThrownBy(() -> parser.parse("s", yaml("""
                    - optional:
                        - items
                        - {array: object}
                        - fields:
                            - required: [id, text]
                    """)))
                    .isInstanceOfSatisfying(
                            MalformedDeclarationError.class, e -> assertThat(e.field()).isEqualTo("items.id"));
        }
    }

    @Nested
    class StructuralRules {

        @Test
        void duplicateNames_rejected() {
            List<Declaration> block = List.of(required("name", "string"), optional("name", "integer"));

            assertThatThrownBy(() -> parser.normalize("s", block))
                    .isInstanceOf(MalformedDeclarationError.class)
                    .hasMessageContaining("Duplicate field name 'name'");
        }

        @Test
        void duplicateEmbeddingName_rejected() {
            List<Declaration> block = List.of(field("data", "string"), embedsMany("data", "user"));

            assertThatThrownBy(() -> parser.normalize("s", block)).isInstanceOf(MalformedDeclarationError.class);
        }

        @Test
        void sameNameInDifferentBlocks_allowed() {
            List<Declaration> block = List.of(
                    required("id", "uuid"),
                    optional("owner", FieldType.OBJECT, Map.of(), required("id", "uuid")));

            assertThat(parser.normalize("s", block)).hasSize(2);
        }

        @Test
        void inlineFieldsOnScalar_rejected() {
            List<Declaration> block = List.of(optional("name", FieldType.STRING, Map.of(), required("x", "string")));

            assertThatThrownBy(() -> parser.normalize("s", block))
                    .isInstanceOf(MalformedDeclarationError.class)
                    .hasMessageContaining("cannot declare nested fields");
        }

        @Test
        void inlineFieldsOnScalarArray_rejected() {
            List<Declaration> block = List.of(
                    optional("tags", FieldType.arrayOf(SemanticType.STRING), Map.of(), required("x", "string")));

            assertThatThrownBy(() -> parser.normalize("s", block)).isInstanceOf(MalformedDeclarationError.class);
        }

        @Test
        void objectArrayWithoutInlineFields_rejected() {
            List<Declaration> block = List.of(optional("items", FieldType.arrayOf(SemanticType.OBJECT)));

            assertThatThrownBy(() -> parser.normalize("s", block))
                    .isInstanceOf(MalformedDeclarationError.class)
                    .hasMessageContaining("requires an inline block");
        }

        @Test
        void enumWithoutValues_rejected() {
            List<Declaration> block = List.of(required("role", "enum"));

            assertThatThrownBy(() -> parser.normalize("s", block))
                    .isInstanceOf(MalformedDeclarationError.class)
                    .hasMessageContaining("requires a 'values' option");
        }

        @Test
        void blankEmbeddingReference_rejected() {
            List<Declaration> block = List.of(embedsMany("data", " "));

            assertThatThrownBy(() -> parser.normalize("s", block))
                    .isInstanceOf(MalformedDeclarationError.class)
                    .hasMessageContaining("missing a schema reference");
        }

        @Test
        void blankFieldName_rejected() {
            List<Declaration> block = List.of(required(" ", "string"));

            assertThatThrownBy(() -> parser.normalize("s", block)).isInstanceOf(MalformedDeclarationError.class);
        }

        @Test
        void dslRejectsUnknownTypeTag() {
            assertThatThrownBy(() -> required("first_name", "text"))
                    .isInstanceOf(MalformedDeclarationError.class)
                    .hasMessageContaining("Unrecognized type 'text'");
        }

        @Test
        void normalizedBlockIsImmutable() {
            List<Declaration> block = parser.normalize("s", List.of(required("name", "string")));

            assertThatThrownBy(() -> block.add(optional("age", "integer")))
                    .isInstanceOf(UnsupportedOperationException.class);
        }
    }
}
