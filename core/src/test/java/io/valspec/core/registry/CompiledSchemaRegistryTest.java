package io.valspec.core.registry;

import static io.valspec.core.declare.Declarations.embedsMany;
import static io.valspec.core.declare.Declarations.embedsOne;
import static io.valspec.core.declare.Declarations.field;
import static io.valspec.core.declare.Declarations.required;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.valspec.core.error.SchemaNotFoundException;
import io.valspec.core.error.UnknownSchemaReferenceError;
import io.valspec.core.model.CompiledSchema;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

/** Tests for {@link CompiledSchemaRegistry}: lookup, lifecycle states, replacement and freezing. */
@DisplayName("CompiledSchemaRegistry")
class CompiledSchemaRegistryTest {

    private CompiledSchemaRegistry registry;
    private ListAppender<ILoggingEvent> logAppender;
    private Logger registryLogger;

    @BeforeEach
    void setUp() {
        registry = new CompiledSchemaRegistry();

        registryLogger = (Logger) LoggerFactory.getLogger(CompiledSchemaRegistry.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        registryLogger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        registryLogger.detachAppender(logAppender);
        logAppender.stop();
    }

    private CompiledSchema compileUser() {
        return registry.compile("user", List.of(field("first_name", "string"), field("age", "integer")));
    }

    @Nested
    class Lookup {

        @Test
        void returnsCompiledSchema() {
            CompiledSchema user = compileUser();

            assertThat(registry.lookup("user")).isSameAs(user);
            assertThat(registry.documentationOf(user)).isSameAs(user.documentationSchema());
            assertThat(registry.validationDescriptorOf(user)).isSameAs(user.validationDescriptor());
        }

        @Test
        void unknownName_throwsNotFound() {
            assertThatThrownBy(() -> registry.lookup("missing"))
                    .isInstanceOfSatisfying(
                            SchemaNotFoundException.class, e -> assertThat(e.schemaName()).isEqualTo("missing"))
                    .hasMessage("No compiled schema named 'missing'");
        }

        @Test
        void findReturnsEmptyForUnknownName() {
            assertThat(registry.find("missing")).isEmpty();
        }

        @Test
        void namesKeepCompilationOrder() {
            compileUser();
            registry.compile("index_response", embedsMany("data", "user"));
            registry.compile("json_response", embedsOne("data", "user"));

            assertThat(registry.names()).containsExactly("user", "index_response", "json_response");
            assertThat(registry.size()).isEqualTo(3);
        }
    }

    @Nested
    class Lifecycle {

        @Test
        void declaredNameIsNotYetLookedUp() {
            registry.declare("user");

            assertThat(registry.stateOf("user")).isEqualTo(SchemaState.DECLARED);
            assertThat(registry.find("user")).isEmpty();
        }

        @Test
        void compiledNameReportsCompiled() {
            compileUser();

            assertThat(registry.stateOf("user")).isEqualTo(SchemaState.COMPILED);
            assertThat(registry.stateOf("never")).isNull();
        }

        @Test
        void embeddingADeclaredButUncompiledSchema_rejected() {
            registry.declare("user");

            assertThatThrownBy(() -> registry.compile("json_response", embedsOne("data", "user")))
                    .isInstanceOf(UnknownSchemaReferenceError.class);
            assertThat(registry.stateOf("json_response")).isNull();
            assertThat(registry.find("json_response")).isEmpty();
        }

        @Test
        void failedFirstCompileOfDeclaredName_staysDeclared() {
            registry.declare("json_response");

            assertThatThrownBy(() -> registry.compile("json_response", embedsOne("data", "user")))
                    .isInstanceOf(UnknownSchemaReferenceError.class);
            assertThat(registry.stateOf("json_response")).isEqualTo(SchemaState.DECLARED);
        }

        @Test
        void failedRecompileKeepsPreviousEntry() {
            CompiledSchema user = compileUser();

            assertThatThrownBy(() -> registry.compile("user", required("role", "enum")))
                    .isInstanceOf(RuntimeException.class);

            assertThat(registry.lookup("user")).isSameAs(user);
            assertThat(registry.stateOf("user")).isEqualTo(SchemaState.COMPILED);
        }

        @Test
        void schemaCannotEmbedItselfWhileRecompiling() {
            compileUser();

            assertThatThrownBy(() -> registry.compile("user", embedsOne("self", "user")))
                    .isInstanceOf(UnknownSchemaReferenceError.class);
        }
    }

    @Nested
    class Replacement {

        @Test
        void lastWriteWins() {
            compileUser();
            CompiledSchema replacement = registry.compile("user", field("email", "string"));

            assertThat(registry.lookup("user")).isSameAs(replacement);
            assertThat(registry.lookup("user").validationDescriptor().fieldNames()).containsExactly("email");
        }

        @Test
        void replacementIsLoggedAtWarn() {
            compileUser();
            compileUser();

            List<ILoggingEvent> warnings = logAppender.list.stream()
                    .filter(e -> e.getLevel() == Level.WARN)
                    .toList();
            assertThat(warnings).hasSize(1);
            assertThat(warnings.get(0).getFormattedMessage()).isEqualTo("Replaced previously compiled schema: name=user");
        }

        @Test
        void firstCompileIsLoggedAtInfoOnly() {
            compileUser();

            assertThat(logAppender.list)
                    .extracting(ILoggingEvent::getLevel)
                    .containsOnly(Level.INFO);
            assertThat(logAppender.list.get(0).getFormattedMessage()).isEqualTo("Compiled schema: name=user, fields=2");
        }
    }

    @Nested
    class Freezing {

        @Test
        void frozenRegistryServesReads() {
            CompiledSchema user = compileUser();
            registry.freeze();

            assertThat(registry.isFrozen()).isTrue();
            assertThat(registry.lookup("user")).isSameAs(user);
            assertThat(registry.names()).containsExactly("user");
        }

        @Test
        void frozenRegistryRejectsWrites() {
            compileUser();
            registry.freeze();

            assertThatThrownBy(() -> registry.compile("other", field("a", "string")))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("frozen");
            assertThatThrownBy(() -> registry.declare("other")).isInstanceOf(IllegalStateException.class);
        }

        @Test
        void freezeIsIdempotent() {
            assertThat(registry.freeze()).isSameAs(registry.freeze());
        }

        @Test
        void namesViewIsUnmodifiable() {
            compileUser();

            assertThatThrownBy(() -> registry.names().add("x")).isInstanceOf(UnsupportedOperationException.class);
        }
    }
}
