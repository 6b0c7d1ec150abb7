package io.toolbridge.core.tool;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.toolbridge.core.schema.SchemaDerivationException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ToolRegistryTest {
    private static final String ECHO_DOC = "Echo the text.\n\nMCP Parameters:\n  text - text to echo";

    @Test
    void shouldRegisterAndResolveTool() throws Exception {
        ToolRegistry registry = new ToolRegistry();
        registry.register(ToolHandler.singleArgument("text", ECHO_DOC, text -> text), "echo", "Echoes input");

        ToolRegistration registration = registry.lookup("echo").orElseThrow();
        assertThat(registration.description()).isEqualTo("Echoes input");
        assertThat(registration.inputSchema()).containsEntry("required", List.of("text"));
        assertThat(registration.annotations().isEmpty()).isTrue();
        ToolHandler.SingleArgument handler = (ToolHandler.SingleArgument) registration.handler();
        assertThat(handler.function().apply("ok")).isEqualTo("ok");
    }

    @Test
    void zeroArgumentHandlerGetsEmptyObjectSchema() {
        ToolRegistry registry = new ToolRegistry();

        ToolRegistration registration = registry.register(ToolHandler.noArgument(() -> "pong"), "ping", "Ping");

        assertThat(registration.inputSchema()).isEqualTo(Map.of("type", "object"));
    }

    @Test
    void reRegistrationReplacesPreviousEntry() {
        ToolRegistry registry = new ToolRegistry();
        registry.register(ToolHandler.noArgument(() -> "one"), "tool", "First");
        registry.register(ToolHandler.noArgument(() -> "two"), "tool", "Second", ToolAnnotations.titled("Tool"));

        assertThat(registry.size()).isEqualTo(1);
        assertThat(registry.lookup("tool").orElseThrow().description()).isEqualTo("Second");
        assertThat(registry.lookup("tool").orElseThrow().annotations().title()).isEqualTo("Tool");
    }

    @Test
    void unregisterReportsWhetherAnythingWasRemoved() {
        ToolRegistry registry = new ToolRegistry();
        registry.register(ToolHandler.noArgument(() -> "x"), "tool", "Tool");

        assertThat(registry.unregister("tool")).isTrue();
        assertThat(registry.unregister("tool")).isFalse();
        assertThat(registry.unregister(null)).isFalse();
        assertThat(registry.lookup("tool")).isEmpty();
        assertThat(registry.isEmpty()).isTrue();
    }

    @Test
    void listKeepsRegistrationOrderAndIsASnapshot() {
        ToolRegistry registry = new ToolRegistry();
        registry.register(ToolHandler.noArgument(() -> "b"), "b", "B");
        registry.register(ToolHandler.noArgument(() -> "a"), "a", "A");

        var snapshot = registry.list();
        registry.unregister("b");

        assertThat(snapshot).extracting(ToolRegistration::id).containsExactly("b", "a");
        assertThat(registry.list()).extracting(ToolRegistration::id).containsExactly("a");
    }

    @Test
    void rejectsMissingHandlerIdOrDescription() {
        ToolRegistry registry = new ToolRegistry();
        ToolHandler handler = ToolHandler.noArgument(() -> "x");

        assertThatThrownBy(() -> registry.register(null, "tool", "Tool"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("handler");
        assertThatThrownBy(() -> registry.register(handler, " ", "Tool"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("id");
        assertThatThrownBy(() -> registry.register(handler, "tool", null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("description");
        assertThat(registry.isEmpty()).isTrue();
    }

    @Test
    void rejectsSingleArgumentHandlerWithoutParameterSection() {
        ToolRegistry registry = new ToolRegistry();

        assertThatThrownBy(() -> registry.register(
            ToolHandler.singleArgument("text", "Echo the text.", text -> text),
            "echo",
            "Echoes input"
        )).isInstanceOf(SchemaDerivationException.class);
        assertThat(registry.lookup("echo")).isEmpty();
    }
}
