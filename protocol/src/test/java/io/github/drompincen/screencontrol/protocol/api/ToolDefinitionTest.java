package io.github.drompincen.screencontrol.protocol.api;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ToolDefinitionTest {

    @Test
    void inputSchemaListsPropertiesInDeclarationOrder() {
        Map<String, ParameterSpec> params = new LinkedHashMap<>();
        params.put("x", ParameterSpec.number("X coordinate"));
        params.put("y", ParameterSpec.number("Y coordinate"));
        params.put("button", ParameterSpec.oneOf("Mouse button", "left", "right"));
        ToolDefinition def = new ToolDefinition("click", "Click", params, List.of("x", "y"), null);

        var schema = def.inputSchema();

        assertThat(schema.get("type").asText()).isEqualTo("object");
        assertThat(schema.get("properties").fieldNames()).toIterable().containsExactly("x", "y", "button");
        assertThat(schema.get("properties").get("button").get("enum").get(1).asText()).isEqualTo("right");
        assertThat(schema.get("required").get(0).asText()).isEqualTo("x");
        assertThat(schema.get("required").get(1).asText()).isEqualTo("y");
    }

    @Test
    void requiredIsOmittedWhenNothingIsRequired() {
        ToolDefinition def = new ToolDefinition("getMousePosition", "Get position", Map.of(), List.of(), null);

        assertThat(def.inputSchema().has("required")).isFalse();
        assertThat(def.inputSchema().get("properties").isEmpty()).isTrue();
    }

    @Test
    void categoryDefaultsFromNamePrefix() {
        assertThat(new ToolDefinition("fs_read", "d", null, null, null).category()).isEqualTo(ToolCategory.FILESYSTEM);
        assertThat(new ToolDefinition("shell_exec", "d", null, null, null).category()).isEqualTo(ToolCategory.SHELL);
        assertThat(new ToolDefinition("browser_navigate", "d", null, null, null).category()).isEqualTo(ToolCategory.BROWSER);
        assertThat(new ToolDefinition("typeText", "d", null, null, null).category()).isEqualTo(ToolCategory.GUI);
    }

    @Test
    void parametersAreImmutable() {
        Map<String, ParameterSpec> params = new LinkedHashMap<>();
        params.put("path", ParameterSpec.string("File path"));
        ToolDefinition def = new ToolDefinition("fs_read", "Read a file", params, List.of("path"), null);
        params.put("extra", ParameterSpec.string("late addition"));

        assertThat(def.parameters()).containsOnlyKeys("path");
        assertThatThrownBy(() -> def.requiredParameters().add("x")).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void mcpToolCarriesNameDescriptionAndSchema() {
        ToolDefinition def = new ToolDefinition("fs_read", "Read a file",
                Map.of("path", ParameterSpec.string("File path")), List.of("path"), ToolCategory.FILESYSTEM);

        var tool = def.toMcpTool();

        assertThat(tool.get("name").asText()).isEqualTo("fs_read");
        assertThat(tool.get("description").asText()).isEqualTo("Read a file");
        assertThat(tool.get("inputSchema").get("properties").has("path")).isTrue();
    }

    @Test
    void blankNameIsRejected() {
        assertThatThrownBy(() -> new ToolDefinition(" ", "d", null, null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
