package io.github.drompincen.screencontrol.runtime.tools;

import io.github.drompincen.screencontrol.protocol.api.ToolCategory;
import io.github.drompincen.screencontrol.protocol.api.ToolDefinition;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ToolRegistryTest {

    @Test
    void catalogNamesAreUnique() {
        var names = ToolCatalog.definitions().stream().map(ToolDefinition::name).toList();

        assertThat(names).doesNotHaveDuplicates();
        assertThat(names).contains("screenshot", "fs_patch", "shell_exec", "shell_read_output", "browser_navigate");
    }

    @Test
    void definitionsForKeepsCatalogOrder() {
        ToolRegistry registry = new ToolRegistry(ToolSettings.defaults());

        var defs = registry.definitionsFor(EnumSet.allOf(ToolCategory.class));

        assertThat(defs).hasSameSizeAs(ToolCatalog.definitions());
        assertThat(defs.get(0).category()).isEqualTo(ToolCategory.GUI);
        assertThat(defs.get(defs.size() - 1).category()).isEqualTo(ToolCategory.BROWSER);
    }

    @Test
    void definitionsForFiltersByCategory() {
        ToolRegistry registry = new ToolRegistry(ToolSettings.defaults());

        var defs = registry.definitionsFor(EnumSet.of(ToolCategory.SHELL));

        assertThat(defs).isNotEmpty();
        assertThat(defs).allSatisfy(d -> assertThat(d.name()).startsWith("shell_"));
    }

    @Test
    void describeFindsKnownToolOnly() {
        ToolRegistry registry = new ToolRegistry(ToolSettings.defaults());

        assertThat(registry.describe("shell_send_input")).hasValueSatisfying(d ->
                assertThat(d.requiredParameters()).containsExactly("session_id", "input"));
        assertThat(registry.describe("nonexistent")).isEmpty();
        assertThat(registry.describe(null)).isEmpty();
    }

    @Test
    void disabledToolsAndCategoriesAreDropped() {
        ToolRegistry registry = new ToolRegistry(new ToolSettings(Set.of(ToolCategory.BROWSER), Set.of("fs_delete")));

        assertThat(registry.describe("fs_delete")).isEmpty();
        assertThat(registry.describe("fs_read")).isPresent();
        assertThat(registry.all()).noneMatch(d -> d.category() == ToolCategory.BROWSER);
    }

    @Test
    void toolsWithoutDedicatedDescriptionGetGenericOne() {
        ToolRegistry registry = new ToolRegistry(ToolSettings.defaults());

        assertThat(registry.describe("browser_hover")).hasValueSatisfying(d ->
                assertThat(d.description()).isEqualTo("Execute browser_hover tool"));
    }
}
