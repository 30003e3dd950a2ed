package io.github.drompincen.screencontrol.runtime.tools;

import io.github.drompincen.screencontrol.protocol.api.ToolCategory;

import java.util.Set;

public record ToolSettings(
        Set<ToolCategory> disabledCategories,
        Set<String> disabledTools
) {
    public ToolSettings {
        disabledCategories = disabledCategories == null ? Set.of() : Set.copyOf(disabledCategories);
        disabledTools = disabledTools == null ? Set.of() : Set.copyOf(disabledTools);
    }

    public static ToolSettings defaults() {
        return new ToolSettings(Set.of(), Set.of());
    }

    public boolean isEnabled(String toolName, ToolCategory category) {
        return !disabledCategories.contains(category) && !disabledTools.contains(toolName);
    }
}
