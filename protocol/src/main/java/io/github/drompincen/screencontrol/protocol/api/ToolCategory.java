package io.github.drompincen.screencontrol.protocol.api;

import java.util.Arrays;
import java.util.Optional;

public enum ToolCategory {
    GUI("gui", "GUI Tools"),
    FILESYSTEM("filesystem", "Filesystem Tools"),
    SHELL("shell", "Shell Tools"),
    BROWSER("browser", "Browser Tools");

    private final String id;
    private final String label;

    ToolCategory(String id, String label) {
        this.id = id;
        this.label = label;
    }

    public String id() { return id; }

    public String label() { return label; }

    /**
     * Owning category of a tool, derived from its name prefix. Anything without a
     * known prefix belongs to the automation (GUI) provider.
     */
    public static ToolCategory forToolName(String toolName) {
        if (toolName.startsWith("fs_")) return FILESYSTEM;
        if (toolName.startsWith("shell_")) return SHELL;
        if (toolName.startsWith("browser_")) return BROWSER;
        return GUI;
    }

    public static Optional<ToolCategory> fromId(String id) {
        return Arrays.stream(values())
                .filter(c -> c.id.equalsIgnoreCase(id) || c.name().equalsIgnoreCase(id))
                .findFirst();
    }
}
