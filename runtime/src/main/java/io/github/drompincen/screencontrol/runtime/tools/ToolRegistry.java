package io.github.drompincen.screencontrol.runtime.tools;

import io.github.drompincen.screencontrol.protocol.api.ToolCategory;
import io.github.drompincen.screencontrol.protocol.api.ToolDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Read-only view over {@link ToolCatalog} minus the tools disabled by configuration.
 * Availability of categories is passed in by the caller, so the registry itself holds
 * no mutable state.
 */
@Component
public class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);
    private final Map<String, ToolDefinition> tools;

    @Autowired
    public ToolRegistry(ToolSettings settings) {
        this(ToolCatalog.definitions(), settings);
    }

    ToolRegistry(List<ToolDefinition> definitions, ToolSettings settings) {
        Map<String, ToolDefinition> enabled = new LinkedHashMap<>();
        for (ToolDefinition def : definitions) {
            if (settings.isEnabled(def.name(), def.category())) {
                enabled.put(def.name(), def);
            } else {
                log.debug("Tool disabled by configuration: {}", def.name());
            }
        }
        this.tools = Collections.unmodifiableMap(enabled);
        log.info("Registered {} tools ({} disabled)", tools.size(), definitions.size() - tools.size());
    }

    public List<ToolDefinition> definitionsFor(Set<ToolCategory> categories) {
        return tools.values().stream()
                .filter(def -> categories.contains(def.category()))
                .collect(Collectors.toList());
    }

    public Optional<ToolDefinition> describe(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(tools.get(name));
    }

    public Collection<ToolDefinition> all() {
        return tools.values();
    }
}
