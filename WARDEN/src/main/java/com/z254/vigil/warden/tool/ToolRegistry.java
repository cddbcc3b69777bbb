package com.z254.vigil.warden.tool;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Typed registry of remediation tools keyed by tool name.
 * Lookups of unknown names return empty; the gateway denies such requests.
 */
@Slf4j
@Component
public class ToolRegistry {

    private final Map<String, RemediationTool> tools = new ConcurrentHashMap<>();

    public ToolRegistry(List<RemediationTool> toolList) {
        toolList.forEach(this::register);
    }

    /**
     * Register a tool.
     *
     * @throws IllegalStateException if a tool with the same name is already registered
     */
    public void register(RemediationTool tool) {
        String name = tool.getName();
        RemediationTool previous = tools.putIfAbsent(name, tool);
        if (previous != null && previous != tool) {
            throw new IllegalStateException("Duplicate remediation tool: " + name);
        }
        log.info("Registered remediation tool: {} ({})", name, tool.getMetadata().getSafetyLevel());
    }

    public Optional<RemediationTool> getTool(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(tools.get(name));
    }

    public Collection<RemediationTool> getAllTools() {
        return Collections.unmodifiableCollection(tools.values());
    }

    public int getToolCount() {
        return tools.size();
    }
}
