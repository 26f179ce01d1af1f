package com.peargent.tools;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Explicit name-to-tool registry, kept in registration order. Built from configuration
 * by {@link BuiltinTools} or from a package file by the package loader.
 */
public class ToolRegistry {
    private final Map<String, Tool> tools = new LinkedHashMap<>();

    /** @throws IllegalArgumentException if a tool with the same name is already registered */
    public ToolRegistry register(Tool tool) {
        var existing = tools.putIfAbsent(tool.name(), tool);
        if (existing != null) {
            throw new IllegalArgumentException("Tool '" + tool.name() + "' is already registered");
        }
        return this;
    }

    public Optional<Tool> find(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    public List<String> names() {
        return List.copyOf(tools.keySet());
    }
}
