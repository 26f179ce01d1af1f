package com.peargent.tools;

import com.peargent.shared.config.ToolsConfig;

import java.util.Set;

/**
 * Builds a {@link ToolRegistry} holding exactly the built-in tools a configuration
 * enables. Nothing is registered implicitly.
 */
public class BuiltinTools {

    public static final Set<String> AVAILABLE = Set.of(HttpRequestTool.NAME);

    public static ToolRegistry registry(ToolsConfig config) {
        var registry = new ToolRegistry();
        for (var name : config.builtin()) {
            registry.register(create(name, config));
        }
        return registry;
    }

    public static Tool create(String name, ToolsConfig config) {
        return switch (name) {
            case HttpRequestTool.NAME -> HttpRequestTool.create(config.httpRequest(), config.defaults());
            default -> throw new IllegalArgumentException(
                    "Tool '" + name + "' not found in built-in tools " + AVAILABLE);
        };
    }
}
