package com.peargent.shared.config;

public record PeargentConfig(
    PoolSettings pool,
    HistoryConfig history,
    ToolsConfig tools,
    AgentSettings agent
) {
    public static PeargentConfig defaults() {
        return new PeargentConfig(PoolSettings.defaults(), HistoryConfig.defaults(),
                ToolsConfig.standard(), AgentSettings.defaults());
    }
}
