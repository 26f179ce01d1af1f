package com.peargent.shared.config;

import java.time.Duration;

/**
 * @param modelTimeoutSeconds null means model calls are not time limited
 */
public record AgentSettings(int maxToolRounds, Double modelTimeoutSeconds) {
    public AgentSettings {
        if (maxToolRounds < 0) throw new IllegalArgumentException("maxToolRounds must be >= 0");
    }

    public Duration modelTimeout() {
        return modelTimeoutSeconds != null ? Duration.ofMillis(Math.round(modelTimeoutSeconds * 1000)) : null;
    }

    public static AgentSettings defaults() {
        return new AgentSettings(5, null);
    }
}
