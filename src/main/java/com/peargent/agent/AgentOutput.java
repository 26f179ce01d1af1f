package com.peargent.agent;

import java.util.List;

/**
 * Result of one agent turn. {@code toolsUsed} lists tool names in invocation order.
 */
public record AgentOutput(String output, List<String> toolsUsed) {
    public AgentOutput {
        output = output != null ? output : "";
        toolsUsed = toolsUsed != null ? List.copyOf(toolsUsed) : List.of();
    }
}
