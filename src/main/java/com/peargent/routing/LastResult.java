package com.peargent.routing;

import java.util.List;

public record LastResult(String agent, String output, List<String> toolsUsed) {
    public LastResult {
        toolsUsed = toolsUsed != null ? List.copyOf(toolsUsed) : List.of();
    }
}
