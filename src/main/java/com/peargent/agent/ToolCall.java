package com.peargent.agent;

import java.util.Map;

public record ToolCall(String name, Map<String, Object> args) {
    public ToolCall {
        args = args != null ? args : Map.of();
    }
}
