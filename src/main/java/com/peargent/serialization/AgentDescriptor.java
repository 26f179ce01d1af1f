package com.peargent.serialization;

import java.util.List;

public record AgentDescriptor(
    String name,
    String description,
    String persona,
    List<String> tools,
    Boolean tracing,
    Integer maxToolRounds,
    Double modelTimeout
) {
    public AgentDescriptor {
        tools = tools != null ? List.copyOf(tools) : List.of();
    }
}
