package com.peargent.serialization;

import java.util.List;

/**
 * Self-contained description of a pool: its tools, its agents and the pool wiring.
 * Tools are listed once even when several agents share them.
 */
public record PearPackage(List<ToolDescriptor> tools, List<AgentDescriptor> agents, PoolDescriptor pool) {
    public PearPackage {
        tools = tools != null ? List.copyOf(tools) : List.of();
        agents = agents != null ? List.copyOf(agents) : List.of();
    }
}
