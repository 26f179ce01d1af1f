package com.peargent.pool;

import java.util.List;

/**
 * One step of an observed run. {@code agent} is null for pool-level events,
 * {@code text} carries the input, a chunk, an agent output or the final result.
 */
public record PoolEvent(Type type, String agent, String text, List<String> toolsUsed) {

    public enum Type { POOL_START, AGENT_START, CHUNK, AGENT_END, POOL_END }

    public PoolEvent {
        toolsUsed = toolsUsed != null ? List.copyOf(toolsUsed) : List.of();
    }

    static PoolEvent poolStart(String input) { return new PoolEvent(Type.POOL_START, null, input, null); }

    static PoolEvent agentStart(String agent, String input) { return new PoolEvent(Type.AGENT_START, agent, input, null); }

    static PoolEvent chunk(String agent, String text) { return new PoolEvent(Type.CHUNK, agent, text, null); }

    static PoolEvent agentEnd(String agent, String output, List<String> toolsUsed) {
        return new PoolEvent(Type.AGENT_END, agent, output, toolsUsed);
    }

    static PoolEvent poolEnd(String result) { return new PoolEvent(Type.POOL_END, null, result, null); }
}
