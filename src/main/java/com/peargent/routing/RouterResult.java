package com.peargent.routing;

import java.util.Optional;

/**
 * A routing decision: the next agent to run, or stop when {@code nextAgent} is null.
 */
public record RouterResult(String nextAgent) {

    private static final RouterResult STOP = new RouterResult(null);

    public static RouterResult next(String agentName) {
        return agentName == null ? STOP : new RouterResult(agentName);
    }

    public static RouterResult stop() { return STOP; }

    public boolean isStop() { return nextAgent == null; }

    public Optional<String> agent() { return Optional.ofNullable(nextAgent); }
}
