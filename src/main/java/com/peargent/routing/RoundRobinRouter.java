package com.peargent.routing;

import com.peargent.state.State;

import java.util.List;

/** Cycles through a fixed name list by call count. Never stops on its own. */
public class RoundRobinRouter implements Router {

    private final List<String> agentNames;

    public RoundRobinRouter(List<String> agentNames) {
        if (agentNames == null || agentNames.isEmpty()) {
            throw new IllegalArgumentException("Round-robin router needs at least one agent name");
        }
        this.agentNames = List.copyOf(agentNames);
    }

    public List<String> agentNames() { return agentNames; }

    @Override
    public RouterResult decide(State state, int callCount, LastResult lastResult) {
        return RouterResult.next(agentNames.get(Math.floorMod(callCount, agentNames.size())));
    }

    @Override
    public RouterDescriptor describe() { return RouterDescriptor.roundRobin(agentNames); }
}
