package com.peargent.routing;

import com.peargent.agent.Agent;
import com.peargent.state.State;

import java.util.Map;
import java.util.Optional;

/**
 * Object-style router that keeps its own state between decisions and may consult
 * the agent registry.
 */
public interface DecisionRouter {

    Optional<String> decide(State state, LastResult lastResult);

    default void bindAgents(Map<String, Agent> agents) {}

    default RouterDescriptor describe() {
        return RouterDescriptor.custom(null);
    }
}
