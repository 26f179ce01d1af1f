package com.peargent.routing;

import com.peargent.agent.Agent;
import com.peargent.state.State;

import java.util.Map;

/**
 * Decides which agent acts next. Plain lambdas implement this directly; stateful
 * {@link DecisionRouter}s are adapted through {@link Routers#adapt}. Routers do not
 * validate names, the pool does.
 */
@FunctionalInterface
public interface Router {

    RouterResult decide(State state, int callCount, LastResult lastResult);

    /** Called by the pool with the agent registry before each run loop starts. */
    default void bindAgents(Map<String, Agent> agents) {}

    /**
     * Unnamed custom router by default. Wrap with {@link Routers#named(String, Router)}
     * to give it a name a package file can refer to.
     */
    default RouterDescriptor describe() {
        return RouterDescriptor.custom(null);
    }
}
