package com.peargent.routing;

import com.peargent.agent.Agent;
import com.peargent.state.State;

import java.util.List;
import java.util.Map;

public final class Routers {

    private static final Router STOP = new Router() {
        @Override
        public RouterResult decide(State state, int callCount, LastResult lastResult) {
            return RouterResult.stop();
        }

        @Override
        public RouterDescriptor describe() { return RouterDescriptor.stop(); }
    };

    private Routers() {}

    /** Router used when none is configured: stops on the first decision. */
    public static Router stop() { return STOP; }

    public static Router roundRobin(List<String> agentNames) {
        return new RoundRobinRouter(agentNames);
    }

    public static Router adapt(DecisionRouter decisionRouter) {
        return new Adapter(decisionRouter);
    }

    /** Gives a custom router the name it is written under and looked up by when loading a package. */
    public static Router named(String name, Router router) {
        return new Named(name, router);
    }

    public static Router named(String name, DecisionRouter decisionRouter) {
        return new Named(name, adapt(decisionRouter));
    }

    static final class Named implements Router {
        private final String name;
        private final Router delegate;

        Named(String name, Router delegate) {
            if (name == null || name.isBlank()) throw new IllegalArgumentException("Router name must not be blank");
            if (delegate == null) throw new IllegalArgumentException("router must not be null");
            this.name = name;
            this.delegate = delegate;
        }

        @Override
        public RouterResult decide(State state, int callCount, LastResult lastResult) {
            return delegate.decide(state, callCount, lastResult);
        }

        @Override
        public void bindAgents(Map<String, Agent> agents) { delegate.bindAgents(agents); }

        @Override
        public RouterDescriptor describe() { return RouterDescriptor.custom(name); }
    }

    static final class Adapter implements Router {
        private final DecisionRouter delegate;

        Adapter(DecisionRouter delegate) {
            if (delegate == null) throw new IllegalArgumentException("decisionRouter must not be null");
            this.delegate = delegate;
        }

        DecisionRouter delegate() { return delegate; }

        @Override
        public RouterResult decide(State state, int callCount, LastResult lastResult) {
            var choice = delegate.decide(state, lastResult);
            return RouterResult.next(choice != null ? choice.orElse(null) : null);
        }

        @Override
        public void bindAgents(Map<String, Agent> agents) { delegate.bindAgents(agents); }

        @Override
        public RouterDescriptor describe() { return delegate.describe(); }
    }
}
