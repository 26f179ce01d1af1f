package com.peargent.routing;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Portable description of a router, as written into a package file. {@code type}
 * is one of stop, round_robin, routing_agent, semantic or custom.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RouterDescriptor(String type, String name, String persona, List<String> agents) {

    public static final String STOP = "stop";
    public static final String ROUND_ROBIN = "round_robin";
    public static final String ROUTING_AGENT = "routing_agent";
    public static final String SEMANTIC = "semantic";
    public static final String CUSTOM = "custom";

    public RouterDescriptor {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Router descriptor needs a type");
        }
        agents = agents != null ? List.copyOf(agents) : null;
    }

    public static RouterDescriptor stop() {
        return new RouterDescriptor(STOP, null, null, null);
    }

    public static RouterDescriptor roundRobin(List<String> agents) {
        return new RouterDescriptor(ROUND_ROBIN, null, null, agents);
    }

    public static RouterDescriptor custom(String name) {
        return new RouterDescriptor(CUSTOM, name, null, null);
    }
}
