package com.peargent.shared.error;

/**
 * The router selected an agent the pool does not know. Fatal for the run.
 */
public class RoutingException extends PeargentException {

    private final String agentName;

    public RoutingException(String agentName) {
        super("Router selected unknown agent: '" + agentName + "'");
        this.agentName = agentName;
    }

    public String agentName() {
        return agentName;
    }
}
