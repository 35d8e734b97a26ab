package org.openebs.events.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Control-plane service that emitted an event.
 */
public enum Component {

    CORE_AGENT("agent-core"),
    IO_ENGINE("io-engine"),
    HA_CLUSTER_AGENT("agent-ha-cluster"),
    HA_NODE_AGENT("agent-ha-node"),

    UNKNOWN("unknown");

    /** Service name the component runs as */
    private final String serviceName;

    Component(String serviceName) {
        this.serviceName = serviceName;
    }

    @JsonValue
    public String getServiceName() {
        return serviceName;
    }

    /**
     * Resolve a component from its service name, e.g. "agent-core" → CORE_AGENT.
     * Unrecognised names map to {@link #UNKNOWN}.
     */
    @JsonCreator
    public static Component fromServiceName(String serviceName) {
        if (serviceName == null) {
            return UNKNOWN;
        }
        for (Component c : values()) {
            if (c.serviceName.equals(serviceName)) {
                return c;
            }
        }
        return UNKNOWN;
    }
}
