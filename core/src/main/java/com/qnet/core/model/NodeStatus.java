package com.qnet.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle status of a backend node as seen by the health monitor.
 */
public enum NodeStatus {
    /**
     * Node answered its last probe and reported itself healthy.
     */
    ACTIVE("active"),

    /**
     * Node answered its last probe but reported itself unhealthy.
     */
    DEGRADED("degraded"),

    /**
     * Node could not be probed (timeout or failure).
     */
    FAILED("failed");

    private final String wireName;

    NodeStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
