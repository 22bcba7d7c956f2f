package com.qnet.monitor.health;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of one health check.
 */
public enum HealthCheckStatus {
    ACTIVE("active"),
    ERROR("error");

    private final String wireName;

    HealthCheckStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
