package com.qnet.core.alert;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Alert severity, ordered from least to most severe.
 */
public enum AlertSeverity {
    WARNING("warning"),
    ERROR("error"),
    CRITICAL("critical");

    private final String wireName;

    AlertSeverity(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
