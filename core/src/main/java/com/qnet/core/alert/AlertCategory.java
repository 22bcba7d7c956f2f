package com.qnet.core.alert;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What kind of signal crossed its threshold.
 */
public enum AlertCategory {
    LATENCY("latency"),
    THROUGHPUT("throughput"),
    ERROR_RATE("error_rate"),
    AVAILABILITY("availability"),
    RESOURCE("resource");

    private final String wireName;

    AlertCategory(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
