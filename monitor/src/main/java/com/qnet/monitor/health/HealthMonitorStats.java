package com.qnet.monitor.health;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * Summary of the node population after a health check cycle.
 */
@Value
@Builder(toBuilder = true)
public class HealthMonitorStats {
    @JsonProperty("totalNodes")
    int totalNodes;

    @JsonProperty("activeNodes")
    int activeNodes;

    @JsonProperty("degradedNodes")
    int degradedNodes;

    @JsonProperty("failedNodes")
    int failedNodes;

    /**
     * Mean probe response time over each node's recent checks.
     */
    @JsonProperty("averageResponseTimeMs")
    double averageResponseTimeMs;

    /**
     * Share of active nodes, 0-100. Zero when no nodes are known.
     */
    @JsonProperty("overallHealthScore")
    double overallHealthScore;

    @JsonProperty("lastUpdateMs")
    long lastUpdateMs;

    public static HealthMonitorStats empty(long nowMs) {
        return HealthMonitorStats.builder().lastUpdateMs(nowMs).build();
    }
}
