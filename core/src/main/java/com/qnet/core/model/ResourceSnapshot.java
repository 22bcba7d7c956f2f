package com.qnet.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Declared resource usage of a node at the time of its last report.
 */
@Value
@Builder(toBuilder = true)
@With
public class ResourceSnapshot {
    /**
     * CPU utilization in percent (0 to 100).
     */
    @JsonProperty("cpuUsagePct")
    double cpuUsagePct;

    /**
     * Memory utilization in percent (0 to 100).
     */
    @JsonProperty("memUsagePct")
    double memUsagePct;

    /**
     * Observed network latency in milliseconds.
     */
    @JsonProperty("networkLatencyMs")
    double networkLatencyMs;

    @JsonCreator
    public ResourceSnapshot(
        @JsonProperty("cpuUsagePct") double cpuUsagePct,
        @JsonProperty("memUsagePct") double memUsagePct,
        @JsonProperty("networkLatencyMs") double networkLatencyMs
    ) {
        this.cpuUsagePct = cpuUsagePct;
        this.memUsagePct = memUsagePct;
        this.networkLatencyMs = networkLatencyMs;
    }

    public static ResourceSnapshot idle() {
        return new ResourceSnapshot(0.0, 0.0, 0.0);
    }
}
