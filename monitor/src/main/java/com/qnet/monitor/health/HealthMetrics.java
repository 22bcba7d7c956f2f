package com.qnet.monitor.health;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.qnet.core.model.ResourceSnapshot;
import lombok.Builder;
import lombok.Value;

/**
 * Metrics a node reports about itself in a health probe.
 */
@Value
@Builder(toBuilder = true)
public class HealthMetrics {
    @JsonProperty("uptimePct")
    double uptimePct;

    /**
     * CPU utilization percent (0-100).
     */
    @JsonProperty("cpuUsagePct")
    double cpuUsagePct;

    /**
     * Memory utilization percent (0-100).
     */
    @JsonProperty("memoryUsagePct")
    double memoryUsagePct;

    @JsonProperty("networkLatencyMs")
    double networkLatencyMs;

    @JsonProperty("requestCount")
    long requestCount;

    @JsonProperty("errorCount")
    long errorCount;

    @JsonProperty("lastError")
    String lastError;

    @JsonCreator
    public HealthMetrics(
        @JsonProperty("uptimePct") double uptimePct,
        @JsonProperty("cpuUsagePct") double cpuUsagePct,
        @JsonProperty("memoryUsagePct") double memoryUsagePct,
        @JsonProperty("networkLatencyMs") double networkLatencyMs,
        @JsonProperty("requestCount") long requestCount,
        @JsonProperty("errorCount") long errorCount,
        @JsonProperty("lastError") String lastError
    ) {
        this.uptimePct = uptimePct;
        this.cpuUsagePct = cpuUsagePct;
        this.memoryUsagePct = memoryUsagePct;
        this.networkLatencyMs = networkLatencyMs;
        this.requestCount = requestCount;
        this.errorCount = errorCount;
        this.lastError = lastError;
    }

    public static HealthMetrics empty() {
        return new HealthMetrics(0, 0, 0, 0, 0, 0, null);
    }

    /**
     * Errors per request as reported by the node, 0 when it served nothing.
     */
    @JsonIgnore
    public double errorRate() {
        return requestCount > 0 ? (double) errorCount / requestCount : 0.0;
    }

    public ResourceSnapshot toResourceSnapshot() {
        return ResourceSnapshot.builder()
            .cpuUsagePct(cpuUsagePct)
            .memUsagePct(memoryUsagePct)
            .networkLatencyMs(networkLatencyMs)
            .build();
    }
}
