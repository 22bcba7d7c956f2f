package com.qnet.monitor.perf;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Service-level limits checked by {@link ThresholdValidator}.
 */
@Value
@Builder(toBuilder = true)
public class PerformanceThresholds {
    @JsonProperty("p50LatencyMs")
    @Builder.Default
    double p50LatencyMs = 1000;

    @JsonProperty("p95LatencyMs")
    @Builder.Default
    double p95LatencyMs = 2000;

    @JsonProperty("p99LatencyMs")
    @Builder.Default
    double p99LatencyMs = 5000;

    @JsonProperty("minRequestsPerSecond")
    @Builder.Default
    double minRequestsPerSecond = 100;

    /**
     * 1 MiB/s.
     */
    @JsonProperty("minBytesPerSecond")
    @Builder.Default
    double minBytesPerSecond = 1024 * 1024;

    @JsonProperty("maxErrorRate")
    @Builder.Default
    double maxErrorRate = 0.01;

    @JsonProperty("minAvailability")
    @Builder.Default
    double minAvailability = 0.99;

    public static PerformanceThresholds defaults() {
        return PerformanceThresholds.builder().build();
    }

    public List<String> problems() {
        List<String> problems = new ArrayList<>();
        if (p50LatencyMs <= 0 || p95LatencyMs <= 0 || p99LatencyMs <= 0) {
            problems.add("performanceThresholds latency limits must be > 0");
        }
        if (minRequestsPerSecond < 0 || minBytesPerSecond < 0) {
            problems.add("performanceThresholds throughput minimums must be >= 0");
        }
        if (maxErrorRate < 0 || maxErrorRate > 1) {
            problems.add("performanceThresholds.maxErrorRate must be within [0, 1]");
        }
        if (minAvailability < 0 || minAvailability > 1) {
            problems.add("performanceThresholds.minAvailability must be within [0, 1]");
        }
        return problems;
    }
}
