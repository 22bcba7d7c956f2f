package com.qnet.monitor.perf;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * Aggregate view of the records inside one time window.
 */
@Value
@Builder(toBuilder = true)
public class PerformanceMetrics {
    @JsonProperty("latency")
    @Builder.Default
    LatencyPercentiles latency = LatencyPercentiles.zero();

    @JsonProperty("throughput")
    @Builder.Default
    Throughput throughput = Throughput.zero();

    /**
     * errors / (latency records + errors), 0 when nothing was recorded.
     */
    @JsonProperty("errorRate")
    double errorRate;

    /**
     * latency records / (latency records + errors), 1.0 when nothing was recorded.
     */
    @JsonProperty("availability")
    @Builder.Default
    double availability = 1.0;

    /**
     * Metrics of a window in which nothing was recorded.
     */
    public static PerformanceMetrics empty() {
        return PerformanceMetrics.builder().build();
    }
}
