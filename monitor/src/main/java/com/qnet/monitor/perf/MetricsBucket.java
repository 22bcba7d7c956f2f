package com.qnet.monitor.perf;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Metrics of the half-open interval {@code [bucketStartMs, bucketStartMs + bucketWidthMs)}.
 */
@Value
public class MetricsBucket {
    @JsonProperty("bucketStartMs")
    long bucketStartMs;

    @JsonProperty("bucketWidthMs")
    long bucketWidthMs;

    @JsonProperty("metrics")
    PerformanceMetrics metrics;
}
