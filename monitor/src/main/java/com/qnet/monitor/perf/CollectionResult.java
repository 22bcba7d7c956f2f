package com.qnet.monitor.perf;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.qnet.core.alert.Alert;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Metrics of the current window together with the alerts they trigger.
 */
@Value
@Builder(toBuilder = true)
public class CollectionResult {
    @JsonProperty("metrics")
    PerformanceMetrics metrics;

    @JsonProperty("alerts")
    List<Alert> alerts;

    @JsonProperty("timestampMs")
    long timestampMs;

    @JsonProperty("collectionDurationMs")
    double collectionDurationMs;
}
