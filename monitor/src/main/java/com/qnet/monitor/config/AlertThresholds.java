package com.qnet.monitor.config;

import lombok.Builder;
import lombok.Value;

/**
 * Per-node thresholds evaluated after every successful health probe.
 */
@Value
@Builder(toBuilder = true)
public class AlertThresholds {
    /**
     * Probe response time above which a latency alert fires (milliseconds).
     */
    @Builder.Default
    double responseTimeMs = 2000;

    /**
     * Node-reported error ratio (errors / requests) above which an error-rate alert fires.
     */
    @Builder.Default
    double errorRate = 0.05;

    @Builder.Default
    double cpuUsagePct = 80;

    @Builder.Default
    double memoryUsagePct = 85;

    public static AlertThresholds defaults() {
        return AlertThresholds.builder().build();
    }
}
