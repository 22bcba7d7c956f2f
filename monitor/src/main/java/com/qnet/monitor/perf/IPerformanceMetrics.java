package com.qnet.monitor.perf;

import java.util.List;

/**
 * Records operation outcomes and aggregates them over time windows.
 */
public interface IPerformanceMetrics {

    void recordLatency(String operation, double latencyMs);

    void recordThroughput(String operation, long requestCount, long dataBytes, long durationMs);

    void recordError(String operation, Throwable error);

    /**
     * Records a failure reported by a caller that has no throwable at hand.
     */
    void recordError(String operation, String errorType, String message);

    /**
     * Aggregates the records of the trailing metrics window.
     */
    PerformanceMetrics collectMetrics();

    /**
     * Same as {@link #collectMetrics()} plus the alerts the metrics trigger against the
     * configured thresholds. The alerts are returned, not recorded.
     */
    CollectionResult collectMetricsWithAlerting();

    ValidationResult validatePerformance(PerformanceMetrics metrics, PerformanceThresholds thresholds);

    /**
     * Epoch-aligned buckets covering {@code [startMs, endMs]}, one entry per bucket.
     */
    List<MetricsBucket> getHistoricalMetrics(long startMs, long endMs);
}
