package com.qnet.monitor.perf;

import com.qnet.core.alert.Alert;
import com.qnet.core.metrics.MetricsNames;
import com.qnet.core.metrics.MetricsTags;
import com.qnet.monitor.alert.AlertHistory;
import com.qnet.monitor.config.MonitorConfig;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * In-memory performance metrics store.
 * <p>
 * Callers append latency, throughput and error records per operation. Aggregation is done on
 * demand over the trailing window ({@link #collectMetrics()}) or over epoch-aligned buckets
 * ({@link #getHistoricalMetrics(long, long)}). When started, a ticker validates the current
 * window every metrics interval, records the resulting alerts and purges records past retention.
 * </p>
 */
public class PerformanceMetricsService implements IPerformanceMetrics {
    private static final Logger log = LoggerFactory.getLogger(PerformanceMetricsService.class);

    private static final int MAX_HISTORY_BUCKETS = 10_000;

    /**
     * Distinct operation names that get their own meter tag; later names share {@link #OTHER_OPERATION}.
     */
    static final int MAX_TAGGED_OPERATIONS = 50;
    static final String OTHER_OPERATION = "other";

    private final Queue<LatencyRecord> latencyRecords = new ConcurrentLinkedQueue<>();
    private final Queue<ThroughputRecord> throughputRecords = new ConcurrentLinkedQueue<>();
    private final Queue<ErrorRecord> errorRecords = new ConcurrentLinkedQueue<>();

    private final AlertHistory alertHistory;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final ThresholdValidator validator;
    private final AtomicBoolean monitoring = new AtomicBoolean(false);
    private final Set<String> taggedOperations = ConcurrentHashMap.newKeySet();

    private volatile MonitorConfig config;
    private volatile Disposable ticker;

    public PerformanceMetricsService(MonitorConfig config, AlertHistory alertHistory, MeterRegistry meterRegistry) {
        this(config, alertHistory, meterRegistry, Clock.systemUTC());
    }

    public PerformanceMetricsService(MonitorConfig config,
                                     AlertHistory alertHistory,
                                     MeterRegistry meterRegistry,
                                     Clock clock) {
        this.config = config.validate();
        this.alertHistory = alertHistory;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.validator = new ThresholdValidator(clock);
    }

    // ========== Recording ==========

    @Override
    public void recordLatency(String operation, double latencyMs) {
        latencyRecords.add(new LatencyRecord(operation, latencyMs, clock.millis()));

        meterRegistry.timer(MetricsNames.PERF_OPERATION_LATENCY, MetricsTags.OPERATION, operationTag(operation))
            .record((long) (latencyMs * 1_000_000), TimeUnit.NANOSECONDS);
    }

    @Override
    public void recordThroughput(String operation, long requestCount, long dataBytes, long durationMs) {
        throughputRecords.add(new ThroughputRecord(operation, requestCount, dataBytes, durationMs, clock.millis()));

        meterRegistry.counter(MetricsNames.PERF_OPERATION_BYTES_TOTAL, MetricsTags.OPERATION, operationTag(operation))
            .increment(dataBytes);
    }

    @Override
    public void recordError(String operation, Throwable error) {
        recordError(operation,
            error != null ? error.getClass().getSimpleName() : "UnknownError",
            error != null ? error.getMessage() : null);
    }

    @Override
    public void recordError(String operation, String errorType, String message) {
        errorRecords.add(new ErrorRecord(operation, errorType, message, clock.millis()));

        meterRegistry.counter(MetricsNames.PERF_OPERATION_ERRORS_TOTAL, MetricsTags.OPERATION, operationTag(operation))
            .increment();
        log.debug("Recorded error for operation {}: {} {}", operation, errorType, message);
    }

    private String operationTag(String operation) {
        if (taggedOperations.contains(operation)) {
            return operation;
        }
        synchronized (taggedOperations) {
            if (taggedOperations.contains(operation) || taggedOperations.size() < MAX_TAGGED_OPERATIONS) {
                taggedOperations.add(operation);
                return operation;
            }
        }
        log.debug("Operation tag limit of {} reached, metering {} as {}", MAX_TAGGED_OPERATIONS, operation, OTHER_OPERATION);
        return OTHER_OPERATION;
    }

    // ========== Aggregation ==========

    @Override
    public PerformanceMetrics collectMetrics() {
        long now = clock.millis();
        long windowMs = config.getMetricsWindow().toMillis();
        return compute(
            filter(latencyRecords, now - windowMs, now),
            filter(throughputRecords, now - windowMs, now),
            filter(errorRecords, now - windowMs, now),
            windowMs
        );
    }

    @Override
    public CollectionResult collectMetricsWithAlerting() {
        long startNanos = System.nanoTime();
        PerformanceMetrics metrics = collectMetrics();
        ValidationResult validation = validator.validate(metrics, config.getPerformanceThresholds());

        return CollectionResult.builder()
            .metrics(metrics)
            .alerts(validation.getAlerts())
            .timestampMs(clock.millis())
            .collectionDurationMs((System.nanoTime() - startNanos) / 1_000_000.0)
            .build();
    }

    @Override
    public ValidationResult validatePerformance(PerformanceMetrics metrics, PerformanceThresholds thresholds) {
        return validator.validate(metrics, thresholds);
    }

    @Override
    public List<MetricsBucket> getHistoricalMetrics(long startMs, long endMs) {
        if (endMs < startMs) {
            return List.of();
        }
        long width = config.getHistoryBucketWidth().toMillis();
        long firstBucket = Math.floorDiv(startMs, width) * width;
        long lastBucket = Math.floorDiv(endMs, width) * width;
        if ((lastBucket - firstBucket) / width >= MAX_HISTORY_BUCKETS) {
            throw new IllegalArgumentException("Requested range spans more than "
                + MAX_HISTORY_BUCKETS + " buckets of " + width + "ms");
        }

        List<LatencyRecord> latencies = filter(latencyRecords, startMs, endMs);
        List<ThroughputRecord> throughputs = filter(throughputRecords, startMs, endMs);
        List<ErrorRecord> errors = filter(errorRecords, startMs, endMs);

        List<MetricsBucket> buckets = new ArrayList<>();
        for (long bucket = firstBucket; bucket <= lastBucket; bucket += width) {
            long bucketStart = bucket;
            long bucketEnd = bucket + width;
            PerformanceMetrics metrics = compute(
                inBucket(latencies, bucketStart, bucketEnd),
                inBucket(throughputs, bucketStart, bucketEnd),
                inBucket(errors, bucketStart, bucketEnd),
                width
            );
            buckets.add(new MetricsBucket(bucketStart, width, metrics));
        }
        return buckets;
    }

    /**
     * Rates are per second of {@code windowMs}, regardless of how much of the window had records.
     */
    static PerformanceMetrics compute(List<LatencyRecord> latencies,
                                      List<ThroughputRecord> throughputs,
                                      List<ErrorRecord> errors,
                                      long windowMs) {
        double windowSeconds = windowMs / 1000.0;

        long totalRequests = 0;
        long totalBytes = 0;
        for (ThroughputRecord r : throughputs) {
            totalRequests += r.requestCount();
            totalBytes += r.dataBytes();
        }

        int totalOperations = latencies.size() + errors.size();

        return PerformanceMetrics.builder()
            .latency(Percentiles.of(latencies.stream().map(LatencyRecord::latencyMs).collect(Collectors.toList())))
            .throughput(Throughput.builder()
                .requestsPerSecond(totalRequests / windowSeconds)
                .bytesPerSecond(totalBytes / windowSeconds)
                .build())
            .errorRate(totalOperations > 0 ? (double) errors.size() / totalOperations : 0.0)
            .availability(totalOperations > 0 ? (double) latencies.size() / totalOperations : 1.0)
            .build();
    }

    private static <T extends TimestampedRecord> List<T> filter(Queue<T> records, long startMs, long endMs) {
        List<T> result = new ArrayList<>();
        for (T record : records) {
            if (record.timestampMs() >= startMs && record.timestampMs() <= endMs) {
                result.add(record);
            }
        }
        return result;
    }

    private static <T extends TimestampedRecord> List<T> inBucket(List<T> records, long bucketStart, long bucketEnd) {
        return records.stream()
            .filter(r -> r.timestampMs() >= bucketStart && r.timestampMs() < bucketEnd)
            .collect(Collectors.toList());
    }

    // ========== Retention ==========

    /**
     * Removes records and alerts older than the retention period.
     *
     * @return number of records removed
     */
    public int purgeExpired() {
        long cutoff = clock.millis() - config.getRetentionPeriod().toMillis();
        int before = latencyRecords.size() + throughputRecords.size() + errorRecords.size();

        latencyRecords.removeIf(r -> r.timestampMs() < cutoff);
        throughputRecords.removeIf(r -> r.timestampMs() < cutoff);
        errorRecords.removeIf(r -> r.timestampMs() < cutoff);
        alertHistory.purgeOlderThan(cutoff);

        int removed = before - (latencyRecords.size() + throughputRecords.size() + errorRecords.size());
        if (removed > 0) {
            log.debug("Purged {} performance records older than {}", removed, cutoff);
        }
        return removed;
    }

    public int recordCount() {
        return latencyRecords.size() + throughputRecords.size() + errorRecords.size();
    }

    // ========== Periodic monitoring ==========

    public synchronized void startMonitoring() {
        if (!monitoring.compareAndSet(false, true)) {
            log.warn("Performance monitoring is already active, ignoring start request");
            return;
        }
        ticker = scheduleTicker(config.getMetricsInterval());
        log.info("Performance monitoring started (interval={}ms, window={}ms)",
            config.getMetricsInterval().toMillis(), config.getMetricsWindow().toMillis());
    }

    public synchronized void stopMonitoring() {
        if (!monitoring.compareAndSet(true, false)) {
            return;
        }
        Disposable current = ticker;
        if (current != null) {
            current.dispose();
        }
        ticker = null;
        log.info("Performance monitoring stopped");
    }

    public boolean isMonitoring() {
        return monitoring.get();
    }

    public MonitorConfig getConfig() {
        return config;
    }

    /**
     * Replaces the configuration, restarting the ticker when monitoring is active.
     */
    public synchronized void updateConfig(MonitorConfig newConfig) {
        this.config = newConfig.validate();
        log.info("Performance monitoring configuration updated");

        if (monitoring.get()) {
            Disposable current = ticker;
            if (current != null) {
                current.dispose();
            }
            ticker = scheduleTicker(newConfig.getMetricsInterval());
        }
    }

    private Disposable scheduleTicker(Duration interval) {
        return Flux.interval(interval)
            .subscribe(
                tick -> {
                    try {
                        runMonitoringTick();
                    } catch (RuntimeException e) {
                        log.error("Performance monitoring tick failed", e);
                    }
                },
                error -> log.error("Performance monitoring ticker terminated unexpectedly", error)
            );
    }

    /**
     * One monitoring tick: collect, record alerts when enabled, purge.
     */
    public CollectionResult runMonitoringTick() {
        CollectionResult result = collectMetricsWithAlerting();
        List<Alert> alerts = result.getAlerts();

        if (config.isAlertingEnabled() && !alerts.isEmpty()) {
            for (Alert alert : alerts) {
                log.warn("[{}] {} performance alert: {}", alert.getSeverity(), alert.getCategory(), alert.getMessage());
            }
            alertHistory.recordAll(alerts);
        }

        purgeExpired();
        return result;
    }
}
