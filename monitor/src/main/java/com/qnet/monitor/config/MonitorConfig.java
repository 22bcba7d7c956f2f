package com.qnet.monitor.config;

import com.qnet.core.error.ConfigurationInvalidException;
import com.qnet.monitor.perf.PerformanceThresholds;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration for the health and performance monitors, loaded from environment variables.
 * <p>
 * Instances are immutable; a running monitor picks up a replacement on its next cycle.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class MonitorConfig {

    // Health monitor
    @Builder.Default
    Duration checkInterval = Duration.ofSeconds(30);
    @Builder.Default
    Duration probeTimeout = Duration.ofSeconds(5);
    @Builder.Default
    int retryAttempts = 3;
    /**
     * Cap on one node's probe including every retry and backoff; {@code probeTimeout} bounds each attempt.
     */
    @Builder.Default
    Duration probeBudget = Duration.ofSeconds(15);
    @Builder.Default
    Duration retryBackoff = Duration.ofMillis(200);
    @Builder.Default
    AlertThresholds alertThresholds = AlertThresholds.defaults();
    @Builder.Default
    int maxHealthHistory = 100;
    @Builder.Default
    double unhealthyThreshold = 50.0;

    // Alerting
    @Builder.Default
    boolean alertingEnabled = true;
    @Builder.Default
    int maxAlertHistory = 1000;
    @Builder.Default
    Duration retentionPeriod = Duration.ofHours(24);

    // Performance metrics
    @Builder.Default
    Duration metricsWindow = Duration.ofSeconds(60);
    @Builder.Default
    Duration metricsInterval = Duration.ofSeconds(5);
    @Builder.Default
    Duration historyBucketWidth = Duration.ofMinutes(1);
    @Builder.Default
    PerformanceThresholds performanceThresholds = PerformanceThresholds.defaults();

    public static MonitorConfig defaults() {
        return MonitorConfig.builder().build();
    }

    public static MonitorConfig fromEnv() {
        AlertThresholds thresholds = AlertThresholds.builder()
            .responseTimeMs(Double.parseDouble(getEnv("ALERT_LATENCY_MS", "2000")))
            .errorRate(Double.parseDouble(getEnv("ALERT_ERROR_RATE", "0.05")))
            .cpuUsagePct(Double.parseDouble(getEnv("ALERT_CPU_PCT", "80")))
            .memoryUsagePct(Double.parseDouble(getEnv("ALERT_MEMORY_PCT", "85")))
            .build();

        return MonitorConfig.builder()
            .checkInterval(Duration.ofMillis(Long.parseLong(getEnv("CHECK_INTERVAL_MS", "30000"))))
            .probeTimeout(Duration.ofMillis(Long.parseLong(getEnv("PROBE_TIMEOUT_MS", "5000"))))
            .retryAttempts(Integer.parseInt(getEnv("RETRY_ATTEMPTS", "3")))
            .probeBudget(Duration.ofMillis(Long.parseLong(getEnv("PROBE_BUDGET_MS", "15000"))))
            .alertThresholds(thresholds)
            .maxHealthHistory(Integer.parseInt(getEnv("MAX_HEALTH_HISTORY", "100")))
            .unhealthyThreshold(Double.parseDouble(getEnv("UNHEALTHY_THRESHOLD", "50")))
            .alertingEnabled(Boolean.parseBoolean(getEnv("ALERTING_ENABLED", "true")))
            .maxAlertHistory(Integer.parseInt(getEnv("MAX_ALERT_HISTORY", "1000")))
            .retentionPeriod(Duration.ofMillis(Long.parseLong(getEnv("RETENTION_PERIOD_MS", "86400000"))))
            .metricsWindow(Duration.ofMillis(Long.parseLong(getEnv("METRICS_WINDOW_MS", "60000"))))
            .metricsInterval(Duration.ofMillis(Long.parseLong(getEnv("METRICS_INTERVAL_MS", "5000"))))
            .build();
    }

    /**
     * Checks every numeric setting and fails with the full list of problems.
     *
     * @return this config, for chaining
     * @throws ConfigurationInvalidException if any setting is out of range
     */
    public MonitorConfig validate() {
        List<String> problems = new ArrayList<>();

        requirePositive(problems, "checkInterval", checkInterval);
        requirePositive(problems, "probeTimeout", probeTimeout);
        requirePositive(problems, "probeBudget", probeBudget);
        if (probeTimeout != null && probeBudget != null && probeBudget.compareTo(probeTimeout) < 0) {
            problems.add("probeBudget must be >= probeTimeout, got " + probeBudget + " < " + probeTimeout);
        }
        requirePositive(problems, "retentionPeriod", retentionPeriod);
        requirePositive(problems, "metricsWindow", metricsWindow);
        requirePositive(problems, "metricsInterval", metricsInterval);
        requirePositive(problems, "historyBucketWidth", historyBucketWidth);
        if (retryBackoff == null || retryBackoff.isNegative()) {
            problems.add("retryBackoff must not be negative");
        }
        if (retryAttempts < 0) {
            problems.add("retryAttempts must be >= 0, got " + retryAttempts);
        }
        if (maxHealthHistory < 1) {
            problems.add("maxHealthHistory must be >= 1, got " + maxHealthHistory);
        }
        if (maxAlertHistory < 1) {
            problems.add("maxAlertHistory must be >= 1, got " + maxAlertHistory);
        }
        if (unhealthyThreshold < 0 || unhealthyThreshold > 100) {
            problems.add("unhealthyThreshold must be within [0, 100], got " + unhealthyThreshold);
        }

        if (alertThresholds == null) {
            problems.add("alertThresholds are required");
        } else {
            if (alertThresholds.getResponseTimeMs() <= 0) {
                problems.add("alertThresholds.responseTimeMs must be > 0");
            }
            if (alertThresholds.getErrorRate() < 0 || alertThresholds.getErrorRate() > 1) {
                problems.add("alertThresholds.errorRate must be within [0, 1]");
            }
            if (alertThresholds.getCpuUsagePct() <= 0 || alertThresholds.getCpuUsagePct() > 100) {
                problems.add("alertThresholds.cpuUsagePct must be within (0, 100]");
            }
            if (alertThresholds.getMemoryUsagePct() <= 0 || alertThresholds.getMemoryUsagePct() > 100) {
                problems.add("alertThresholds.memoryUsagePct must be within (0, 100]");
            }
        }

        if (performanceThresholds == null) {
            problems.add("performanceThresholds are required");
        } else {
            problems.addAll(performanceThresholds.problems());
        }

        if (!problems.isEmpty()) {
            throw new ConfigurationInvalidException(problems);
        }
        return this;
    }

    private static void requirePositive(List<String> problems, String name, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            problems.add(name + " must be a positive duration, got " + value);
        }
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}
