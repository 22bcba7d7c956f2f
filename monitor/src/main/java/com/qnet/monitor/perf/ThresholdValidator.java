package com.qnet.monitor.perf;

import com.qnet.core.alert.Alert;
import com.qnet.core.alert.AlertCategory;
import com.qnet.core.alert.AlertSeverity;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Compares aggregated metrics against {@link PerformanceThresholds}.
 * <p>
 * Severity grows with the percentile: p50 breaches warn, p95 breaches are errors and
 * p99 breaches are critical. Throughput shortfalls warn, a high error rate is an error
 * and low availability is critical. Nothing is recorded here; callers decide what to
 * do with the returned alerts.
 * </p>
 */
public class ThresholdValidator {
    private final Clock clock;

    public ThresholdValidator(Clock clock) {
        this.clock = clock;
    }

    public ValidationResult validate(PerformanceMetrics metrics, PerformanceThresholds thresholds) {
        long now = clock.millis();
        List<String> violations = new ArrayList<>();
        List<Alert> alerts = new ArrayList<>();

        LatencyPercentiles latency = metrics.getLatency();
        checkAbove(latency.getP50(), thresholds.getP50LatencyMs(), "P50 latency", "ms",
            AlertCategory.LATENCY, AlertSeverity.WARNING, now, violations, alerts);
        checkAbove(latency.getP95(), thresholds.getP95LatencyMs(), "P95 latency", "ms",
            AlertCategory.LATENCY, AlertSeverity.ERROR, now, violations, alerts);
        checkAbove(latency.getP99(), thresholds.getP99LatencyMs(), "P99 latency", "ms",
            AlertCategory.LATENCY, AlertSeverity.CRITICAL, now, violations, alerts);

        Throughput throughput = metrics.getThroughput();
        checkBelow(throughput.getRequestsPerSecond(), thresholds.getMinRequestsPerSecond(), "Request throughput", " req/s",
            AlertCategory.THROUGHPUT, AlertSeverity.WARNING, now, violations, alerts);
        checkBelow(throughput.getBytesPerSecond(), thresholds.getMinBytesPerSecond(), "Data throughput", " B/s",
            AlertCategory.THROUGHPUT, AlertSeverity.WARNING, now, violations, alerts);

        checkAbove(metrics.getErrorRate(), thresholds.getMaxErrorRate(), "Error rate", "",
            AlertCategory.ERROR_RATE, AlertSeverity.ERROR, now, violations, alerts);
        checkBelow(metrics.getAvailability(), thresholds.getMinAvailability(), "Availability", "",
            AlertCategory.AVAILABILITY, AlertSeverity.CRITICAL, now, violations, alerts);

        return new ValidationResult(violations.isEmpty(), List.copyOf(violations), List.copyOf(alerts));
    }

    private static void checkAbove(double observed, double max, String label, String unit,
                                   AlertCategory category, AlertSeverity severity, long now,
                                   List<String> violations, List<Alert> alerts) {
        if (observed > max) {
            String message = String.format("%s %s%s exceeds threshold %s%s",
                label, format(observed), unit, format(max), unit);
            violations.add(message);
            alerts.add(Alert.of(category, severity, null, max, observed, message, now));
        }
    }

    private static void checkBelow(double observed, double min, String label, String unit,
                                   AlertCategory category, AlertSeverity severity, long now,
                                   List<String> violations, List<Alert> alerts) {
        if (observed < min) {
            String message = String.format("%s %s%s below threshold %s%s",
                label, format(observed), unit, format(min), unit);
            violations.add(message);
            alerts.add(Alert.of(category, severity, null, min, observed, message, now));
        }
    }

    private static String format(double value) {
        return value == Math.rint(value) && Math.abs(value) < 1e15
            ? String.valueOf((long) value)
            : String.format("%.4f", value);
    }
}
