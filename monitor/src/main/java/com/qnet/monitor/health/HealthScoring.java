package com.qnet.monitor.health;

import java.util.List;

/**
 * Health score arithmetic.
 * <p>
 * <b>Per-check score:</b>
 * {@code 100 * (0.4*healthy + 0.2*(1 - cpu) + 0.2*(1 - mem) + 0.2*max(0, 1 - rt/timeout))}
 * where cpu and mem are fractions. A node's health score is the mean of its last
 * {@link #ROLLING_WINDOW} check scores.
 * </p>
 */
public final class HealthScoring {
    public static final int ROLLING_WINDOW = 5;

    private static final double HEALTHY_WEIGHT = 0.4;
    private static final double CPU_WEIGHT = 0.2;
    private static final double MEMORY_WEIGHT = 0.2;
    private static final double RESPONSE_TIME_WEIGHT = 0.2;

    private HealthScoring() {
    }

    public static double checkScore(boolean healthy, HealthMetrics metrics, double responseTimeMs, double timeoutMs) {
        double cpu = clamp01(metrics.getCpuUsagePct() / 100.0);
        double mem = clamp01(metrics.getMemoryUsagePct() / 100.0);
        double rt = timeoutMs > 0 ? clamp01(1.0 - responseTimeMs / timeoutMs) : 0.0;

        double score = (healthy ? HEALTHY_WEIGHT : 0.0)
            + CPU_WEIGHT * (1.0 - cpu)
            + MEMORY_WEIGHT * (1.0 - mem)
            + RESPONSE_TIME_WEIGHT * rt;
        return 100.0 * score;
    }

    /**
     * Mean of the last {@link #ROLLING_WINDOW} check scores, oldest first in {@code history}.
     */
    public static double rollingScore(List<HealthCheckResult> history) {
        if (history.isEmpty()) {
            return 0.0;
        }
        int from = Math.max(0, history.size() - ROLLING_WINDOW);
        return history.subList(from, history.size()).stream()
            .mapToDouble(HealthCheckResult::getCheckScore)
            .average()
            .orElse(0.0);
    }

    /**
     * Mean response time of the last {@link #ROLLING_WINDOW} checks.
     */
    public static double rollingResponseTime(List<HealthCheckResult> history) {
        if (history.isEmpty()) {
            return 0.0;
        }
        int from = Math.max(0, history.size() - ROLLING_WINDOW);
        return history.subList(from, history.size()).stream()
            .mapToDouble(HealthCheckResult::getResponseTimeMs)
            .average()
            .orElse(0.0);
    }

    private static double clamp01(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
