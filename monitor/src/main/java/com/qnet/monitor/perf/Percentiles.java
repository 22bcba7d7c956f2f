package com.qnet.monitor.perf;

import java.util.Arrays;
import java.util.Collection;

/**
 * Nearest-rank percentiles.
 * <p>
 * {@code P(p) = sorted[ceil(p/100 * n) - 1]}, or 0 for an empty sample. The result does
 * not depend on the order in which values were recorded.
 * </p>
 */
public final class Percentiles {
    private Percentiles() {
    }

    /**
     * @param sorted ascending values
     * @param p      percentile in (0, 100]
     */
    public static double nearestRank(double[] sorted, double p) {
        if (sorted.length == 0) {
            return 0.0;
        }
        int rank = (int) Math.ceil(p / 100.0 * sorted.length);
        int index = Math.max(0, Math.min(sorted.length - 1, rank - 1));
        return sorted[index];
    }

    public static LatencyPercentiles of(Collection<Double> values) {
        double[] sorted = values.stream().mapToDouble(Double::doubleValue).toArray();
        Arrays.sort(sorted);
        return LatencyPercentiles.builder()
            .p50(nearestRank(sorted, 50))
            .p95(nearestRank(sorted, 95))
            .p99(nearestRank(sorted, 99))
            .build();
    }
}
