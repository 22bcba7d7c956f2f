package com.qnet.loadbalancer.balance;

import com.qnet.core.model.Node;
import com.qnet.core.model.ResourceSnapshot;

/**
 * Default weight model.
 * <p>
 * <b>Formula:</b>
 * {@code w = 0.30*health/100 + 0.25*(1 - cpu/100) + 0.25*(1 - mem/100)
 *          + 0.10*max(0, 1 - latencyMs/1000) + 0.10*max(0, 1 - connections/1000)}
 * </p>
 * <p>
 * Every component is clamped to [0, 1], so the weight lies in [0, 1]: a healthy, idle,
 * nearby node with no connections scores 1.
 * </p>
 */
public final class NodeWeightModel implements WeightFunction {
    public static final NodeWeightModel INSTANCE = new NodeWeightModel();

    static final double HEALTH_WEIGHT = 0.30;
    static final double CPU_WEIGHT = 0.25;
    static final double MEMORY_WEIGHT = 0.25;
    static final double LATENCY_WEIGHT = 0.10;
    static final double CONNECTION_WEIGHT = 0.10;

    // Latency (ms) and connection count at which those components reach zero
    static final double LATENCY_CEILING_MS = 1000.0;
    static final double CONNECTION_CEILING = 1000.0;

    private NodeWeightModel() {
    }

    @Override
    public double weightOf(Node node, int liveConnections) {
        ResourceSnapshot resources = node.getResources();

        double health = clamp01(node.getHealthScore() / Node.MAX_HEALTH_SCORE);
        double cpu = clamp01(1.0 - resources.getCpuUsagePct() / 100.0);
        double mem = clamp01(1.0 - resources.getMemUsagePct() / 100.0);
        double latency = clamp01(1.0 - resources.getNetworkLatencyMs() / LATENCY_CEILING_MS);
        double connections = clamp01(1.0 - liveConnections / CONNECTION_CEILING);

        double weight = HEALTH_WEIGHT * health
            + CPU_WEIGHT * cpu
            + MEMORY_WEIGHT * mem
            + LATENCY_WEIGHT * latency
            + CONNECTION_WEIGHT * connections;
        return Math.max(0.0, weight);
    }

    private static double clamp01(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
