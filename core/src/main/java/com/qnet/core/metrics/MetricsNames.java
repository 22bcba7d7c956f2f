package com.qnet.core.metrics;

/**
 * Micrometer metric names used across the system.
 * <p>
 * <b>Naming convention:</b> {@code qnet.<component>.<metric>}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Gauges: current value (no suffix)</li>
 *   <li>Timers: {@code .latency} suffix</li>
 * </ul>
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Gauge: Number of nodes currently tracked by the weight model.
     */
    public static final String LB_TRACKED_NODES = "qnet.lb.tracked.nodes";

    /**
     * Gauge: Total live connections across all tracked nodes.
     */
    public static final String LB_ACTIVE_CONNECTIONS = "qnet.lb.active.connections";

    /**
     * Counter: Successful node selections.
     * <p>
     * Tags: strategy (weighted/round_robin)
     * </p>
     */
    public static final String LB_SELECTIONS_TOTAL = "qnet.lb.selections.total";

    /**
     * Counter: Selections rejected because no node was eligible.
     */
    public static final String LB_NO_AVAILABLE_NODES_TOTAL = "qnet.lb.no.available.nodes.total";

    /**
     * Counter: Failover runs.
     * <p>
     * Tags: result (success/exhausted)
     * </p>
     */
    public static final String LB_FAILOVERS_TOTAL = "qnet.lb.failovers.total";

    /**
     * Timer: Duration of a full health-check cycle.
     */
    public static final String HEALTH_CYCLE_LATENCY = "qnet.health.cycle.latency";

    /**
     * Timer: Probe round trip per node.
     * <p>
     * Tags: node_id
     * </p>
     */
    public static final String HEALTH_PROBE_LATENCY = "qnet.health.probe.latency";

    /**
     * Counter: Probes that timed out or failed.
     * <p>
     * Tags: node_id, reason (timeout/failure)
     * </p>
     */
    public static final String HEALTH_PROBE_FAILURES_TOTAL = "qnet.health.probe.failures.total";

    /**
     * Gauge: Fleet health score (active / total * 100) from the last cycle.
     */
    public static final String HEALTH_OVERALL_SCORE = "qnet.health.overall.score";

    /**
     * Counter: Alerts recorded.
     * <p>
     * Tags: category, severity
     * </p>
     */
    public static final String ALERTS_TOTAL = "qnet.alerts.total";

    /**
     * Gauge: Alerts currently retained in history.
     */
    public static final String ALERTS_RETAINED = "qnet.alerts.retained";

    /**
     * Timer: Operation latency reported by callers.
     * <p>
     * Tags: operation
     * </p>
     */
    public static final String PERF_OPERATION_LATENCY = "qnet.perf.operation.latency";

    /**
     * Counter: Operation errors reported by callers.
     * <p>
     * Tags: operation
     * </p>
     */
    public static final String PERF_OPERATION_ERRORS_TOTAL = "qnet.perf.operation.errors.total";

    /**
     * Counter: Bytes processed as reported by throughput records.
     * <p>
     * Tags: operation
     * </p>
     */
    public static final String PERF_OPERATION_BYTES_TOTAL = "qnet.perf.operation.bytes.total";
}
