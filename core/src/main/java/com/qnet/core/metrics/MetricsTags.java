package com.qnet.core.metrics;

/**
 * Standard tag keys for Micrometer metrics.
 * <p>
 * Consistent tagging enables aggregation and filtering in Prometheus/Grafana.
 * </p>
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    /**
     * Tag key for node identifier.
     */
    public static final String NODE_ID = "node_id";

    /**
     * Tag key for selection strategy (weighted/round_robin).
     */
    public static final String STRATEGY = "strategy";

    /**
     * Tag key for failure reason or failover result.
     */
    public static final String REASON = "reason";

    public static final String RESULT = "result";

    public static final String CATEGORY = "category";

    public static final String SEVERITY = "severity";

    /**
     * Tag key for the caller-supplied operation name.
     */
    public static final String OPERATION = "operation";
}
