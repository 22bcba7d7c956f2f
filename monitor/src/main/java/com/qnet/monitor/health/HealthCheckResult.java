package com.qnet.monitor.health;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Result of probing one node once. Kept in a bounded per-node history.
 */
@Value
@Builder(toBuilder = true)
public class HealthCheckResult {
    @JsonProperty("nodeId")
    String nodeId;

    @JsonProperty("status")
    HealthCheckStatus status;

    @JsonProperty("checkedAtMs")
    long checkedAtMs;

    /**
     * Time spent on the probe including retries, or the timeout when the probe timed out.
     */
    @JsonProperty("responseTimeMs")
    double responseTimeMs;

    @JsonProperty("metrics")
    @Builder.Default
    HealthMetrics metrics = HealthMetrics.empty();

    @JsonProperty("dependencies")
    @Builder.Default
    List<DependencyStatus> dependencies = List.of();

    /**
     * Why the probe failed; null for a probe that answered.
     */
    @JsonProperty("error")
    String error;

    /**
     * Score of this single check in [0, 100], before rolling averaging.
     */
    @JsonProperty("checkScore")
    double checkScore;
}
