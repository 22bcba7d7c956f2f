package com.qnet.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Immutable snapshot of a backend node known to the registry.
 * <p>
 * The registry replaces the whole snapshot whenever the health monitor
 * reports a change, so holders of an older instance never see a half-updated node.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@With
public class Node {
    public static final double MAX_HEALTH_SCORE = 100.0;

    /**
     * Unique identifier for this node.
     */
    @JsonProperty("nodeId")
    String nodeId;

    /**
     * Base URL of the node's health endpoint, if it exposes one (e.g. http://qnet-2:8080).
     */
    @JsonProperty("endpoint")
    String endpoint;

    @JsonProperty("status")
    @Builder.Default
    NodeStatus status = NodeStatus.ACTIVE;

    /**
     * Health score between 0 and 100.
     */
    @JsonProperty("healthScore")
    @Builder.Default
    double healthScore = MAX_HEALTH_SCORE;

    @JsonProperty("resources")
    @Builder.Default
    ResourceSnapshot resources = ResourceSnapshot.idle();

    /**
     * Epoch millis of the last completed health check, 0 if never checked.
     */
    @JsonProperty("lastHealthCheckMs")
    long lastHealthCheckMs;

    @JsonCreator
    public Node(
        @JsonProperty("nodeId") String nodeId,
        @JsonProperty("endpoint") String endpoint,
        @JsonProperty("status") NodeStatus status,
        @JsonProperty("healthScore") double healthScore,
        @JsonProperty("resources") ResourceSnapshot resources,
        @JsonProperty("lastHealthCheckMs") long lastHealthCheckMs
    ) {
        this.nodeId = nodeId;
        this.endpoint = endpoint;
        this.status = status != null ? status : NodeStatus.ACTIVE;
        this.healthScore = Math.max(0.0, Math.min(MAX_HEALTH_SCORE, healthScore));
        this.resources = resources != null ? resources : ResourceSnapshot.idle();
        this.lastHealthCheckMs = lastHealthCheckMs;
    }

    /**
     * Checks whether this node may receive new work.
     *
     * @param minHealthScore exclusive lower bound on the health score
     * @return true if the node is active and healthier than the bound
     */
    @JsonIgnore
    public boolean isEligible(double minHealthScore) {
        return status == NodeStatus.ACTIVE && healthScore > minHealthScore;
    }
}
