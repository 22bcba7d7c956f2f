package com.qnet.loadbalancer.balance;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Outcome of moving a failed node's connections to the surviving nodes.
 */
@Value
@Builder(toBuilder = true)
public class FailoverResult {
    @JsonProperty("success")
    boolean success;

    @JsonProperty("failedNodeId")
    String failedNodeId;

    /**
     * Connections handed out in total: the per-node share times the number of survivors.
     */
    @JsonProperty("redistributedCount")
    int redistributedCount;

    @JsonProperty("activeNodes")
    @Builder.Default
    List<String> activeNodes = List.of();

    /**
     * Connection count of each survivor after redistribution.
     */
    @JsonProperty("loadDistribution")
    @Builder.Default
    Map<String, Integer> loadDistribution = Map.of();

    /**
     * Mean network latency of the survivors, from their last known resource snapshots.
     */
    @JsonProperty("averageLatencyMs")
    double averageLatencyMs;

    @JsonProperty("error")
    String error;

    public static FailoverResult exhausted(String failedNodeId) {
        return FailoverResult.builder()
            .success(false)
            .failedNodeId(failedNodeId)
            .error("No remaining nodes available for failover")
            .build();
    }
}
