package com.qnet.loadbalancer.balance;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class LoadStatistics {
    @JsonProperty("totalConnections")
    long totalConnections;

    @JsonProperty("nodeCount")
    int nodeCount;

    @JsonProperty("averageConnectionsPerNode")
    double averageConnectionsPerNode;

    /**
     * Population standard deviation of per-node connection counts.
     */
    @JsonProperty("loadStdDev")
    double loadStdDev;
}
