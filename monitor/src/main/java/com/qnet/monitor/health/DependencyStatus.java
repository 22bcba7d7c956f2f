package com.qnet.monitor.health;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.qnet.core.model.NodeStatus;
import lombok.Value;

/**
 * Status of something a node depends on (database, broker, upstream), as reported by the node.
 */
@Value
public class DependencyStatus {
    @JsonProperty("dependencyId")
    String dependencyId;

    @JsonProperty("status")
    NodeStatus status;

    @JsonProperty("lastCheckMs")
    long lastCheckMs;

    @JsonCreator
    public DependencyStatus(
        @JsonProperty("dependencyId") String dependencyId,
        @JsonProperty("status") NodeStatus status,
        @JsonProperty("lastCheckMs") long lastCheckMs
    ) {
        this.dependencyId = dependencyId;
        this.status = status;
        this.lastCheckMs = lastCheckMs;
    }
}
