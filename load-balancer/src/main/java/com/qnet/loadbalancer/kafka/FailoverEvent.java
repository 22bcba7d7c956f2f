package com.qnet.loadbalancer.kafka;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.qnet.loadbalancer.balance.FailoverResult;
import lombok.Builder;
import lombok.Value;

/**
 * Message published to the failover control topic.
 */
@Value
@Builder
public class FailoverEvent {
    /**
     * Load balancer instance that handled the failure.
     */
    @JsonProperty("balancerId")
    String balancerId;

    @JsonProperty("failedNodeId")
    String failedNodeId;

    @JsonProperty("result")
    FailoverResult result;

    @JsonProperty("timestampMs")
    long timestampMs;
}
