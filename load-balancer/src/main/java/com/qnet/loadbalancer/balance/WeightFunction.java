package com.qnet.loadbalancer.balance;

import com.qnet.core.model.Node;

/**
 * Maps a node snapshot and its live connection count to a non-negative selection weight.
 */
@FunctionalInterface
public interface WeightFunction {
    double weightOf(Node node, int liveConnections);
}
