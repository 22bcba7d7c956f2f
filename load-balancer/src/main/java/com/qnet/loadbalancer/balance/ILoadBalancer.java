package com.qnet.loadbalancer.balance;

import com.qnet.core.error.NoAvailableNodesException;
import com.qnet.core.model.Node;

import java.util.Collection;
import java.util.Map;

/**
 * Weighted request distribution with connection tracking and failover.
 */
public interface ILoadBalancer {

    /**
     * Picks a node for {@code request} among the eligible candidates and counts a new
     * connection on it.
     *
     * @throws NoAvailableNodesException if no candidate is active and healthy enough
     */
    Node distribute(Object request, Collection<Node> candidates);

    /**
     * Recomputes weights for exactly these nodes. Tracking of any other node is dropped.
     */
    void updateWeights(Collection<Node> nodes);

    /**
     * Stops tracking {@code nodeId} and spreads its connections over the remaining nodes.
     * Never throws; an empty survivor set yields an unsuccessful result.
     */
    FailoverResult handleFailure(String nodeId);

    /**
     * Share of all live connections per node, in percent. Empty when there are none.
     */
    Map<String, Double> getLoadDistribution();

    void completeConnection(String nodeId);

    LoadStatistics getStatistics();

    int getNodeConnections(String nodeId);

    double getNodeWeight(String nodeId);

    void resetConnections();

    WeightSnapshot getWeightSnapshot();
}
