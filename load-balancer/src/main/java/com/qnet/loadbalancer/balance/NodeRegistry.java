package com.qnet.loadbalancer.balance;

import com.qnet.core.inventory.INodeHealthListener;
import com.qnet.core.inventory.INodeInventory;
import com.qnet.core.model.Node;
import com.qnet.core.model.NodeStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Source of truth for the known node set.
 * <p>
 * The health monitor reads the inventory from here and pushes updated snapshots back.
 * Every change re-weights the load balancer with the nodes that are not FAILED; a node
 * entering FAILED triggers failover once per transition.
 * </p>
 */
public class NodeRegistry implements INodeInventory, INodeHealthListener {
    private static final Logger log = LoggerFactory.getLogger(NodeRegistry.class);

    private final Map<String, Node> nodes = new ConcurrentHashMap<>();
    private final List<FailoverListener> failoverListeners = new CopyOnWriteArrayList<>();
    private final ILoadBalancer loadBalancer;

    public NodeRegistry(ILoadBalancer loadBalancer) {
        this.loadBalancer = loadBalancer;
    }

    public void addFailoverListener(FailoverListener listener) {
        failoverListeners.add(listener);
    }

    /**
     * Adds the node or replaces the known snapshot of it. A replacement goes through the same
     * transition handling as a health update, so registering a known node as FAILED fails it over.
     */
    public void register(Node node) {
        if (nodes.putIfAbsent(node.getNodeId(), node) == null) {
            log.info("Node registered: {} ({})", node.getNodeId(), node.getEndpoint());
            refreshWeights();
            return;
        }
        log.info("Node updated: {}", node.getNodeId());
        if (!applyOutcome(node.getNodeId(), previous -> node).known()) {
            // Deregistered in between
            register(node);
        }
    }

    /**
     * @return true if the node was known
     */
    public boolean deregister(String nodeId) {
        Node removed = nodes.remove(nodeId);
        if (removed == null) {
            return false;
        }
        log.info("Node deregistered: {}", nodeId);
        refreshWeights();
        return true;
    }

    @Override
    public Collection<Node> getNodes() {
        return List.copyOf(nodes.values());
    }

    public Optional<Node> getNode(String nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    /**
     * Applies the health-owned fields of {@code updated} (status, health score, resources and
     * check time) onto the current snapshot; endpoint changes made meanwhile are kept.
     */
    @Override
    public void onNodeHealthChanged(Node updated) {
        FailoverOutcome outcome = applyOutcome(updated.getNodeId(), previous -> previous.toBuilder()
            .status(updated.getStatus())
            .healthScore(updated.getHealthScore())
            .resources(updated.getResources())
            .lastHealthCheckMs(updated.getLastHealthCheckMs())
            .build());
        if (!outcome.known()) {
            log.debug("Ignoring health update for unknown node {}", updated.getNodeId());
        }
    }

    /**
     * Takes a node out of rotation without waiting for the health monitor.
     *
     * @return the failover result, or empty if the node is unknown or already FAILED
     */
    public Optional<FailoverResult> markFailed(String nodeId) {
        if (!nodes.containsKey(nodeId)) {
            return Optional.empty();
        }
        log.warn("Node {} marked as failed manually", nodeId);
        return Optional.ofNullable(apply(nodeId, previous -> previous.toBuilder()
            .status(NodeStatus.FAILED)
            .healthScore(0.0)
            .build()));
    }

    private FailoverResult apply(String nodeId, UnaryOperator<Node> change) {
        return applyOutcome(nodeId, change).result();
    }

    private FailoverOutcome applyOutcome(String nodeId, UnaryOperator<Node> change) {
        AtomicReference<Node> previousRef = new AtomicReference<>();
        Node updated = nodes.computeIfPresent(nodeId, (id, previous) -> {
            previousRef.set(previous);
            return change.apply(previous);
        });

        Node previous = previousRef.get();
        if (previous == null || updated == null) {
            return new FailoverOutcome(false, null);
        }

        FailoverResult result = null;
        if (updated.getStatus() == NodeStatus.FAILED && previous.getStatus() != NodeStatus.FAILED) {
            result = loadBalancer.handleFailure(nodeId);
            notifyFailover(nodeId, result);
        } else if (previous.getStatus() == NodeStatus.FAILED && updated.getStatus() != NodeStatus.FAILED) {
            log.info("Node {} recovered ({})", nodeId, updated.getStatus());
        }

        refreshWeights();
        return new FailoverOutcome(true, result);
    }

    private void notifyFailover(String nodeId, FailoverResult result) {
        for (FailoverListener listener : failoverListeners) {
            try {
                listener.onFailover(nodeId, result);
            } catch (RuntimeException e) {
                log.error("Failover listener failed for node {}", nodeId, e);
            }
        }
    }

    private void refreshWeights() {
        List<Node> routable = nodes.values().stream()
            .filter(node -> node.getStatus() != NodeStatus.FAILED)
            .collect(Collectors.toList());
        loadBalancer.updateWeights(routable);
    }

    private record FailoverOutcome(boolean known, FailoverResult result) {
    }
}
