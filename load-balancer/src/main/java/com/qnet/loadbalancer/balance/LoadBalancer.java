package com.qnet.loadbalancer.balance;

import com.qnet.core.error.NoAvailableNodesException;
import com.qnet.core.hash.Hashers;
import com.qnet.core.metrics.MetricsNames;
import com.qnet.core.metrics.MetricsTags;
import com.qnet.core.model.Node;
import com.qnet.loadbalancer.config.LBConfig;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Weighted-random load balancer with per-node connection tracking.
 * <p>
 * <b>Selection:</b>
 * 1. Keep candidates that are ACTIVE with a health score above the eligibility threshold
 * 2. Weigh each with the {@link WeightFunction} using its live connection count
 * 3. Draw {@code r} in [0, total) and walk the candidates by descending weight until {@code r <= 0}
 * 4. If every weight is zero, fall back to round-robin over the eligible candidates
 * </p>
 * <p>
 * Once {@link #updateWeights(Collection)} has run, only tracked nodes are selected; a stale
 * candidate list can never route to a node that already failed over.
 * </p>
 * <p>
 * <b>Failover:</b> the failed node's connections are split evenly (rounded up) over every
 * node still tracked; health is not consulted.
 * </p>
 */
public class LoadBalancer implements ILoadBalancer {
    private static final Logger log = LoggerFactory.getLogger(LoadBalancer.class);

    private final AtomicLong versionCounter = new AtomicLong(1);
    private final Map<String, AtomicInteger> connectionCounts = new ConcurrentHashMap<>();
    private final AtomicInteger roundRobinCursor = new AtomicInteger(0);
    private final Object trackingLock = new Object();

    private final double eligibilityThreshold;
    private final WeightFunction weightFunction;
    private final Random random;

    private final Counter weightedSelections;
    private final Counter roundRobinSelections;
    private final Counter noAvailableNodes;
    private final MeterRegistry meterRegistry;

    private volatile WeightSnapshot currentSnapshot = WeightSnapshot.empty();
    // Guarded by trackingLock
    private boolean membershipTracked;

    public LoadBalancer(LBConfig config, MeterRegistry meterRegistry) {
        this(config, meterRegistry, NodeWeightModel.INSTANCE,
            config.getRandomSeed() != null ? new Random(config.getRandomSeed()) : new Random());
    }

    public LoadBalancer(LBConfig config, MeterRegistry meterRegistry, WeightFunction weightFunction, Random random) {
        this.eligibilityThreshold = config.getEligibilityThreshold();
        this.weightFunction = weightFunction;
        this.random = random;
        this.meterRegistry = meterRegistry;

        this.weightedSelections = Counter.builder(MetricsNames.LB_SELECTIONS_TOTAL)
            .tag(MetricsTags.STRATEGY, "weighted")
            .register(meterRegistry);
        this.roundRobinSelections = Counter.builder(MetricsNames.LB_SELECTIONS_TOTAL)
            .tag(MetricsTags.STRATEGY, "round_robin")
            .register(meterRegistry);
        this.noAvailableNodes = Counter.builder(MetricsNames.LB_NO_AVAILABLE_NODES_TOTAL)
            .register(meterRegistry);

        Gauge.builder(MetricsNames.LB_TRACKED_NODES, this, lb -> lb.currentSnapshot.getWeights().size())
            .register(meterRegistry);
        Gauge.builder(MetricsNames.LB_ACTIVE_CONNECTIONS, this, lb -> lb.totalConnections())
            .register(meterRegistry);
    }

    // ========== Selection ==========

    @Override
    public Node distribute(Object request, Collection<Node> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            noAvailableNodes.increment();
            throw new NoAvailableNodesException("No available nodes for load distribution");
        }

        List<Node> eligible = candidates.stream()
            .filter(node -> node.isEligible(eligibilityThreshold))
            .collect(Collectors.toList());

        if (eligible.isEmpty()) {
            noAvailableNodes.increment();
            throw new NoAvailableNodesException(String.format(
                "No healthy nodes available: %d candidates, none active with health score above %.1f",
                candidates.size(), eligibilityThreshold));
        }

        Node selected;
        int connections;
        synchronized (trackingLock) {
            List<Node> routable = tracked(eligible);
            if (routable.isEmpty()) {
                noAvailableNodes.increment();
                throw new NoAvailableNodesException(String.format(
                    "No tracked nodes available: %d eligible candidates are no longer in rotation", eligible.size()));
            }
            selected = selectNode(routable);
            connections = connectionCounter(selected.getNodeId()).incrementAndGet();
        }

        log.debug("Request {} routed to node {} ({} connections)", request, selected.getNodeId(), connections);
        return selected;
    }

    private List<Node> tracked(List<Node> eligible) {
        if (!membershipTracked) {
            return eligible;
        }
        WeightSnapshot snapshot = currentSnapshot;
        return eligible.stream()
            .filter(node -> snapshot.contains(node.getNodeId()))
            .collect(Collectors.toList());
    }

    private Node selectNode(List<Node> eligible) {
        List<WeightedNode> weighted = eligible.stream()
            .map(node -> new WeightedNode(node, safeWeight(node)))
            .sorted(Comparator.comparingDouble(WeightedNode::weight).reversed()
                .thenComparing(w -> w.node().getNodeId()))
            .collect(Collectors.toList());

        double totalWeight = weighted.stream().mapToDouble(WeightedNode::weight).sum();

        if (totalWeight <= 0) {
            int index = Math.floorMod(roundRobinCursor.getAndIncrement(), eligible.size());
            roundRobinSelections.increment();
            return eligible.get(index);
        }

        double remaining = random.nextDouble() * totalWeight;
        for (WeightedNode candidate : weighted) {
            remaining -= candidate.weight();
            if (remaining <= 0) {
                weightedSelections.increment();
                return candidate.node();
            }
        }

        // Floating-point residue: the draw landed in the last interval
        weightedSelections.increment();
        return weighted.get(weighted.size() - 1).node();
    }

    private double safeWeight(Node node) {
        double weight = weightFunction.weightOf(node, getNodeConnections(node.getNodeId()));
        if (Double.isNaN(weight) || Double.isInfinite(weight) || weight < 0) {
            log.warn("Invalid weight {} for node {}, treating as 0", weight, node.getNodeId());
            return 0.0;
        }
        return weight;
    }

    @Override
    public void completeConnection(String nodeId) {
        AtomicInteger counter = connectionCounts.get(nodeId);
        if (counter == null) {
            return;
        }
        counter.updateAndGet(current -> Math.max(0, current - 1));
    }

    // ========== Weights ==========

    @Override
    public void updateWeights(Collection<Node> nodes) {
        synchronized (trackingLock) {
            Map<String, Double> weights = new HashMap<>();
            Map<String, Node> nodeMap = new HashMap<>();
            for (Node node : nodes) {
                nodeMap.put(node.getNodeId(), node);
                weights.put(node.getNodeId(), safeWeight(node));
            }

            // Nodes that left stop being tracked entirely
            connectionCounts.keySet().removeIf(nodeId -> !nodeMap.containsKey(nodeId));

            WeightSnapshot previous = currentSnapshot;
            membershipTracked = true;
            currentSnapshot = WeightSnapshot.builder()
                .version(versionCounter.getAndIncrement())
                .issuedAt(Instant.now())
                .versionHash(Hashers.fingerprint(nodeMap.keySet()))
                .weights(Map.copyOf(weights))
                .nodes(Map.copyOf(nodeMap))
                .build();

            if (!previous.getVersionHash().equals(currentSnapshot.getVersionHash())) {
                log.info("Tracked node set changed: {} nodes (version {})",
                    nodeMap.size(), currentSnapshot.getVersion());
            } else {
                log.debug("Weights updated for {} nodes (version {})", nodeMap.size(), currentSnapshot.getVersion());
            }
        }
    }

    @Override
    public WeightSnapshot getWeightSnapshot() {
        return currentSnapshot;
    }

    @Override
    public double getNodeWeight(String nodeId) {
        return currentSnapshot.getWeights().getOrDefault(nodeId, 0.0);
    }

    // ========== Failover ==========

    @Override
    public FailoverResult handleFailure(String nodeId) {
        synchronized (trackingLock) {
            AtomicInteger removed = connectionCounts.remove(nodeId);
            int failedConnections = removed != null ? removed.get() : 0;

            WeightSnapshot remainingSnapshot = currentSnapshot.without(
                nodeId, versionCounter.getAndIncrement(), Instant.now());
            currentSnapshot = remainingSnapshot;

            List<String> survivors = new ArrayList<>(remainingSnapshot.getWeights().keySet());
            Collections.sort(survivors);

            if (survivors.isEmpty()) {
                log.error("Failover for node {} impossible: no remaining nodes ({} connections lost)",
                    nodeId, failedConnections);
                failoverCounter("exhausted").increment();
                return FailoverResult.exhausted(nodeId);
            }

            int perNode = (int) Math.ceil((double) failedConnections / survivors.size());
            Map<String, Integer> loadDistribution = new LinkedHashMap<>();
            int redistributed = 0;
            for (String survivor : survivors) {
                loadDistribution.put(survivor, connectionCounter(survivor).addAndGet(perNode));
                redistributed += perNode;
            }

            double averageLatencyMs = survivors.stream()
                .map(remainingSnapshot.getNodes()::get)
                .filter(Objects::nonNull)
                .mapToDouble(node -> node.getResources().getNetworkLatencyMs())
                .average()
                .orElse(0.0);

            failoverCounter("success").increment();
            log.warn("Failover for node {}: {} connections moved to {} nodes ({} each)",
                nodeId, failedConnections, survivors.size(), perNode);

            return FailoverResult.builder()
                .success(true)
                .failedNodeId(nodeId)
                .redistributedCount(redistributed)
                .activeNodes(List.copyOf(survivors))
                .loadDistribution(Collections.unmodifiableMap(loadDistribution))
                .averageLatencyMs(averageLatencyMs)
                .build();
        }
    }

    private Counter failoverCounter(String result) {
        return Counter.builder(MetricsNames.LB_FAILOVERS_TOTAL)
            .tag(MetricsTags.RESULT, result)
            .register(meterRegistry);
    }

    // ========== Load reporting ==========

    @Override
    public Map<String, Double> getLoadDistribution() {
        Map<String, Integer> snapshot = connectionSnapshot();
        long total = snapshot.values().stream().mapToLong(Integer::longValue).sum();
        if (total == 0) {
            return Map.of();
        }

        Map<String, Double> distribution = new TreeMap<>();
        snapshot.forEach((nodeId, count) -> distribution.put(nodeId, count * 100.0 / total));
        return distribution;
    }

    @Override
    public LoadStatistics getStatistics() {
        Map<String, Integer> snapshot = connectionSnapshot();
        int nodeCount = snapshot.size();
        long total = snapshot.values().stream().mapToLong(Integer::longValue).sum();
        double average = nodeCount > 0 ? (double) total / nodeCount : 0.0;

        double variance = nodeCount > 0
            ? snapshot.values().stream().mapToDouble(c -> (c - average) * (c - average)).sum() / nodeCount
            : 0.0;

        return LoadStatistics.builder()
            .totalConnections(total)
            .nodeCount(nodeCount)
            .averageConnectionsPerNode(average)
            .loadStdDev(Math.sqrt(variance))
            .build();
    }

    @Override
    public int getNodeConnections(String nodeId) {
        AtomicInteger counter = connectionCounts.get(nodeId);
        return counter != null ? counter.get() : 0;
    }

    @Override
    public void resetConnections() {
        connectionCounts.values().forEach(counter -> counter.set(0));
        log.info("Connection counts reset for {} nodes", connectionCounts.size());
    }

    private long totalConnections() {
        return connectionCounts.values().stream().mapToLong(AtomicInteger::get).sum();
    }

    private Map<String, Integer> connectionSnapshot() {
        Map<String, Integer> snapshot = new TreeMap<>();
        connectionCounts.forEach((nodeId, counter) -> snapshot.put(nodeId, counter.get()));
        return snapshot;
    }

    private AtomicInteger connectionCounter(String nodeId) {
        return connectionCounts.computeIfAbsent(nodeId, id -> new AtomicInteger(0));
    }

    private record WeightedNode(Node node, double weight) {
    }
}
