package com.qnet.loadbalancer.balance;

import com.qnet.core.error.NoAvailableNodesException;
import com.qnet.core.metrics.MetricsNames;
import com.qnet.core.metrics.MetricsTags;
import com.qnet.core.model.Node;
import com.qnet.core.model.NodeStatus;
import com.qnet.core.model.ResourceSnapshot;
import com.qnet.loadbalancer.config.LBConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class LoadBalancerTest {

    private SimpleMeterRegistry meterRegistry;
    private LBConfig config;
    private LoadBalancer loadBalancer;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        config = LBConfig.builder().randomSeed(42L).build();
        loadBalancer = new LoadBalancer(config, meterRegistry);
    }

    // ========== Selection ==========

    @Test
    @DisplayName("Should only select active nodes above the eligibility threshold")
    void testOnlyEligibleNodesSelected() {
        // Given
        Node healthy = node("a", 90);
        Node degraded = node("b", 100).withStatus(NodeStatus.DEGRADED);
        Node weak = node("c", 40);
        Node failed = node("d", 95).withStatus(NodeStatus.FAILED);
        List<Node> candidates = List.of(healthy, degraded, weak, failed);

        // When / Then
        for (int i = 0; i < 200; i++) {
            assertEquals("a", loadBalancer.distribute("req-" + i, candidates).getNodeId());
        }
        assertEquals(200, loadBalancer.getNodeConnections("a"));
    }

    @Test
    @DisplayName("Should throw when there are no candidates or none is eligible")
    void testNoAvailableNodes() {
        assertThrows(NoAvailableNodesException.class, () -> loadBalancer.distribute("r", List.of()));
        assertThrows(NoAvailableNodesException.class, () -> loadBalancer.distribute("r", null));
        assertThrows(NoAvailableNodesException.class,
            () -> loadBalancer.distribute("r", List.of(node("a", 50), node("b", 10))));

        assertEquals(3.0, meterRegistry.get(MetricsNames.LB_NO_AVAILABLE_NODES_TOTAL).counter().count());
    }

    @Test
    @DisplayName("Selection frequency should approximate the weight ratio")
    void testWeightedSelectionApproximatesWeights() {
        // Given: constant weights 3:1
        WeightFunction fixed = (node, connections) -> node.getNodeId().equals("a") ? 3.0 : 1.0;
        LoadBalancer balancer = new LoadBalancer(config, meterRegistry, fixed, new Random(7));
        List<Node> candidates = List.of(node("a", 100), node("b", 100));

        // When
        Map<String, Integer> picks = new HashMap<>();
        int draws = 20_000;
        for (int i = 0; i < draws; i++) {
            picks.merge(balancer.distribute(i, candidates).getNodeId(), 1, Integer::sum);
        }

        // Then
        double shareA = picks.get("a") / (double) draws;
        assertEquals(0.75, shareA, 0.02, "Node a should get about three quarters of the draws");
        assertEquals(draws, meterRegistry.get(MetricsNames.LB_SELECTIONS_TOTAL)
            .tag(MetricsTags.STRATEGY, "weighted").counter().count());
    }

    @Test
    @DisplayName("Should fall back to round-robin when every weight is zero")
    void testRoundRobinOnZeroWeights() {
        // Given
        LoadBalancer balancer = new LoadBalancer(config, meterRegistry, (node, connections) -> 0.0, new Random(1));
        List<Node> candidates = List.of(node("a", 100), node("b", 100), node("c", 100));

        // When
        List<String> order = new ArrayList<>();
        for (int i = 0; i < 9; i++) {
            order.add(balancer.distribute(i, candidates).getNodeId());
        }

        // Then
        assertEquals(List.of("a", "b", "c", "a", "b", "c", "a", "b", "c"), order);
        assertEquals(3, balancer.getNodeConnections("a"));
        assertEquals(3, balancer.getNodeConnections("b"));
        assertEquals(3, balancer.getNodeConnections("c"));
        assertEquals(9.0, meterRegistry.get(MetricsNames.LB_SELECTIONS_TOTAL)
            .tag(MetricsTags.STRATEGY, "round_robin").counter().count());
    }

    @Test
    @DisplayName("Invalid weights should count as zero")
    void testInvalidWeightsIgnored() {
        WeightFunction broken = (node, connections) -> {
            if (node.getNodeId().equals("a")) {
                return Double.NaN;
            }
            return node.getNodeId().equals("b") ? -5.0 : 1.0;
        };
        LoadBalancer balancer = new LoadBalancer(config, meterRegistry, broken, new Random(3));
        List<Node> candidates = List.of(node("a", 100), node("b", 100), node("c", 100));

        for (int i = 0; i < 100; i++) {
            assertEquals("c", balancer.distribute(i, candidates).getNodeId());
        }
    }

    // ========== Failover ==========

    @Test
    @DisplayName("Should spread failed connections as ceil(N / remaining) per survivor")
    void testFailoverRedistribution() {
        // Given
        Node a = node("a", 100);
        loadBalancer.updateWeights(List.of(a, node("b", 100), node("c", 100), node("d", 100)));
        for (int i = 0; i < 7; i++) {
            loadBalancer.distribute(i, List.of(a));
        }

        // When
        FailoverResult result = loadBalancer.handleFailure("a");

        // Then
        assertTrue(result.isSuccess());
        assertEquals("a", result.getFailedNodeId());
        assertEquals(List.of("b", "c", "d"), result.getActiveNodes());
        assertEquals(Map.of("b", 3, "c", 3, "d", 3), result.getLoadDistribution());
        assertEquals(9, result.getRedistributedCount());
        assertNull(result.getError());

        Map<String, Double> distribution = loadBalancer.getLoadDistribution();
        assertFalse(distribution.containsKey("a"), "Failed node must not appear in the distribution");
        assertEquals(3, distribution.size());
        distribution.values().forEach(share -> assertEquals(100.0 / 3, share, 1e-9));

        assertEquals(0, loadBalancer.getNodeConnections("a"));
        assertEquals(0.0, loadBalancer.getNodeWeight("a"));
        assertFalse(loadBalancer.getWeightSnapshot().contains("a"));
        assertEquals(1.0, meterRegistry.get(MetricsNames.LB_FAILOVERS_TOTAL)
            .tag(MetricsTags.RESULT, "success").counter().count());
    }

    @Test
    @DisplayName("Failover result should report the survivors' mean latency")
    void testFailoverAverageLatency() {
        loadBalancer.updateWeights(List.of(
            node("a", 100),
            node("b", 100).withResources(new ResourceSnapshot(10, 10, 20)),
            node("c", 100).withResources(new ResourceSnapshot(10, 10, 40))));

        FailoverResult result = loadBalancer.handleFailure("a");

        assertEquals(30.0, result.getAverageLatencyMs(), 1e-9);
        assertEquals(0, result.getRedistributedCount());
    }

    @Test
    @DisplayName("Failover without survivors should return an unsuccessful result instead of throwing")
    void testFailoverExhausted() {
        // Given
        Node only = node("a", 100);
        loadBalancer.updateWeights(List.of(only));
        loadBalancer.distribute("r1", List.of(only));
        loadBalancer.distribute("r2", List.of(only));

        // When
        FailoverResult result = loadBalancer.handleFailure("a");

        // Then
        assertFalse(result.isSuccess());
        assertEquals("a", result.getFailedNodeId());
        assertNotNull(result.getError());
        assertTrue(result.getActiveNodes().isEmpty());
        assertEquals(0, result.getRedistributedCount());
        assertTrue(loadBalancer.getLoadDistribution().isEmpty());
        assertEquals(1.0, meterRegistry.get(MetricsNames.LB_FAILOVERS_TOTAL)
            .tag(MetricsTags.RESULT, "exhausted").counter().count());
    }

    @Test
    @DisplayName("Weak node is never selected, and after the strong node fails only it remains")
    void testStrongAndWeakNodeScenario() {
        // Given
        Node a = node("a", 90).withResources(new ResourceSnapshot(10, 0, 0));
        Node b = node("b", 40).withResources(new ResourceSnapshot(10, 0, 0));
        loadBalancer.updateWeights(List.of(a, b));

        // When
        for (int i = 0; i < 100; i++) {
            assertEquals("a", loadBalancer.distribute(i, List.of(a, b)).getNodeId());
        }
        FailoverResult result = loadBalancer.handleFailure("a");

        // Then
        assertTrue(result.isSuccess());
        assertEquals(List.of("b"), result.getActiveNodes());
        assertEquals(Map.of("b", 100.0), loadBalancer.getLoadDistribution());
        assertThrows(NoAvailableNodesException.class, () -> loadBalancer.distribute("next", List.of(b)));
    }

    @Test
    @DisplayName("A stale candidate list should never route to a node that already failed over")
    void testStaleCandidatesAfterFailover() {
        // Given
        Node a = node("a", 100);
        Node b = node("b", 100);
        loadBalancer.updateWeights(List.of(a, b));
        loadBalancer.distribute("r1", List.of(b));

        // When
        loadBalancer.handleFailure("a");
        Node routed = loadBalancer.distribute("r2", List.of(a, b));

        // Then
        assertEquals("b", routed.getNodeId());
        assertThrows(NoAvailableNodesException.class, () -> loadBalancer.distribute("r3", List.of(a)));
        assertFalse(loadBalancer.getLoadDistribution().containsKey("a"));
        assertEquals(0, loadBalancer.getNodeConnections("a"));
    }

    @Test
    @DisplayName("After the last node failed over, stale candidates should find no node")
    void testStaleCandidatesAfterExhaustedFailover() {
        Node a = node("a", 100);
        loadBalancer.updateWeights(List.of(a));

        loadBalancer.handleFailure("a");

        assertThrows(NoAvailableNodesException.class, () -> loadBalancer.distribute("r", List.of(a)));
        assertTrue(loadBalancer.getLoadDistribution().isEmpty());
    }

    // ========== Concurrency ==========

    @Test
    @DisplayName("Concurrent distribute and complete calls should not lose updates")
    void testConcurrentDistributeAndComplete() throws Exception {
        // Given
        List<Node> nodes = List.of(node("a", 100), node("b", 100), node("c", 100));
        loadBalancer.updateWeights(nodes);
        int threads = 8;
        int callsPerThread = 500;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        // When: every thread opens callsPerThread connections and closes half of them
        try {
            for (int t = 0; t < threads; t++) {
                int thread = t;
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < callsPerThread; i++) {
                        Node selected = loadBalancer.distribute(thread + "-" + i, nodes);
                        if (i % 2 == 0) {
                            loadBalancer.completeConnection(selected.getNodeId());
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        // Then
        long expected = (long) threads * callsPerThread / 2;
        LoadStatistics stats = loadBalancer.getStatistics();
        assertEquals(expected, stats.getTotalConnections());
        assertEquals(expected, loadBalancer.getNodeConnections("a")
            + loadBalancer.getNodeConnections("b") + loadBalancer.getNodeConnections("c"));
        assertEquals((double) threads * callsPerThread, meterRegistry.get(MetricsNames.LB_SELECTIONS_TOTAL)
            .tag(MetricsTags.STRATEGY, "weighted").counter().count());
    }

    // ========== Tracking ==========

    @Test
    @DisplayName("Updating weights should drop tracking of nodes that left")
    void testUpdateWeightsPurgesAbsentNodes() {
        // Given
        Node a = node("a", 100);
        Node b = node("b", 100);
        loadBalancer.updateWeights(List.of(a, b));
        loadBalancer.distribute(1, List.of(a));
        loadBalancer.distribute(2, List.of(b));
        WeightSnapshot before = loadBalancer.getWeightSnapshot();

        // When
        loadBalancer.updateWeights(List.of(b));

        // Then
        WeightSnapshot after = loadBalancer.getWeightSnapshot();
        assertTrue(after.getVersion() > before.getVersion());
        assertNotEquals(before.getVersionHash(), after.getVersionHash());
        assertEquals(0, loadBalancer.getNodeConnections("a"));
        assertEquals(Map.of("b", 100.0), loadBalancer.getLoadDistribution());
        assertEquals(1.0, meterRegistry.get(MetricsNames.LB_TRACKED_NODES).gauge().value());
    }

    @Test
    @DisplayName("Snapshot hash should only change when membership changes")
    void testSnapshotHashStableForSameMembership() {
        loadBalancer.updateWeights(List.of(node("a", 100), node("b", 100)));
        String hash = loadBalancer.getWeightSnapshot().getVersionHash();

        loadBalancer.updateWeights(List.of(node("b", 70), node("a", 60)));

        assertEquals(hash, loadBalancer.getWeightSnapshot().getVersionHash());
        assertTrue(loadBalancer.getNodeWeight("a") < 1.0);
    }

    @Test
    @DisplayName("Completing connections should never go below zero")
    void testCompleteConnectionFloor() {
        Node a = node("a", 100);
        loadBalancer.distribute("r", List.of(a));

        loadBalancer.completeConnection("a");
        loadBalancer.completeConnection("a");
        assertDoesNotThrow(() -> loadBalancer.completeConnection("unknown"));

        assertEquals(0, loadBalancer.getNodeConnections("a"));
        assertTrue(loadBalancer.getLoadDistribution().isEmpty());
    }

    @Test
    @DisplayName("Statistics should report totals, mean and population standard deviation")
    void testStatistics() {
        // Given
        Node a = node("a", 100);
        Node b = node("b", 100);
        for (int i = 0; i < 2; i++) {
            loadBalancer.distribute(i, List.of(a));
        }
        for (int i = 0; i < 4; i++) {
            loadBalancer.distribute(i, List.of(b));
        }

        // When
        LoadStatistics stats = loadBalancer.getStatistics();

        // Then
        assertEquals(6, stats.getTotalConnections());
        assertEquals(2, stats.getNodeCount());
        assertEquals(3.0, stats.getAverageConnectionsPerNode(), 1e-9);
        assertEquals(1.0, stats.getLoadStdDev(), 1e-9);
        assertEquals(6.0, meterRegistry.get(MetricsNames.LB_ACTIVE_CONNECTIONS).gauge().value());
    }

    @Test
    @DisplayName("Reset should zero every counter")
    void testResetConnections() {
        Node a = node("a", 100);
        loadBalancer.distribute("r1", List.of(a));
        loadBalancer.distribute("r2", List.of(a));

        loadBalancer.resetConnections();

        assertEquals(0, loadBalancer.getNodeConnections("a"));
        assertEquals(Map.of(), loadBalancer.getLoadDistribution());
        assertEquals(0, loadBalancer.getStatistics().getTotalConnections());
    }

    private static Node node(String id, double healthScore) {
        return Node.builder()
            .nodeId(id)
            .endpoint("http://" + id + ":8080")
            .healthScore(healthScore)
            .build();
    }
}
