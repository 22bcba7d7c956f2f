package com.qnet.monitor.health;

import com.qnet.core.alert.Alert;
import com.qnet.core.alert.AlertCategory;
import com.qnet.core.alert.AlertListener;
import com.qnet.core.alert.AlertSeverity;
import com.qnet.core.inventory.INodeHealthListener;
import com.qnet.core.inventory.INodeInventory;
import com.qnet.core.metrics.MetricsNames;
import com.qnet.core.metrics.MetricsTags;
import com.qnet.core.model.Node;
import com.qnet.core.model.NodeStatus;
import com.qnet.core.util.JitterBackoff;
import com.qnet.monitor.alert.AlertHistory;
import com.qnet.monitor.config.AlertThresholds;
import com.qnet.monitor.config.MonitorConfig;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Periodically probes every node of an inventory and turns the answers into node status,
 * rolling health scores and alerts.
 * <p>
 * <b>Cycle:</b>
 * 1. Snapshot the inventory
 * 2. Probe all nodes concurrently, each attempt bounded by the probe timeout and retried with jittered
 *    backoff, the whole retried probe bounded by the probe budget
 * 3. Record a {@link HealthCheckResult} per node and raise alerts for crossed thresholds
 * 4. Push the updated nodes to the registered {@link INodeHealthListener}s
 * 5. Purge alerts past retention and publish {@link HealthMonitorStats}
 * </p>
 * <p>
 * A failing probe never aborts its siblings. Stopping cancels the ticker only; a cycle
 * already running completes on its own subscription.
 * </p>
 */
public class HealthMonitor {
    private static final Logger log = LoggerFactory.getLogger(HealthMonitor.class);

    private static final int DEFAULT_HISTORY_LIMIT = 20;
    private static final int DEFAULT_ALERT_LIMIT = 50;

    private final NodeProbe probe;
    private final AlertHistory alertHistory;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final List<INodeHealthListener> healthListeners = new CopyOnWriteArrayList<>();
    private final Map<String, Deque<HealthCheckResult>> healthHistory = new ConcurrentHashMap<>();
    private final AtomicBoolean monitoring = new AtomicBoolean(false);
    private final AtomicBoolean cycleInFlight = new AtomicBoolean(false);
    private final Timer cycleTimer;

    private volatile MonitorConfig config;
    private volatile INodeInventory inventory;
    private volatile Disposable ticker;
    private volatile HealthMonitorStats lastStats;

    public HealthMonitor(MonitorConfig config, NodeProbe probe, AlertHistory alertHistory, MeterRegistry meterRegistry) {
        this(config, probe, alertHistory, meterRegistry, Clock.systemUTC());
    }

    public HealthMonitor(MonitorConfig config,
                         NodeProbe probe,
                         AlertHistory alertHistory,
                         MeterRegistry meterRegistry,
                         Clock clock) {
        this.config = config.validate();
        this.probe = probe;
        this.alertHistory = alertHistory;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.lastStats = HealthMonitorStats.empty(clock.millis());

        this.cycleTimer = Timer.builder(MetricsNames.HEALTH_CYCLE_LATENCY)
            .register(meterRegistry);
        Gauge.builder(MetricsNames.HEALTH_OVERALL_SCORE, this, m -> m.lastStats.getOverallHealthScore())
            .register(meterRegistry);
    }

    public void addHealthListener(INodeHealthListener listener) {
        healthListeners.add(listener);
    }

    public void onAlert(AlertListener listener) {
        alertHistory.addListener(listener);
    }

    /**
     * Starts probing the given inventory: one cycle immediately, then one per check interval.
     * Calling this while monitoring is active only logs a warning.
     */
    public synchronized void startMonitoring(INodeInventory inventory) {
        if (!monitoring.compareAndSet(false, true)) {
            log.warn("Health monitoring is already active, ignoring start request");
            return;
        }
        this.inventory = inventory;

        MonitorConfig cfg = config;
        log.info("Starting health monitoring (interval={}ms, timeout={}ms, retries={})",
            cfg.getCheckInterval().toMillis(), cfg.getProbeTimeout().toMillis(), cfg.getRetryAttempts());

        ticker = scheduleTicker(Duration.ZERO, cfg.getCheckInterval());
    }

    /**
     * Cancels the ticker. A cycle that is already probing finishes normally.
     */
    public synchronized void stopMonitoring() {
        if (!monitoring.compareAndSet(true, false)) {
            log.debug("Health monitoring is not active");
            return;
        }
        Disposable current = ticker;
        if (current != null) {
            current.dispose();
        }
        ticker = null;
        log.info("Health monitoring stopped");
    }

    public boolean isMonitoring() {
        return monitoring.get();
    }

    /**
     * Replaces the configuration. Probe settings and thresholds apply from the next cycle;
     * a changed check interval reschedules the running ticker.
     */
    public synchronized void updateConfig(MonitorConfig newConfig) {
        newConfig.validate();
        MonitorConfig previous = this.config;
        this.config = newConfig;
        alertHistory.setCapacity(newConfig.getMaxAlertHistory());
        log.info("Health monitor configuration updated");

        if (monitoring.get() && !previous.getCheckInterval().equals(newConfig.getCheckInterval())) {
            Disposable current = ticker;
            if (current != null) {
                current.dispose();
            }
            ticker = scheduleTicker(newConfig.getCheckInterval(), newConfig.getCheckInterval());
            log.info("Health check interval changed to {}ms", newConfig.getCheckInterval().toMillis());
        }
    }

    public MonitorConfig getConfig() {
        return config;
    }

    private Disposable scheduleTicker(Duration initialDelay, Duration interval) {
        return Flux.interval(initialDelay, interval)
            .subscribe(
                tick -> triggerCycle(),
                error -> log.error("Health monitoring ticker terminated unexpectedly", error)
            );
    }

    private void triggerCycle() {
        INodeInventory target = inventory;
        if (!monitoring.get() || target == null) {
            return;
        }
        if (!cycleInFlight.compareAndSet(false, true)) {
            log.warn("Previous health check cycle still running, skipping tick");
            return;
        }

        // Detached from the ticker so that disposing it does not cancel probes mid-flight
        runCycle(target)
            .doOnError(error -> log.error("Health check cycle failed", error))
            .onErrorResume(error -> Mono.empty())
            .doFinally(signal -> cycleInFlight.set(false))
            .subscribe();
    }

    /**
     * Runs a single health check cycle against {@code inventory}.
     *
     * @return stats computed once every node has been probed
     */
    public Mono<HealthMonitorStats> runCycle(INodeInventory inventory) {
        return Mono.defer(() -> {
            MonitorConfig cfg = config;
            List<Node> nodes = List.copyOf(inventory.getNodes());
            Timer.Sample sample = Timer.start(meterRegistry);

            log.debug("Running health check cycle for {} nodes", nodes.size());

            return Flux.fromIterable(nodes)
                .flatMap(node -> checkNode(node, cfg))
                .collectList()
                .map(updated -> completeCycle(updated, cfg))
                .doFinally(signal -> sample.stop(cycleTimer));
        });
    }

    private Mono<Node> checkNode(Node node, MonitorConfig cfg) {
        long startNanos = System.nanoTime();

        return Mono.defer(() -> probe.probe(node))
            .timeout(cfg.getProbeTimeout())
            .onErrorMap(TimeoutException.class, e -> new ProbeTimeoutException(node.getNodeId(), cfg.getProbeTimeout()))
            .switchIfEmpty(Mono.error(() -> new ProbeFailureException(node.getNodeId(), "Probe completed without a result")))
            .retryWhen(retrySpec(node, cfg))
            .timeout(cfg.getProbeBudget())
            .onErrorMap(TimeoutException.class, e -> new ProbeTimeoutException(node.getNodeId(), cfg.getProbeBudget()))
            .map(answer -> answeredResult(node, answer, elapsedMs(startNanos), cfg))
            .onErrorResume(error -> Mono.just(failedResult(node, error, elapsedMs(startNanos))))
            .map(result -> applyResult(node, result, cfg));
    }

    // Timeouts already spent the whole budget; only outright failures are retried
    private Retry retrySpec(Node node, MonitorConfig cfg) {
        return Retry.from(signals -> signals.concatMap(signal -> {
            Throwable failure = signal.failure();
            long attempt = signal.totalRetries();
            if (failure instanceof ProbeTimeoutException || attempt >= cfg.getRetryAttempts()) {
                return Mono.<Long>error(failure);
            }

            Duration delay = JitterBackoff.next(
                (int) attempt,
                cfg.getRetryBackoff(),
                cfg.getProbeTimeout(),
                cfg.getRetryBackoff().dividedBy(2)
            );
            log.debug("Probe of node {} failed ({}), retry {}/{} in {}ms",
                node.getNodeId(), failure.getMessage(), attempt + 1, cfg.getRetryAttempts(), delay.toMillis());
            return Mono.delay(delay);
        }));
    }

    private HealthCheckResult answeredResult(Node node, ProbeResult answer, double elapsedMs, MonitorConfig cfg) {
        double score = HealthScoring.checkScore(
            answer.isHealthy(), answer.getMetrics(), elapsedMs, cfg.getProbeTimeout().toMillis());

        meterRegistry.timer(MetricsNames.HEALTH_PROBE_LATENCY,
                MetricsTags.NODE_ID, node.getNodeId(),
                MetricsTags.RESULT, answer.isHealthy() ? "healthy" : "unhealthy")
            .record((long) elapsedMs, TimeUnit.MILLISECONDS);

        return HealthCheckResult.builder()
            .nodeId(node.getNodeId())
            .status(answer.isHealthy() ? HealthCheckStatus.ACTIVE : HealthCheckStatus.ERROR)
            .checkedAtMs(clock.millis())
            .responseTimeMs(elapsedMs)
            .metrics(answer.getMetrics())
            .dependencies(answer.getDependencies())
            .checkScore(score)
            .build();
    }

    private HealthCheckResult failedResult(Node node, Throwable error, double elapsedMs) {
        boolean timedOut = error instanceof ProbeTimeoutException;
        double responseTimeMs = timedOut ? ((ProbeTimeoutException) error).getTimeout().toMillis() : elapsedMs;
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();

        Counter.builder(MetricsNames.HEALTH_PROBE_FAILURES_TOTAL)
            .tag(MetricsTags.NODE_ID, node.getNodeId())
            .tag(MetricsTags.REASON, timedOut ? "timeout" : "error")
            .register(meterRegistry)
            .increment();

        log.warn("Health check failed for node {}: {}", node.getNodeId(), message);

        return HealthCheckResult.builder()
            .nodeId(node.getNodeId())
            .status(HealthCheckStatus.ERROR)
            .checkedAtMs(clock.millis())
            .responseTimeMs(responseTimeMs)
            .error(message)
            .checkScore(0.0)
            .build();
    }

    private Node applyResult(Node node, HealthCheckResult result, MonitorConfig cfg) {
        List<HealthCheckResult> history = appendHistory(result, cfg.getMaxHealthHistory());
        boolean probeFailed = result.getError() != null;

        if (probeFailed) {
            raiseAlert(cfg, node.getNodeId(), AlertCategory.AVAILABILITY, AlertSeverity.CRITICAL,
                1.0, 0.0, "Node health check failed: " + result.getError(), result.getCheckedAtMs());
        } else {
            evaluateAlerts(node.getNodeId(), result, cfg);
        }

        double score = HealthScoring.rollingScore(history);
        NodeStatus status;
        if (probeFailed) {
            status = NodeStatus.FAILED;
            score = Math.min(score, cfg.getUnhealthyThreshold());
        } else {
            status = result.getStatus() == HealthCheckStatus.ACTIVE ? NodeStatus.ACTIVE : NodeStatus.DEGRADED;
        }

        Node updated = node.toBuilder()
            .status(status)
            .healthScore(score)
            .resources(probeFailed ? node.getResources() : result.getMetrics().toResourceSnapshot())
            .lastHealthCheckMs(result.getCheckedAtMs())
            .build();

        if (status != node.getStatus()) {
            log.info("Node {} status changed: {} -> {} (health score {})",
                node.getNodeId(), node.getStatus(), status, String.format("%.1f", score));
        }

        notifyListeners(updated);
        return updated;
    }

    private void evaluateAlerts(String nodeId, HealthCheckResult result, MonitorConfig cfg) {
        AlertThresholds thresholds = cfg.getAlertThresholds();
        HealthMetrics metrics = result.getMetrics();
        long ts = result.getCheckedAtMs();

        if (result.getResponseTimeMs() > thresholds.getResponseTimeMs()) {
            raiseAlert(cfg, nodeId, AlertCategory.LATENCY, AlertSeverity.WARNING,
                thresholds.getResponseTimeMs(), result.getResponseTimeMs(),
                String.format("High response time: %.0fms", result.getResponseTimeMs()), ts);
        }
        if (metrics.getCpuUsagePct() > thresholds.getCpuUsagePct()) {
            raiseAlert(cfg, nodeId, AlertCategory.RESOURCE, AlertSeverity.ERROR,
                thresholds.getCpuUsagePct(), metrics.getCpuUsagePct(),
                String.format("High CPU usage: %.1f%%", metrics.getCpuUsagePct()), ts);
        }
        if (metrics.getMemoryUsagePct() > thresholds.getMemoryUsagePct()) {
            raiseAlert(cfg, nodeId, AlertCategory.RESOURCE, AlertSeverity.ERROR,
                thresholds.getMemoryUsagePct(), metrics.getMemoryUsagePct(),
                String.format("High memory usage: %.1f%%", metrics.getMemoryUsagePct()), ts);
        }
        if (metrics.errorRate() > thresholds.getErrorRate()) {
            raiseAlert(cfg, nodeId, AlertCategory.ERROR_RATE, AlertSeverity.WARNING,
                thresholds.getErrorRate(), metrics.errorRate(),
                String.format("High error rate: %.2f%%", metrics.errorRate() * 100), ts);
        }
        if (result.getStatus() == HealthCheckStatus.ERROR) {
            raiseAlert(cfg, nodeId, AlertCategory.AVAILABILITY, AlertSeverity.CRITICAL,
                1.0, 0.0, "Node is in error state", ts);
        }
    }

    private void raiseAlert(MonitorConfig cfg,
                            String nodeId,
                            AlertCategory category,
                            AlertSeverity severity,
                            double threshold,
                            double observed,
                            String message,
                            long timestampMs) {
        if (!cfg.isAlertingEnabled()) {
            return;
        }
        log.warn("[{}] {} alert for node {}: {}", severity, category, nodeId, message);
        alertHistory.record(Alert.of(category, severity, nodeId, threshold, observed, message, timestampMs));
    }

    private void notifyListeners(Node updated) {
        for (INodeHealthListener listener : healthListeners) {
            try {
                listener.onNodeHealthChanged(updated);
            } catch (RuntimeException e) {
                log.error("Health listener failed for node {}", updated.getNodeId(), e);
            }
        }
    }

    private HealthMonitorStats completeCycle(List<Node> updated, MonitorConfig cfg) {
        long now = clock.millis();
        alertHistory.purgeOlderThan(now - cfg.getRetentionPeriod().toMillis());

        // Drop histories of nodes that left the inventory
        Set<String> probedIds = updated.stream().map(Node::getNodeId).collect(Collectors.toSet());
        healthHistory.keySet().retainAll(probedIds);

        HealthMonitorStats stats = computeStats(updated, now);
        lastStats = stats;

        log.info("Health check cycle completed: {} nodes ({} active, {} degraded, {} failed), overall score {}",
            stats.getTotalNodes(), stats.getActiveNodes(), stats.getDegradedNodes(), stats.getFailedNodes(),
            String.format("%.1f", stats.getOverallHealthScore()));
        return stats;
    }

    private HealthMonitorStats computeStats(Collection<Node> nodes, long nowMs) {
        int total = nodes.size();
        int active = 0;
        int degraded = 0;
        int failed = 0;
        for (Node node : nodes) {
            switch (node.getStatus()) {
                case ACTIVE:
                    active++;
                    break;
                case DEGRADED:
                    degraded++;
                    break;
                case FAILED:
                    failed++;
                    break;
                default:
                    break;
            }
        }

        // Mean over nodes of each node's rolling response time
        double responseTimeSum = 0.0;
        int responseTimeCount = 0;
        for (Node node : nodes) {
            List<HealthCheckResult> recent = healthHistory(node.getNodeId(), HealthScoring.ROLLING_WINDOW);
            if (!recent.isEmpty()) {
                responseTimeSum += HealthScoring.rollingResponseTime(recent);
                responseTimeCount++;
            }
        }

        return HealthMonitorStats.builder()
            .totalNodes(total)
            .activeNodes(active)
            .degradedNodes(degraded)
            .failedNodes(failed)
            .averageResponseTimeMs(responseTimeCount > 0 ? responseTimeSum / responseTimeCount : 0.0)
            .overallHealthScore(total > 0 ? (double) active / total * 100.0 : 0.0)
            .lastUpdateMs(nowMs)
            .build();
    }

    /**
     * Stats for the monitored inventory as it is right now, or the last cycle's stats
     * when monitoring has never been started.
     */
    public HealthMonitorStats currentStats() {
        INodeInventory target = inventory;
        if (target == null) {
            return lastStats;
        }
        return computeStats(target.getNodes(), clock.millis());
    }

    public HealthMonitorStats lastCycleStats() {
        return lastStats;
    }

    private List<HealthCheckResult> appendHistory(HealthCheckResult result, int maxEntries) {
        Deque<HealthCheckResult> deque = healthHistory.computeIfAbsent(result.getNodeId(), id -> new ArrayDeque<>());
        synchronized (deque) {
            deque.addLast(result);
            while (deque.size() > maxEntries) {
                deque.removeFirst();
            }
            return new ArrayList<>(deque);
        }
    }

    /**
     * Returns up to {@code limit} of the node's most recent check results, oldest first.
     */
    public List<HealthCheckResult> healthHistory(String nodeId, int limit) {
        Deque<HealthCheckResult> deque = healthHistory.get(nodeId);
        if (deque == null || limit <= 0) {
            return List.of();
        }
        synchronized (deque) {
            List<HealthCheckResult> all = new ArrayList<>(deque);
            return List.copyOf(all.subList(Math.max(0, all.size() - limit), all.size()));
        }
    }

    public List<HealthCheckResult> healthHistory(String nodeId) {
        return healthHistory(nodeId, DEFAULT_HISTORY_LIMIT);
    }

    public List<Alert> recentAlerts(int limit) {
        return alertHistory.recent(limit);
    }

    public List<Alert> recentAlerts() {
        return recentAlerts(DEFAULT_ALERT_LIMIT);
    }

    public void clearAlerts() {
        alertHistory.clear();
    }

    private static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }
}
