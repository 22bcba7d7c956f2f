package com.qnet.loadbalancer.http;

import com.qnet.core.error.NoAvailableNodesException;
import com.qnet.core.model.Node;
import com.qnet.core.util.JsonUtils;
import com.qnet.loadbalancer.balance.ILoadBalancer;
import com.qnet.loadbalancer.balance.NodeRegistry;
import com.qnet.loadbalancer.config.LBConfig;
import com.qnet.loadbalancer.metrics.PrometheusMetricsExporter;
import com.qnet.monitor.health.HealthMonitor;
import com.qnet.monitor.perf.IPerformanceMetrics;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;
import reactor.netty.http.server.HttpServerRoutes;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * HTTP server for load-balancer endpoints.
 */
public class HttpServer {
    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private static final String JSON = "application/json";

    private final LBConfig config;
    private final ILoadBalancer loadBalancer;
    private final NodeRegistry nodeRegistry;
    private final HealthMonitor healthMonitor;
    private final IPerformanceMetrics performanceMetrics;
    private final PrometheusMetricsExporter metricsExporter;

    private DisposableServer server;

    public HttpServer(
        LBConfig config,
        ILoadBalancer loadBalancer,
        NodeRegistry nodeRegistry,
        HealthMonitor healthMonitor,
        IPerformanceMetrics performanceMetrics,
        PrometheusMetricsExporter metricsExporter
    ) {
        this.config = config;
        this.loadBalancer = loadBalancer;
        this.nodeRegistry = nodeRegistry;
        this.healthMonitor = healthMonitor;
        this.performanceMetrics = performanceMetrics;
        this.metricsExporter = metricsExporter;
    }

    /**
     * Starts the HTTP server on the configured port (0 binds an ephemeral port).
     */
    public DisposableServer start() {
        server = reactor.netty.http.server.HttpServer.create()
            .port(config.getHttpPort())
            .route(this::configureRoutes)
            .bind()
            .doOnNext(bound -> log.info("HTTP server started on port {}", bound.port()))
            .doOnError(err -> log.error("Failed to start HTTP server", err))
            .block(Duration.ofSeconds(45));

        return server;
    }

    public void stop() {
        if (server != null) {
            server.disposeNow(Duration.ofSeconds(20));
        }
    }

    private void configureRoutes(HttpServerRoutes routes) {
        routes
            // Liveness
            .get("/healthz", (req, res) ->
                res.status(200).sendString(Mono.just("OK"))
            )
            .get("/metrics", (req, res) ->
                res.addHeader("Content-Type", "text/plain; version=0.0.4; charset=utf-8")
                    .sendString(Mono.just(metricsExporter.scrape()))
                    .then()
            )

            // Node registry
            .get("/api/v1/nodes", (req, res) -> sendJson(res, HttpResponseStatus.OK, nodeRegistry.getNodes()))
            .post("/api/v1/nodes", (req, res) ->
                req.receive().aggregate().asString()
                    .defaultIfEmpty("")
                    .flatMap(body -> {
                        Node node;
                        try {
                            node = JsonUtils.readValue(body, Node.class);
                        } catch (IllegalArgumentException e) {
                            return sendError(res, HttpResponseStatus.BAD_REQUEST, "Invalid node payload");
                        }
                        if (node.getNodeId() == null || node.getNodeId().isBlank()) {
                            return sendError(res, HttpResponseStatus.BAD_REQUEST, "Missing nodeId");
                        }
                        nodeRegistry.register(node);
                        return sendJson(res, HttpResponseStatus.CREATED, node);
                    })
            )
            .delete("/api/v1/nodes/{nodeId}", (req, res) -> {
                String nodeId = req.param("nodeId");
                if (!nodeRegistry.deregister(nodeId)) {
                    return sendError(res, HttpResponseStatus.NOT_FOUND, "Unknown node " + nodeId);
                }
                return res.status(HttpResponseStatus.NO_CONTENT).send();
            })

            // Distribution
            .post("/api/v1/distribute", (req, res) -> {
                String requestId = queryParam(req, "requestId");
                if (requestId == null || requestId.isEmpty()) {
                    requestId = UUID.randomUUID().toString();
                }

                long startNanos = System.nanoTime();
                try {
                    Node node = loadBalancer.distribute(requestId, nodeRegistry.getNodes());
                    performanceMetrics.recordLatency("distribute", (System.nanoTime() - startNanos) / 1_000_000.0);
                    return sendJson(res, HttpResponseStatus.OK, Map.of(
                        "requestId", requestId,
                        "nodeId", node.getNodeId(),
                        "endpoint", node.getEndpoint() != null ? node.getEndpoint() : ""
                    ));
                } catch (NoAvailableNodesException e) {
                    performanceMetrics.recordError("distribute", e);
                    return sendError(res, HttpResponseStatus.SERVICE_UNAVAILABLE, e.getMessage());
                }
            })
            .post("/api/v1/complete", (req, res) -> {
                String nodeId = queryParam(req, "nodeId");
                if (nodeId == null || nodeId.isEmpty()) {
                    return sendError(res, HttpResponseStatus.BAD_REQUEST, "Missing nodeId parameter");
                }
                loadBalancer.completeConnection(nodeId);
                return res.status(HttpResponseStatus.NO_CONTENT).send();
            })
            .post("/api/v1/failover/{nodeId}", (req, res) -> {
                String nodeId = req.param("nodeId");
                if (nodeRegistry.getNode(nodeId).isEmpty()) {
                    return sendError(res, HttpResponseStatus.NOT_FOUND, "Unknown node " + nodeId);
                }
                return nodeRegistry.markFailed(nodeId)
                    .map(result -> sendJson(res, HttpResponseStatus.OK, result))
                    .orElseGet(() -> sendError(res, HttpResponseStatus.CONFLICT, "Node " + nodeId + " is already failed"));
            })
            .get("/api/v1/load-distribution", (req, res) ->
                sendJson(res, HttpResponseStatus.OK, loadBalancer.getLoadDistribution()))
            .get("/api/v1/statistics", (req, res) ->
                sendJson(res, HttpResponseStatus.OK, loadBalancer.getStatistics()))
            .get("/api/v1/weights", (req, res) ->
                sendJson(res, HttpResponseStatus.OK, loadBalancer.getWeightSnapshot()))

            // Health monitoring
            .get("/api/v1/alerts", (req, res) -> {
                Integer limit = intParam(req, "limit", 50);
                if (limit == null) {
                    return sendError(res, HttpResponseStatus.BAD_REQUEST, "limit must be a positive integer");
                }
                return sendJson(res, HttpResponseStatus.OK, healthMonitor.recentAlerts(limit));
            })
            .get("/api/v1/health/stats", (req, res) ->
                sendJson(res, HttpResponseStatus.OK, healthMonitor.currentStats()))
            .get("/api/v1/health/{nodeId}", (req, res) -> {
                Integer limit = intParam(req, "limit", 20);
                if (limit == null) {
                    return sendError(res, HttpResponseStatus.BAD_REQUEST, "limit must be a positive integer");
                }
                return sendJson(res, HttpResponseStatus.OK, healthMonitor.healthHistory(req.param("nodeId"), limit));
            })

            // Performance
            .get("/api/v1/performance", (req, res) ->
                sendJson(res, HttpResponseStatus.OK, performanceMetrics.collectMetricsWithAlerting()))
            .get("/api/v1/performance/history", (req, res) -> {
                try {
                    long start = Long.parseLong(queryParam(req, "start"));
                    long end = Long.parseLong(queryParam(req, "end"));
                    return sendJson(res, HttpResponseStatus.OK, performanceMetrics.getHistoricalMetrics(start, end));
                } catch (NumberFormatException e) {
                    return sendError(res, HttpResponseStatus.BAD_REQUEST, "start and end must be epoch millis");
                } catch (IllegalArgumentException e) {
                    return sendError(res, HttpResponseStatus.BAD_REQUEST, e.getMessage());
                }
            })
            .post("/api/v1/performance/latency", (req, res) -> {
                String operation = queryParam(req, "operation");
                String ms = queryParam(req, "ms");
                if (operation == null || operation.isEmpty() || ms == null) {
                    return sendError(res, HttpResponseStatus.BAD_REQUEST, "Missing operation or ms parameter");
                }
                double latencyMs;
                try {
                    latencyMs = Double.parseDouble(ms);
                } catch (NumberFormatException e) {
                    return sendError(res, HttpResponseStatus.BAD_REQUEST, "ms must be a number");
                }
                if (latencyMs < 0 || Double.isNaN(latencyMs)) {
                    return sendError(res, HttpResponseStatus.BAD_REQUEST, "ms must not be negative");
                }
                performanceMetrics.recordLatency(operation, latencyMs);
                return res.status(HttpResponseStatus.NO_CONTENT).send();
            })
            .post("/api/v1/performance/error", (req, res) -> {
                String operation = queryParam(req, "operation");
                if (operation == null || operation.isEmpty()) {
                    return sendError(res, HttpResponseStatus.BAD_REQUEST, "Missing operation parameter");
                }
                String type = queryParam(req, "type");
                performanceMetrics.recordError(operation,
                    type != null && !type.isEmpty() ? type : "ReportedError",
                    queryParam(req, "message"));
                return res.status(HttpResponseStatus.NO_CONTENT).send();
            });
    }

    private static String queryParam(HttpServerRequest req, String name) {
        QueryStringDecoder decoder = new QueryStringDecoder(req.uri());
        List<String> values = decoder.parameters().get(name);
        return values != null && !values.isEmpty() ? values.get(0) : null;
    }

    /**
     * @return the parsed value, {@code defaultValue} when absent, or null when malformed
     */
    private static Integer intParam(HttpServerRequest req, String name, int defaultValue) {
        String raw = queryParam(req, name);
        if (raw == null || raw.isEmpty()) {
            return defaultValue;
        }
        try {
            int value = Integer.parseInt(raw);
            return value > 0 ? value : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Mono<Void> sendJson(HttpServerResponse res, HttpResponseStatus status, Object body) {
        return Mono.fromCallable(() -> JsonUtils.writeValueAsString(body))
            .flatMap(json ->
                res.status(status)
                    .header("Content-Type", JSON)
                    .sendString(Mono.just(json)).then()
            ).onErrorResume(err -> {
                log.error("Failed to serialize {} response", body.getClass().getSimpleName(), err);
                return res.status(HttpResponseStatus.INTERNAL_SERVER_ERROR)
                    .sendString(Mono.just("{\"error\":\"Serialization failed\"}")).then();
            });
    }

    private static Mono<Void> sendError(HttpServerResponse res, HttpResponseStatus status, String message) {
        return sendJson(res, status, Map.of("error", message != null ? message : status.reasonPhrase()));
    }
}
