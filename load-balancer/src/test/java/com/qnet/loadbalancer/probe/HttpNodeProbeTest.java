package com.qnet.loadbalancer.probe;

import com.qnet.core.model.Node;
import com.qnet.monitor.health.ProbeFailureException;
import com.qnet.monitor.health.ProbeResult;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServer;
import reactor.test.StepVerifier;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class HttpNodeProbeTest {

    private static final String HEALTHY_BODY = "{\"healthy\":true,\"metrics\":{\"uptimePct\":99.5,"
        + "\"cpuUsagePct\":35.0,\"memoryUsagePct\":48.0,\"networkLatencyMs\":12.0,"
        + "\"requestCount\":500,\"errorCount\":5},\"dependencies\":[],\"version\":\"2.1.0\"}";

    private static DisposableServer server;

    private final HttpNodeProbe probe = new HttpNodeProbe(Duration.ofSeconds(2));

    @BeforeAll
    static void startServer() {
        server = HttpServer.create()
            .port(0)
            .route(routes -> routes
                .get("/healthy/health", (req, res) ->
                    res.header("Content-Type", "application/json").sendString(Mono.just(HEALTHY_BODY)))
                .get("/down/health", (req, res) ->
                    res.status(HttpResponseStatus.SERVICE_UNAVAILABLE).sendString(Mono.just("maintenance")))
                .get("/garbled/health", (req, res) ->
                    res.sendString(Mono.just("{not json")))
                .get("/empty/health", (req, res) ->
                    res.status(HttpResponseStatus.OK).send()))
            .bindNow();
    }

    @AfterAll
    static void stopServer() {
        server.disposeNow();
    }

    // ========== HTTP round trips ==========

    @Test
    @DisplayName("Should parse the metrics reported by a healthy node")
    void testHealthyNode() {
        StepVerifier.create(probe.probe(node("/healthy")))
            .assertNext(result -> {
                assertTrue(result.isHealthy());
                assertEquals(35.0, result.getMetrics().getCpuUsagePct());
                assertEquals(48.0, result.getMetrics().getMemoryUsagePct());
                assertEquals(0.01, result.getMetrics().errorRate(), 1e-9);
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("A non-2xx answer should be an unhealthy result, not a probe failure")
    void testNon2xxIsUnhealthy() {
        StepVerifier.create(probe.probe(node("/down")))
            .assertNext(result -> {
                assertFalse(result.isHealthy());
                assertEquals("HTTP 503", result.getMetrics().getLastError());
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("An unreadable body should fail the probe")
    void testGarbledBodyFails() {
        StepVerifier.create(probe.probe(node("/garbled")))
            .expectErrorSatisfies(err -> {
                assertInstanceOf(ProbeFailureException.class, err);
                assertEquals("garbled", ((ProbeFailureException) err).getNodeId());
            })
            .verify(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("An empty 2xx answer should count as healthy")
    void testEmptyBodyIsHealthy() {
        StepVerifier.create(probe.probe(node("/empty")))
            .assertNext(result -> assertTrue(result.isHealthy()))
            .verifyComplete();
    }

    @Test
    @DisplayName("A node without endpoint should fail the probe without any request")
    void testMissingEndpoint() {
        Node node = Node.builder().nodeId("bare").build();

        StepVerifier.create(probe.probe(node))
            .expectErrorSatisfies(err -> {
                assertInstanceOf(ProbeFailureException.class, err);
                assertTrue(err.getMessage().contains("no health endpoint"));
            })
            .verify();
    }

    // ========== Response mapping ==========

    @Test
    @DisplayName("Missing healthy flag should default to healthy")
    void testToResultDefaultsHealthy() {
        ProbeResult result = HttpNodeProbe.toResult(node("/x"), 200, "{\"metrics\":{\"cpuUsagePct\":10}}");

        assertTrue(result.isHealthy());
        assertEquals(10.0, result.getMetrics().getCpuUsagePct());
        assertTrue(result.getDependencies().isEmpty());
    }

    @Test
    @DisplayName("Reported unhealthy flag should be kept")
    void testToResultReportedUnhealthy() {
        ProbeResult result = HttpNodeProbe.toResult(node("/x"), 200, "{\"healthy\":false}");

        assertFalse(result.isHealthy());
    }

    private static Node node(String path) {
        return Node.builder()
            .nodeId(path.substring(1))
            .endpoint("http://localhost:" + server.port() + path + "/")
            .build();
    }
}
