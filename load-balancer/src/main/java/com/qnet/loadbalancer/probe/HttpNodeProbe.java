package com.qnet.loadbalancer.probe;

import com.qnet.core.model.Node;
import com.qnet.core.util.JsonUtils;
import com.qnet.monitor.health.HealthMetrics;
import com.qnet.monitor.health.NodeProbe;
import com.qnet.monitor.health.ProbeFailureException;
import com.qnet.monitor.health.ProbeResult;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

/**
 * Probes {@code GET {endpoint}/health}.
 * <p>
 * A 2xx answer is parsed as a {@link ProbeResult} (an empty body counts as healthy);
 * any other status is an unhealthy answer. Transport errors and unparseable bodies
 * fail the probe.
 * </p>
 */
public class HttpNodeProbe implements NodeProbe {
    private static final Logger log = LoggerFactory.getLogger(HttpNodeProbe.class);

    static final String HEALTH_PATH = "/health";

    private final HttpClient httpClient;

    public HttpNodeProbe(Duration responseTimeout) {
        this(HttpClient.create()
            .headers(headers -> headers.set(HttpHeaderNames.ACCEPT, HttpHeaderValues.APPLICATION_JSON))
            .responseTimeout(responseTimeout));
    }

    HttpNodeProbe(HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public Mono<ProbeResult> probe(Node node) {
        String endpoint = node.getEndpoint();
        if (endpoint == null || endpoint.isBlank()) {
            return Mono.error(new ProbeFailureException(node.getNodeId(), "Node has no health endpoint"));
        }

        String uri = stripTrailingSlash(endpoint) + HEALTH_PATH;
        return httpClient.get()
            .uri(uri)
            .responseSingle((response, body) -> body.asString()
                .defaultIfEmpty("")
                .map(text -> toResult(node, response.status().code(), text)))
            .onErrorMap(error -> !(error instanceof ProbeFailureException),
                error -> new ProbeFailureException(node.getNodeId(),
                    "GET " + uri + " failed: " + error.getMessage(), error));
    }

    static ProbeResult toResult(Node node, int statusCode, String body) {
        if (statusCode < 200 || statusCode >= 300) {
            log.debug("Node {} answered health check with HTTP {}", node.getNodeId(), statusCode);
            return ProbeResult.unhealthy(HealthMetrics.empty().toBuilder()
                .lastError("HTTP " + statusCode)
                .build());
        }
        if (body.isBlank()) {
            return ProbeResult.healthy(HealthMetrics.empty());
        }
        try {
            return JsonUtils.readValue(body, ProbeResult.class);
        } catch (RuntimeException e) {
            throw new ProbeFailureException(node.getNodeId(), "Unreadable health payload: " + e.getMessage(), e);
        }
    }

    private static String stripTrailingSlash(String endpoint) {
        return endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
    }
}
