package com.qnet.loadbalancer.kafka;

import com.qnet.core.alert.Alert;
import com.qnet.core.alert.AlertCategory;
import com.qnet.core.alert.AlertSeverity;
import com.qnet.loadbalancer.balance.FailoverResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ControlEventForwarderTest {

    private final Clock clock = Clock.fixed(Instant.ofEpochMilli(42_000L), ZoneOffset.UTC);

    @Test
    @DisplayName("Should publish alerts as they are recorded")
    void testForwardsAlerts() {
        StubPublisher publisher = new StubPublisher();
        ControlEventForwarder forwarder = new ControlEventForwarder(publisher, "lb-1", clock);

        Alert alert = Alert.of(AlertCategory.LATENCY, AlertSeverity.WARNING, "node-1",
            2000, 3500, "High response time: 3500ms", 1000L);
        forwarder.onAlert(alert);

        assertEquals(List.of(alert), publisher.alerts);
    }

    @Test
    @DisplayName("Should wrap failover results with the balancer id and timestamp")
    void testForwardsFailover() {
        StubPublisher publisher = new StubPublisher();
        ControlEventForwarder forwarder = new ControlEventForwarder(publisher, "lb-1", clock);
        FailoverResult result = FailoverResult.builder()
            .success(true)
            .failedNodeId("node-1")
            .activeNodes(List.of("node-2"))
            .build();

        forwarder.onFailover("node-1", result);

        assertEquals(1, publisher.failovers.size());
        FailoverEvent event = publisher.failovers.get(0);
        assertEquals("lb-1", event.getBalancerId());
        assertEquals("node-1", event.getFailedNodeId());
        assertSame(result, event.getResult());
        assertEquals(42_000L, event.getTimestampMs());
    }

    @Test
    @DisplayName("Publishing failures should not reach the caller")
    void testPublishFailureSwallowedByPipeline() {
        StubPublisher publisher = new StubPublisher();
        publisher.failure = new IllegalStateException("broker down");
        ControlEventForwarder forwarder = new ControlEventForwarder(publisher, "lb-1", clock);

        assertDoesNotThrow(() -> forwarder.onAlert(
            Alert.of(AlertCategory.RESOURCE, AlertSeverity.ERROR, "node-1", 80, 95, "High CPU usage: 95.0%", 1L)));
        assertDoesNotThrow(() -> forwarder.onFailover("node-1", FailoverResult.exhausted("node-1")));
    }

    private static class StubPublisher implements IAlertPublisher {
        final List<Alert> alerts = new ArrayList<>();
        final List<FailoverEvent> failovers = new ArrayList<>();
        RuntimeException failure;

        @Override
        public Mono<Void> publishAlert(Alert alert) {
            return Mono.defer(() -> {
                if (failure != null) {
                    return Mono.error(failure);
                }
                alerts.add(alert);
                return Mono.<Void>empty();
            });
        }

        @Override
        public Mono<Void> publishFailover(FailoverEvent event) {
            return Mono.defer(() -> {
                if (failure != null) {
                    return Mono.error(failure);
                }
                failovers.add(event);
                return Mono.<Void>empty();
            });
        }

        @Override
        public void close() {
        }
    }
}
