package com.qnet.loadbalancer.kafka;

import com.qnet.core.alert.Alert;
import com.qnet.core.alert.AlertListener;
import com.qnet.loadbalancer.balance.FailoverListener;
import com.qnet.loadbalancer.balance.FailoverResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;

/**
 * Bridges alert history and node registry callbacks to an {@link IAlertPublisher}.
 * <p>
 * Callbacks arrive on monitor threads, so publishing is fire-and-forget: failures are
 * logged by the subscription and never reach the caller.
 * </p>
 */
public class ControlEventForwarder implements AlertListener, FailoverListener {
    private static final Logger log = LoggerFactory.getLogger(ControlEventForwarder.class);

    private final IAlertPublisher publisher;
    private final String balancerId;
    private final Clock clock;

    public ControlEventForwarder(IAlertPublisher publisher, String balancerId, Clock clock) {
        this.publisher = publisher;
        this.balancerId = balancerId;
        this.clock = clock;
    }

    @Override
    public void onAlert(Alert alert) {
        forward(publisher.publishAlert(alert), "alert " + alert.getId());
    }

    @Override
    public void onFailover(String failedNodeId, FailoverResult result) {
        FailoverEvent event = FailoverEvent.builder()
            .balancerId(balancerId)
            .failedNodeId(failedNodeId)
            .result(result)
            .timestampMs(clock.millis())
            .build();
        forward(publisher.publishFailover(event), "failover of " + failedNodeId);
    }

    private void forward(Mono<Void> publication, String what) {
        publication
            .doOnError(err -> log.warn("Dropped {}: {}", what, err.getMessage()))
            .onErrorResume(err -> Mono.empty())
            .subscribe();
    }
}
