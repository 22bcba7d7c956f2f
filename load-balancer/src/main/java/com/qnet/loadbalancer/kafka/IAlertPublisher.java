package com.qnet.loadbalancer.kafka;

import com.qnet.core.alert.Alert;
import reactor.core.publisher.Mono;

/**
 * Publishes monitor alerts and failover outcomes to external consumers.
 */
public interface IAlertPublisher {

    Mono<Void> publishAlert(Alert alert);

    Mono<Void> publishFailover(FailoverEvent event);

    void close();
}
