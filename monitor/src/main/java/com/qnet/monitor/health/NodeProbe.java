package com.qnet.monitor.health;

import com.qnet.core.model.Node;
import reactor.core.publisher.Mono;

/**
 * Asks a single node how it is doing.
 * <p>
 * Implementations signal {@link ProbeFailureException} (or any error) when the node
 * cannot be reached; the monitor applies its own timeout and retries on top.
 * </p>
 */
@FunctionalInterface
public interface NodeProbe {
    Mono<ProbeResult> probe(Node node);
}
