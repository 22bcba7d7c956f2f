package com.qnet.monitor.health;

import java.time.Duration;

/**
 * Raised when a probe did not answer within the configured timeout.
 */
public class ProbeTimeoutException extends ProbeFailureException {
    private final Duration timeout;

    public ProbeTimeoutException(String nodeId, Duration timeout) {
        super(nodeId, "Health check timeout after " + timeout.toMillis() + "ms");
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
