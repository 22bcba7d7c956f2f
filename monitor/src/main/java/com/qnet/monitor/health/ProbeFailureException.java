package com.qnet.monitor.health;

/**
 * Raised when a node could not be probed.
 */
public class ProbeFailureException extends RuntimeException {
    private final String nodeId;

    public ProbeFailureException(String nodeId, String message) {
        super(message);
        this.nodeId = nodeId;
    }

    public ProbeFailureException(String nodeId, String message, Throwable cause) {
        super(message, cause);
        this.nodeId = nodeId;
    }

    public String getNodeId() {
        return nodeId;
    }
}
