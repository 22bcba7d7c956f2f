package com.qnet.core.error;

/**
 * Thrown on the request path when no candidate node passes the eligibility gate.
 */
public class NoAvailableNodesException extends RuntimeException {

    public NoAvailableNodesException(String message) {
        super(message);
    }
}
