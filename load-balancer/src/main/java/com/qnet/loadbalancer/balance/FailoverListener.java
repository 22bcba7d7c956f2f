package com.qnet.loadbalancer.balance;

/**
 * Notified after the registry ran failover for a node that transitioned into FAILED.
 */
@FunctionalInterface
public interface FailoverListener {
    void onFailover(String failedNodeId, FailoverResult result);
}
