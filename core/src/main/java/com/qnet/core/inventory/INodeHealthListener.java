package com.qnet.core.inventory;

import com.qnet.core.model.Node;

/**
 * Receives node snapshots updated by a health-check cycle.
 */
@FunctionalInterface
public interface INodeHealthListener {

    /**
     * Called once per node per cycle with the node's new status, health score and resources.
     *
     * @param updated replacement snapshot for the node
     */
    void onNodeHealthChanged(Node updated);
}
