package com.qnet.core.inventory;

import com.qnet.core.model.Node;

import java.util.Collection;

/**
 * Supplies the current node inventory to the health monitor.
 */
public interface INodeInventory {

    /**
     * Gets a point-in-time copy of all known nodes.
     */
    Collection<Node> getNodes();
}
