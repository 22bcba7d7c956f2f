package com.qnet.monitor.health;

import com.qnet.core.inventory.INodeHealthListener;
import com.qnet.core.inventory.INodeInventory;
import com.qnet.core.model.Node;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory inventory that keeps whatever the monitor pushes back.
 */
class TestInventory implements INodeInventory, INodeHealthListener {
    private final Map<String, Node> nodes = new LinkedHashMap<>();

    TestInventory(Node... initial) {
        for (Node node : initial) {
            nodes.put(node.getNodeId(), node);
        }
    }

    @Override
    public synchronized Collection<Node> getNodes() {
        return List.copyOf(nodes.values());
    }

    @Override
    public synchronized void onNodeHealthChanged(Node updated) {
        nodes.put(updated.getNodeId(), updated);
    }

    synchronized Node get(String nodeId) {
        return nodes.get(nodeId);
    }

    synchronized void add(Node node) {
        nodes.put(node.getNodeId(), node);
    }

    synchronized void remove(String nodeId) {
        nodes.remove(nodeId);
    }
}
