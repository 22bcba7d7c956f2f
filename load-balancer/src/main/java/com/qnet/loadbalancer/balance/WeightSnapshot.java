package com.qnet.loadbalancer.balance;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.qnet.core.hash.Hashers;
import com.qnet.core.model.Node;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable, versioned view of the tracked nodes and their weights.
 * <p>
 * The load balancer swaps the whole snapshot on every recomputation, so a reader
 * holding one never observes a half-applied update.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class WeightSnapshot {
    /**
     * Monotonically increasing version number.
     */
    @JsonProperty("version")
    long version;

    @JsonProperty("issuedAt")
    Instant issuedAt;

    /**
     * SHA-256 of the sorted node-id set. Changes only when membership changes.
     */
    @JsonProperty("versionHash")
    String versionHash;

    @JsonProperty("weights")
    Map<String, Double> weights;

    @JsonIgnore
    Map<String, Node> nodes;

    public static WeightSnapshot empty() {
        return WeightSnapshot.builder()
            .version(0)
            .issuedAt(Instant.EPOCH)
            .versionHash(Hashers.fingerprint(List.of()))
            .weights(Map.of())
            .nodes(Map.of())
            .build();
    }

    /**
     * Copy of this snapshot without {@code nodeId}, stamped with a new version.
     */
    public WeightSnapshot without(String nodeId, long newVersion, Instant issuedAt) {
        Map<String, Double> remainingWeights = new HashMap<>(weights);
        remainingWeights.remove(nodeId);
        Map<String, Node> remainingNodes = new HashMap<>(nodes);
        remainingNodes.remove(nodeId);

        return WeightSnapshot.builder()
            .version(newVersion)
            .issuedAt(issuedAt)
            .versionHash(Hashers.fingerprint(remainingWeights.keySet()))
            .weights(Map.copyOf(remainingWeights))
            .nodes(Map.copyOf(remainingNodes))
            .build();
    }

    public boolean contains(String nodeId) {
        return weights.containsKey(nodeId);
    }
}
