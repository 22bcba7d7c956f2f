package com.qnet.loadbalancer.config;

import com.qnet.core.error.ConfigurationInvalidException;
import com.qnet.core.model.Node;
import com.qnet.monitor.config.MonitorConfig;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Configuration for the load balancer, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class LBConfig {

    @Builder.Default
    String nodeId = "qnet-lb-1";
    @Builder.Default
    int httpPort = 8081;
    @Builder.Default
    String kafkaBootstrap = "localhost:9092";

    // Publish alerts and failover results to Kafka
    @Builder.Default
    boolean alertsKafkaEnabled = false;

    // Nodes need a health score strictly above this to receive work
    @Builder.Default
    double eligibilityThreshold = 50.0;

    // Seed for weighted draws; null picks a random seed
    Long randomSeed;

    // Nodes registered at startup (NODES="id=http://host:port,...")
    @Builder.Default
    List<Node> bootstrapNodes = List.of();

    @Builder.Default
    MonitorConfig monitor = MonitorConfig.defaults();

    public static LBConfig fromEnv() {
        String seed = System.getenv("RANDOM_SEED");
        return LBConfig.builder()
            .nodeId(getEnv("NODE_ID", "qnet-lb-1"))
            .httpPort(Integer.parseInt(getEnv("HTTP_PORT", "8081")))
            .kafkaBootstrap(getEnv("KAFKA_BOOTSTRAP", "localhost:9092"))
            .alertsKafkaEnabled(Boolean.parseBoolean(getEnv("ALERTS_KAFKA_ENABLED", "false")))
            .eligibilityThreshold(Double.parseDouble(getEnv("ELIGIBILITY_THRESHOLD", "50")))
            .randomSeed(seed != null && !seed.isBlank() ? Long.parseLong(seed.trim()) : null)
            .bootstrapNodes(parseNodes(getEnv("NODES", "")))
            .monitor(MonitorConfig.fromEnv())
            .build();
    }

    /**
     * Parses {@code id=endpoint} pairs separated by commas. An entry without {@code =} is a
     * node without a health endpoint.
     */
    public static List<Node> parseNodes(String value) {
        List<Node> nodes = new ArrayList<>();
        if (value == null || value.isBlank()) {
            return nodes;
        }
        for (String entry : value.split(",")) {
            String trimmed = entry.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            int eq = trimmed.indexOf('=');
            String id = eq >= 0 ? trimmed.substring(0, eq).trim() : trimmed;
            String endpoint = eq >= 0 ? trimmed.substring(eq + 1).trim() : null;
            nodes.add(Node.builder()
                .nodeId(id)
                .endpoint(endpoint == null || endpoint.isEmpty() ? null : endpoint)
                .build());
        }
        return nodes;
    }

    /**
     * @return this config, for chaining
     * @throws ConfigurationInvalidException listing every problem found, including the monitor's
     */
    public LBConfig validate() {
        List<String> problems = new ArrayList<>();

        if (nodeId == null || nodeId.isBlank()) {
            problems.add("nodeId must not be blank");
        }
        if (httpPort < 0 || httpPort > 65535) {
            problems.add("httpPort must be within [0, 65535], got " + httpPort);
        }
        if (alertsKafkaEnabled && (kafkaBootstrap == null || kafkaBootstrap.isBlank())) {
            problems.add("kafkaBootstrap is required when alertsKafkaEnabled is set");
        }
        if (eligibilityThreshold < 0 || eligibilityThreshold >= 100) {
            problems.add("eligibilityThreshold must be within [0, 100), got " + eligibilityThreshold);
        }

        Set<String> seen = new HashSet<>();
        for (Node node : bootstrapNodes) {
            if (node.getNodeId() == null || node.getNodeId().isBlank()) {
                problems.add("bootstrap node with blank id");
            } else if (!seen.add(node.getNodeId())) {
                problems.add("duplicate bootstrap node id " + node.getNodeId());
            }
        }

        if (monitor == null) {
            problems.add("monitor configuration is required");
        } else {
            try {
                monitor.validate();
            } catch (ConfigurationInvalidException e) {
                problems.addAll(e.getProblems());
            }
        }

        if (!problems.isEmpty()) {
            throw new ConfigurationInvalidException(problems);
        }
        return this;
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}
