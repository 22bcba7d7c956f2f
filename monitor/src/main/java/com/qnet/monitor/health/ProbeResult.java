package com.qnet.monitor.health;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Answer of a successful probe. Also the JSON body served by a node's health endpoint.
 */
@Value
@Builder(toBuilder = true)
public class ProbeResult {
    @JsonProperty("healthy")
    @Builder.Default
    boolean healthy = true;

    @JsonProperty("metrics")
    @Builder.Default
    HealthMetrics metrics = HealthMetrics.empty();

    @JsonProperty("dependencies")
    @Builder.Default
    List<DependencyStatus> dependencies = List.of();

    @JsonCreator
    public ProbeResult(
        @JsonProperty("healthy") Boolean healthy,
        @JsonProperty("metrics") HealthMetrics metrics,
        @JsonProperty("dependencies") List<DependencyStatus> dependencies
    ) {
        this.healthy = healthy == null || healthy;
        this.metrics = metrics != null ? metrics : HealthMetrics.empty();
        this.dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
    }

    public static ProbeResult healthy(HealthMetrics metrics) {
        return ProbeResult.builder().healthy(true).metrics(metrics).build();
    }

    public static ProbeResult unhealthy(HealthMetrics metrics) {
        return ProbeResult.builder().healthy(false).metrics(metrics).build();
    }
}
