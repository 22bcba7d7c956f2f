package com.qnet.monitor.perf;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class LatencyPercentiles {
    @JsonProperty("p50")
    double p50;

    @JsonProperty("p95")
    double p95;

    @JsonProperty("p99")
    double p99;

    public static LatencyPercentiles zero() {
        return LatencyPercentiles.builder().build();
    }
}
