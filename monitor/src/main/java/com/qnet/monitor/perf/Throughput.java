package com.qnet.monitor.perf;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class Throughput {
    @JsonProperty("requestsPerSecond")
    double requestsPerSecond;

    @JsonProperty("bytesPerSecond")
    double bytesPerSecond;

    public static Throughput zero() {
        return Throughput.builder().build();
    }
}
