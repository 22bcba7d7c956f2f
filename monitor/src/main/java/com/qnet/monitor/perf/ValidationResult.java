package com.qnet.monitor.perf;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.qnet.core.alert.Alert;
import lombok.Value;

import java.util.List;

@Value
public class ValidationResult {
    @JsonProperty("valid")
    boolean valid;

    /**
     * Human readable description of each crossed threshold.
     */
    @JsonProperty("violations")
    List<String> violations;

    @JsonProperty("alerts")
    List<Alert> alerts;
}
