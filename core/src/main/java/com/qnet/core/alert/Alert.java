package com.qnet.core.alert;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Structured record raised when an observed value crosses a configured threshold.
 * <p>
 * Both the health monitor (per node) and the performance validator (per service)
 * produce alerts of this shape, so consumers only deal with one taxonomy.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class Alert {
    @JsonProperty("id")
    String id;

    @JsonProperty("category")
    AlertCategory category;

    @JsonProperty("severity")
    AlertSeverity severity;

    /**
     * Node id for health alerts, null for service-wide performance alerts.
     */
    @JsonProperty("source")
    String source;

    @JsonProperty("threshold")
    double threshold;

    @JsonProperty("observedValue")
    double observedValue;

    @JsonProperty("message")
    String message;

    /**
     * Epoch millis when the alert was raised.
     */
    @JsonProperty("timestampMs")
    long timestampMs;

    @JsonCreator
    public Alert(
        @JsonProperty("id") String id,
        @JsonProperty("category") AlertCategory category,
        @JsonProperty("severity") AlertSeverity severity,
        @JsonProperty("source") String source,
        @JsonProperty("threshold") double threshold,
        @JsonProperty("observedValue") double observedValue,
        @JsonProperty("message") String message,
        @JsonProperty("timestampMs") long timestampMs
    ) {
        this.id = id;
        this.category = category;
        this.severity = severity;
        this.source = source;
        this.threshold = threshold;
        this.observedValue = observedValue;
        this.message = message;
        this.timestampMs = timestampMs;
    }

    /**
     * Creates an alert with a generated id of the form {@code <category>_<ts>_<random>}.
     */
    public static Alert of(AlertCategory category,
                           AlertSeverity severity,
                           String source,
                           double threshold,
                           double observedValue,
                           String message,
                           long timestampMs) {
        String id = category.wireName() + "_" + timestampMs + "_"
            + Long.toString(ThreadLocalRandom.current().nextLong(Long.MAX_VALUE), 36);
        return new Alert(id, category, severity, source, threshold, observedValue, message, timestampMs);
    }
}
