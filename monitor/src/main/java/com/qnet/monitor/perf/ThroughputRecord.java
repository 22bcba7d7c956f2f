package com.qnet.monitor.perf;

/**
 * A batch of completed requests for an operation.
 */
public record ThroughputRecord(String operation, long requestCount, long dataBytes, long durationMs, long timestampMs) implements TimestampedRecord {
}
