package com.qnet.monitor.perf;

/**
 * One latency observation for an operation.
 */
public record LatencyRecord(String operation, double latencyMs, long timestampMs) implements TimestampedRecord {
}
