package com.qnet.monitor.perf;

/**
 * One failed operation. Only the error type and message are kept, not the throwable.
 */
public record ErrorRecord(String operation, String errorType, String message, long timestampMs) implements TimestampedRecord {
}
