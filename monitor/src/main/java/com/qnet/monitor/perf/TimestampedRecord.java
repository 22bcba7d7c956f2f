package com.qnet.monitor.perf;

interface TimestampedRecord {
    long timestampMs();
}
