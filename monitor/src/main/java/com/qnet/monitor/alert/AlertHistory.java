package com.qnet.monitor.alert;

import com.qnet.core.alert.Alert;
import com.qnet.core.alert.AlertListener;
import com.qnet.core.metrics.MetricsNames;
import com.qnet.core.metrics.MetricsTags;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Bounded, time-ordered alert log shared by the health and performance monitors.
 * <p>
 * Once the capacity is reached the oldest alert is evicted. Listeners are invoked
 * synchronously on the recording thread; a listener that throws is logged and
 * skipped, the alert stays recorded and the remaining listeners still run.
 * </p>
 */
public class AlertHistory {
    private static final Logger log = LoggerFactory.getLogger(AlertHistory.class);

    private final Deque<Alert> alerts = new ArrayDeque<>();
    private final List<AlertListener> listeners = new CopyOnWriteArrayList<>();
    private final MeterRegistry meterRegistry;
    private volatile int capacity;

    public AlertHistory(int capacity, MeterRegistry meterRegistry) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Alert history capacity must be >= 1, got " + capacity);
        }
        this.capacity = capacity;
        this.meterRegistry = meterRegistry;

        Gauge.builder(MetricsNames.ALERTS_RETAINED, this, AlertHistory::size)
            .register(meterRegistry);
    }

    public void addListener(AlertListener listener) {
        listeners.add(listener);
    }

    public boolean removeListener(AlertListener listener) {
        return listeners.remove(listener);
    }

    /**
     * Appends an alert, evicting the oldest entries beyond capacity, then notifies listeners.
     */
    public void record(Alert alert) {
        synchronized (alerts) {
            alerts.addLast(alert);
            trimToCapacity();
        }

        Counter.builder(MetricsNames.ALERTS_TOTAL)
            .tag(MetricsTags.CATEGORY, alert.getCategory().wireName())
            .tag(MetricsTags.SEVERITY, alert.getSeverity().wireName())
            .register(meterRegistry)
            .increment();

        for (AlertListener listener : listeners) {
            try {
                listener.onAlert(alert);
            } catch (RuntimeException e) {
                log.error("Alert listener failed for alert {}", alert.getId(), e);
            }
        }
    }

    public void recordAll(List<Alert> batch) {
        batch.forEach(this::record);
    }

    /**
     * Returns up to {@code limit} of the most recent alerts, oldest first.
     */
    public List<Alert> recent(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        synchronized (alerts) {
            List<Alert> all = new ArrayList<>(alerts);
            int from = Math.max(0, all.size() - limit);
            return List.copyOf(all.subList(from, all.size()));
        }
    }

    /**
     * Drops every alert raised before {@code cutoffMs}.
     *
     * @return number of alerts removed
     */
    public int purgeOlderThan(long cutoffMs) {
        int removed = 0;
        synchronized (alerts) {
            Iterator<Alert> it = alerts.iterator();
            while (it.hasNext()) {
                if (it.next().getTimestampMs() < cutoffMs) {
                    it.remove();
                    removed++;
                }
            }
        }
        if (removed > 0) {
            log.debug("Purged {} alerts older than {}", removed, cutoffMs);
        }
        return removed;
    }

    public void clear() {
        synchronized (alerts) {
            alerts.clear();
        }
        log.info("Alert history cleared");
    }

    public int size() {
        synchronized (alerts) {
            return alerts.size();
        }
    }

    public int getCapacity() {
        return capacity;
    }

    public void setCapacity(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Alert history capacity must be >= 1, got " + capacity);
        }
        synchronized (alerts) {
            this.capacity = capacity;
            trimToCapacity();
        }
    }

    private void trimToCapacity() {
        while (alerts.size() > capacity) {
            alerts.removeFirst();
        }
    }
}
