package com.qnet.monitor.alert;

import com.qnet.core.alert.Alert;
import com.qnet.core.alert.AlertCategory;
import com.qnet.core.alert.AlertSeverity;
import com.qnet.core.metrics.MetricsNames;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class AlertHistoryTest {

    private SimpleMeterRegistry meterRegistry;
    private AlertHistory history;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        history = new AlertHistory(5, meterRegistry);
    }

    @Test
    @DisplayName("Should never exceed capacity and evict oldest alerts first")
    void testCapacityAndFifoEviction() {
        for (int i = 0; i < 12; i++) {
            history.record(alert(i, 1000L + i));
            assertTrue(history.size() <= 5, "History must stay within capacity");
        }

        List<Alert> recent = history.recent(100);
        assertEquals(5, recent.size());
        assertEquals(List.of("m7", "m8", "m9", "m10", "m11"),
            recent.stream().map(Alert::getMessage).collect(Collectors.toList()));
    }

    @Test
    @DisplayName("Should return only the requested number of most recent alerts")
    void testRecentLimit() {
        for (int i = 0; i < 4; i++) {
            history.record(alert(i, 1000L + i));
        }

        List<Alert> recent = history.recent(2);
        assertEquals(2, recent.size());
        assertEquals("m2", recent.get(0).getMessage());
        assertEquals("m3", recent.get(1).getMessage());
        assertTrue(history.recent(0).isEmpty());
    }

    @Test
    @DisplayName("A failing listener should not block other listeners or the recording")
    void testListenerIsolation() {
        List<Alert> received = new ArrayList<>();
        history.addListener(alert -> {
            throw new IllegalStateException("listener broke");
        });
        history.addListener(received::add);

        Alert alert = alert(1, 1000L);
        assertDoesNotThrow(() -> history.record(alert));

        assertEquals(List.of(alert), received);
        assertEquals(1, history.size());
    }

    @Test
    @DisplayName("Should purge alerts older than the cutoff")
    void testPurgeOlderThan() {
        history.record(alert(1, 1000L));
        history.record(alert(2, 2000L));
        history.record(alert(3, 3000L));

        int removed = history.purgeOlderThan(2000L);

        assertEquals(1, removed);
        assertEquals(List.of("m2", "m3"),
            history.recent(10).stream().map(Alert::getMessage).collect(Collectors.toList()));
    }

    @Test
    @DisplayName("Shrinking capacity should drop the oldest alerts immediately")
    void testSetCapacity() {
        for (int i = 0; i < 5; i++) {
            history.record(alert(i, 1000L + i));
        }

        history.setCapacity(2);

        assertEquals(2, history.size());
        assertEquals("m3", history.recent(10).get(0).getMessage());
        assertThrows(IllegalArgumentException.class, () -> history.setCapacity(0));
    }

    @Test
    @DisplayName("Should count alerts per category and severity")
    void testAlertCounter() {
        history.record(alert(1, 1000L));
        history.record(alert(2, 1001L));
        history.clear();

        assertEquals(0, history.size());
        double count = meterRegistry.get(MetricsNames.ALERTS_TOTAL)
            .tag("category", "latency")
            .tag("severity", "warning")
            .counter()
            .count();
        assertEquals(2.0, count);
    }

    private static Alert alert(int i, long ts) {
        return Alert.of(AlertCategory.LATENCY, AlertSeverity.WARNING, "node-" + i, 100, 200, "m" + i, ts);
    }
}
