package com.qnet.monitor.health;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HealthScoringTest {

    @Test
    @DisplayName("Idle healthy node answering instantly should score 100")
    void testPerfectScore() {
        double score = HealthScoring.checkScore(true, ScriptedProbe.metrics(0, 0), 0, 5000);

        assertEquals(100.0, score, 1e-9);
    }

    @Test
    @DisplayName("Each component should contribute its weight")
    void testComponentWeights() {
        // unhealthy, 50% cpu, 25% mem, half the timeout
        double score = HealthScoring.checkScore(false, ScriptedProbe.metrics(50, 25), 2500, 5000);

        assertEquals(100 * (0.0 + 0.2 * 0.5 + 0.2 * 0.75 + 0.2 * 0.5), score, 1e-9);
    }

    @Test
    @DisplayName("Response time beyond the timeout should not push the score negative")
    void testSlowResponseClamped() {
        double score = HealthScoring.checkScore(true, ScriptedProbe.metrics(100, 100), 9000, 5000);

        assertEquals(40.0, score, 1e-9);
    }

    @Test
    @DisplayName("Rolling score should average only the last five checks")
    void testRollingWindow() {
        List<HealthCheckResult> history = new ArrayList<>();
        double[] scores = {0, 0, 100, 80, 60, 40, 20};
        for (double s : scores) {
            history.add(HealthCheckResult.builder().nodeId("n").checkScore(s).responseTimeMs(s).build());
        }

        assertEquals(60.0, HealthScoring.rollingScore(history), 1e-9);
        assertEquals(60.0, HealthScoring.rollingResponseTime(history), 1e-9);
        assertEquals(0.0, HealthScoring.rollingScore(List.of()));
    }
}
