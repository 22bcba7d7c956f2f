package com.qnet.loadbalancer.config;

import com.qnet.core.error.ConfigurationInvalidException;
import com.qnet.core.model.Node;
import com.qnet.monitor.config.MonitorConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LBConfigTest {

    @Test
    @DisplayName("Should parse id=endpoint pairs and bare ids")
    void testParseNodes() {
        List<Node> nodes = LBConfig.parseNodes(" qnet-1=http://qnet-1:8080 , qnet-2 ,,qnet-3= ");

        assertEquals(3, nodes.size());
        assertEquals("qnet-1", nodes.get(0).getNodeId());
        assertEquals("http://qnet-1:8080", nodes.get(0).getEndpoint());
        assertEquals("qnet-2", nodes.get(1).getNodeId());
        assertNull(nodes.get(1).getEndpoint());
        assertNull(nodes.get(2).getEndpoint());
    }

    @Test
    @DisplayName("Blank node lists should parse to nothing")
    void testParseEmpty() {
        assertTrue(LBConfig.parseNodes(null).isEmpty());
        assertTrue(LBConfig.parseNodes("   ").isEmpty());
    }

    @Test
    @DisplayName("Defaults should be valid")
    void testDefaultsValid() {
        LBConfig config = LBConfig.builder().build();

        assertSame(config, config.validate());
        assertEquals(8081, config.getHttpPort());
        assertEquals(50.0, config.getEligibilityThreshold());
        assertFalse(config.isAlertsKafkaEnabled());
        assertNull(config.getRandomSeed());
    }

    @Test
    @DisplayName("Validation should report every problem, including the monitor's")
    void testValidationCollectsProblems() {
        LBConfig config = LBConfig.builder()
            .httpPort(70000)
            .eligibilityThreshold(100)
            .bootstrapNodes(LBConfig.parseNodes("a=http://a,a=http://b"))
            .monitor(MonitorConfig.defaults().toBuilder().retryAttempts(-1).build())
            .build();

        ConfigurationInvalidException e = assertThrows(ConfigurationInvalidException.class, config::validate);

        assertEquals(4, e.getProblems().size(), () -> "Problems: " + e.getProblems());
        assertTrue(e.getProblems().stream().anyMatch(p -> p.contains("httpPort")));
        assertTrue(e.getProblems().stream().anyMatch(p -> p.contains("eligibilityThreshold")));
        assertTrue(e.getProblems().stream().anyMatch(p -> p.contains("duplicate bootstrap node id a")));
        assertTrue(e.getProblems().stream().anyMatch(p -> p.contains("retryAttempts")));
    }

    @Test
    @DisplayName("Kafka publishing should require a bootstrap address")
    void testKafkaRequiresBootstrap() {
        LBConfig config = LBConfig.builder()
            .alertsKafkaEnabled(true)
            .kafkaBootstrap(" ")
            .build();

        ConfigurationInvalidException e = assertThrows(ConfigurationInvalidException.class, config::validate);
        assertEquals(1, e.getProblems().size());
    }
}
