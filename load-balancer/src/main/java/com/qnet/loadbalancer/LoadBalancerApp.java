package com.qnet.loadbalancer;

import com.qnet.core.model.Node;
import com.qnet.loadbalancer.balance.LoadBalancer;
import com.qnet.loadbalancer.balance.NodeRegistry;
import com.qnet.loadbalancer.config.LBConfig;
import com.qnet.loadbalancer.http.HttpServer;
import com.qnet.loadbalancer.kafka.ControlEventForwarder;
import com.qnet.loadbalancer.kafka.KafkaAlertPublisher;
import com.qnet.loadbalancer.metrics.PrometheusMetricsExporter;
import com.qnet.loadbalancer.probe.HttpNodeProbe;
import com.qnet.monitor.alert.AlertHistory;
import com.qnet.monitor.config.MonitorConfig;
import com.qnet.monitor.health.HealthMonitor;
import com.qnet.monitor.perf.PerformanceMetricsService;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.netty.DisposableServer;

import java.time.Clock;

public class LoadBalancerApp {
    private static final Logger log = LoggerFactory.getLogger(LoadBalancerApp.class);

    public static void main(String[] args) {
        LBConfig config = LBConfig.fromEnv().validate();
        MonitorConfig monitorConfig = config.getMonitor();

        log.info("Starting Load-Balancer {}", config.getNodeId());
        log.info("  HTTP port: {}", config.getHttpPort());
        log.info("  Bootstrap nodes: {}", config.getBootstrapNodes().size());
        log.info("  Check interval: {}", monitorConfig.getCheckInterval());
        log.info("  Kafka alerts: {}", config.isAlertsKafkaEnabled() ? config.getKafkaBootstrap() : "disabled");

        // Setup metrics
        PrometheusMetricsExporter metricsExporter = new PrometheusMetricsExporter(config.getNodeId());
        MeterRegistry registry = metricsExporter.getRegistry();

        // Initialize components
        AlertHistory alertHistory = new AlertHistory(monitorConfig.getMaxAlertHistory(), registry);
        LoadBalancer loadBalancer = new LoadBalancer(config, registry);
        NodeRegistry nodeRegistry = new NodeRegistry(loadBalancer);
        for (Node node : config.getBootstrapNodes()) {
            nodeRegistry.register(node);
        }

        HealthMonitor healthMonitor = new HealthMonitor(
            monitorConfig,
            new HttpNodeProbe(monitorConfig.getProbeTimeout()),
            alertHistory,
            registry
        );
        healthMonitor.addHealthListener(nodeRegistry);

        PerformanceMetricsService performanceMetrics = new PerformanceMetricsService(monitorConfig, alertHistory, registry);

        KafkaAlertPublisher alertPublisher = null;
        if (config.isAlertsKafkaEnabled()) {
            alertPublisher = new KafkaAlertPublisher(config);
            ControlEventForwarder forwarder = new ControlEventForwarder(alertPublisher, config.getNodeId(), Clock.systemUTC());
            alertHistory.addListener(forwarder);
            nodeRegistry.addFailoverListener(forwarder);
        }

        // Start HTTP server
        HttpServer httpServer = new HttpServer(
            config,
            loadBalancer,
            nodeRegistry,
            healthMonitor,
            performanceMetrics,
            metricsExporter
        );

        DisposableServer disposableServer = httpServer.start();

        healthMonitor.startMonitoring(nodeRegistry);
        performanceMetrics.startMonitoring();

        log.info("Load-Balancer is ready");

        handleShutDown(healthMonitor, performanceMetrics, httpServer, alertPublisher);

        disposableServer.onDispose().block();
    }

    private static void handleShutDown(
        HealthMonitor healthMonitor,
        PerformanceMetricsService performanceMetrics,
        HttpServer httpServer,
        KafkaAlertPublisher alertPublisher
    ) {
        // Graceful shutdown
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown signal received");

            healthMonitor.stopMonitoring();
            performanceMetrics.stopMonitoring();

            httpServer.stop();

            if (alertPublisher != null) {
                alertPublisher.close();
            }

            log.info("Shutdown complete");
        }));
    }
}
