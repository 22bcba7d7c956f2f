package com.qnet.loadbalancer.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the process meter registry and renders it in Prometheus text format.
 * <p>
 * Components register meters on {@link #getRegistry()}; {@code /metrics} serves {@link #scrape()}.
 * </p>
 */
public class PrometheusMetricsExporter {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsExporter.class);

    @Getter
    private final MeterRegistry registry;
    private final PrometheusMeterRegistry prometheusRegistry;

    public PrometheusMetricsExporter(String balancerId) {
        this.prometheusRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        CompositeMeterRegistry composite = new CompositeMeterRegistry();
        composite.add(prometheusRegistry);
        this.registry = composite;

        // Node-scoped meters carry their own node_id tag
        registry.config().commonTags("balancer_id", balancerId);

        new JvmMemoryMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        log.info("Metrics exporter initialized with Prometheus registry");
    }

    public String scrape() {
        return prometheusRegistry.scrape();
    }
}
