package com.helios.surveillance.metrics.impl.prometheus;


import com.helios.surveillance.metrics.MetricsRegistry;
import com.helios.surveillance.metrics.api.MetricsRegistryProvider;

/**
 * Prometheus-backed metrics provider.
 *
 * <p>Registered via ServiceLoader in
 * {@code META-INF/services/com.helios.surveillance.metrics.api.MetricsRegistryProvider}.
 */
public final class PrometheusMetricsRegistryProvider implements MetricsRegistryProvider {

    @Override
    public MetricsRegistry create() {
        return new PrometheusMetricsRegistry();
    }

    @Override
    public int priority() {
        return 100;  // Prefer Prometheus in production
    }

    @Override
    public String name() {
        return "Prometheus";
    }
}
