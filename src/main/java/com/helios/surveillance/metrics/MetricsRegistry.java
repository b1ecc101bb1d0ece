package com.helios.surveillance.metrics;

import com.helios.surveillance.metrics.internal.MetricsRegistryHolder;

/**
 * Framework-agnostic metrics registry.
 *
 * <p>This is the primary entry point for recording engine metrics.
 * Implementations are discovered via {@link java.util.ServiceLoader}.
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * MetricsRegistry metrics = MetricsRegistry.getInstance();
 * Counter dropped = metrics.counter("surveillance_matches_dropped_total");
 * dropped.increment();
 * }</pre>
 */
public interface MetricsRegistry {

    /**
     * Creates or retrieves a counter metric.
     *
     * @param name metric name (lowercase, underscores only)
     * @param tags optional key-value pairs for labels
     * @return thread-safe counter instance
     */
    Counter counter(String name, String... tags);

    /**
     * Creates or retrieves a gauge metric.
     *
     * @param name metric name
     * @param tags optional key-value pairs
     * @return thread-safe gauge instance
     */
    Gauge gauge(String name, String... tags);

    /**
     * Creates or retrieves a timer histogram.
     *
     * @param name metric name
     * @param tags optional key-value pairs
     * @return thread-safe timer instance
     */
    Timer timer(String name, String... tags);

    /**
     * Gets the singleton registry instance.
     *
     * <p>Implementation is discovered via ServiceLoader.
     * Falls back to no-op if no provider found.
     *
     * @return global metrics registry
     */
    static MetricsRegistry getInstance() {
        return MetricsRegistryHolder.INSTANCE;
    }

    /**
     * A registry that records nothing.
     */
    static MetricsRegistry noop() {
        return MetricsRegistryHolder.NO_OP;
    }
}
