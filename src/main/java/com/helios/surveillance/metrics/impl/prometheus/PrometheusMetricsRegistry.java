package com.helios.surveillance.metrics.impl.prometheus;

import com.helios.surveillance.metrics.Counter;
import com.helios.surveillance.metrics.Gauge;
import com.helios.surveillance.metrics.MetricsRegistry;
import com.helios.surveillance.metrics.Timer;
import io.prometheus.client.Collector;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Histogram;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Prometheus implementation of MetricsRegistry.
 *
 * <p>One Prometheus collector is registered per metric name, with the tag keys as label names;
 * every distinct tag value combination gets its own bound child. All calls for one name must use
 * the same tag keys. Thread-safe.
 */
public final class PrometheusMetricsRegistry implements MetricsRegistry {

    private static final double[] LATENCY_BUCKETS =
            {0.0001, 0.0005, 0.001, 0.005, 0.01, 0.05, 0.1, 0.5, 1.0, 5.0, 10.0};

    private final CollectorRegistry registry;
    private final Map<String, Collector> collectors = new ConcurrentHashMap<>();
    private final Map<String, Counter> counters = new ConcurrentHashMap<>();
    private final Map<String, Gauge> gauges = new ConcurrentHashMap<>();
    private final Map<String, Timer> timers = new ConcurrentHashMap<>();

    public PrometheusMetricsRegistry() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusMetricsRegistry(CollectorRegistry registry) {
        this.registry = registry;
    }

    public CollectorRegistry getCollectorRegistry() {
        return registry;
    }

    @Override
    public Counter counter(String name, String... tags) {
        return counters.computeIfAbsent(key(name, tags), k -> {
            io.prometheus.client.Counter parent = (io.prometheus.client.Counter) collectors.computeIfAbsent(
                    name, n -> io.prometheus.client.Counter.build()
                            .name(sanitizeName(n))
                            .help("Counter " + n)
                            .labelNames(extractLabelNames(tags))
                            .register(registry));
            return new CounterAdapter(parent.labels(extractLabelValues(tags)));
        });
    }

    @Override
    public Gauge gauge(String name, String... tags) {
        return gauges.computeIfAbsent(key(name, tags), k -> {
            io.prometheus.client.Gauge parent = (io.prometheus.client.Gauge) collectors.computeIfAbsent(
                    name, n -> io.prometheus.client.Gauge.build()
                            .name(sanitizeName(n))
                            .help("Gauge " + n)
                            .labelNames(extractLabelNames(tags))
                            .register(registry));
            return new GaugeAdapter(parent.labels(extractLabelValues(tags)));
        });
    }

    @Override
    public Timer timer(String name, String... tags) {
        return timers.computeIfAbsent(key(name, tags), k -> {
            Histogram parent = (Histogram) collectors.computeIfAbsent(
                    name, n -> Histogram.build()
                            .name(sanitizeName(n) + "_seconds")
                            .help("Timer " + n)
                            .buckets(LATENCY_BUCKETS)
                            .labelNames(extractLabelNames(tags))
                            .register(registry));
            return new TimerAdapter(parent.labels(extractLabelValues(tags)));
        });
    }

    private static String key(String name, String[] tags) {
        return tags.length == 0 ? name : name + "{" + String.join(",", tags) + "}";
    }

    private static String sanitizeName(String name) {
        return name.toLowerCase()
                .replaceAll("[^a-z0-9_:]", "_")
                .replaceAll("_{2,}", "_");
    }

    private static String[] extractLabelNames(String[] tags) {
        String[] labels = new String[tags.length / 2];
        for (int i = 0; i < labels.length; i++) {
            labels[i] = tags[i * 2];
        }
        return labels;
    }

    private static String[] extractLabelValues(String[] tags) {
        String[] values = new String[tags.length / 2];
        for (int i = 0; i < values.length; i++) {
            values[i] = tags[i * 2 + 1];
        }
        return values;
    }

    /**
     * Bridges {@link Counter} to a Prometheus counter child bound to fixed label values.
     */
    static final class CounterAdapter implements Counter {
        private final io.prometheus.client.Counter.Child counter;

        CounterAdapter(io.prometheus.client.Counter.Child counter) {
            this.counter = counter;
        }

        @Override
        public void increment() {
            counter.inc();
        }

        @Override
        public void increment(long amount) {
            if (amount < 0) {
                throw new IllegalArgumentException("Counter increment amount cannot be negative: " + amount);
            }
            counter.inc(amount);
        }

        @Override
        public long count() {
            // Prometheus stores as double, but counters are always whole numbers
            return (long) counter.get();
        }
    }

    static final class GaugeAdapter implements Gauge {
        private final io.prometheus.client.Gauge.Child gauge;

        GaugeAdapter(io.prometheus.client.Gauge.Child gauge) {
            this.gauge = gauge;
        }

        @Override
        public void set(double value) {
            gauge.set(value);
        }

        @Override
        public double value() {
            return gauge.get();
        }
    }

    /**
     * Histogram-backed timer. Percentiles are estimated as the upper bound of the bucket
     * containing the requested rank.
     */
    static final class TimerAdapter implements Timer {
        private final Histogram.Child histogram;

        TimerAdapter(Histogram.Child histogram) {
            this.histogram = histogram;
        }

        @Override
        public <T> T record(Callable<T> callable) throws Exception {
            long start = System.nanoTime();
            try {
                return callable.call();
            } finally {
                record(Duration.ofNanos(System.nanoTime() - start));
            }
        }

        @Override
        public void record(Duration duration) {
            histogram.observe(duration.toNanos() / 1_000_000_000.0);
        }

        @Override
        public Duration percentile(double percentile) {
            double[] cumulative = histogram.get().buckets;
            if (cumulative.length == 0) {
                return Duration.ZERO;
            }
            double total = cumulative[cumulative.length - 1];
            if (total == 0) {
                return Duration.ZERO;
            }
            double rank = Math.max(0.0, Math.min(1.0, percentile)) * total;
            for (int i = 0; i < LATENCY_BUCKETS.length; i++) {
                if (cumulative[i] >= rank) {
                    return Duration.ofNanos((long) (LATENCY_BUCKETS[i] * 1_000_000_000L));
                }
            }
            return Duration.ofNanos((long) (LATENCY_BUCKETS[LATENCY_BUCKETS.length - 1] * 1_000_000_000L));
        }

        @Override
        public long count() {
            double[] cumulative = histogram.get().buckets;
            return cumulative.length == 0 ? 0L : (long) cumulative[cumulative.length - 1];
        }
    }
}
