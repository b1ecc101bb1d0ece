package com.helios.surveillance.metrics.impl.inmemory;


import com.helios.surveillance.metrics.Counter;
import com.helios.surveillance.metrics.Gauge;
import com.helios.surveillance.metrics.MetricsRegistry;
import com.helios.surveillance.metrics.Timer;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory metrics registry for testing.
 *
 * <p>Metrics are keyed by name and tags, so {@code counter("x", "path", "a")} and
 * {@code counter("x", "path", "b")} are distinct. Provides access to recorded values for assertions:
 * <pre>{@code
 * InMemoryMetricsRegistry metrics = new InMemoryMetricsRegistry();
 * metrics.counter("surveillance_matches_dropped_total").increment();
 *
 * assertThat(metrics.getCounterValue("surveillance_matches_dropped_total")).isEqualTo(1L);
 * }</pre>
 */
public final class InMemoryMetricsRegistry implements MetricsRegistry {

    private final Map<String, InMemoryCounter> counters = new ConcurrentHashMap<>();
    private final Map<String, InMemoryGauge> gauges = new ConcurrentHashMap<>();
    private final Map<String, InMemoryTimer> timers = new ConcurrentHashMap<>();

    @Override
    public Counter counter(String name, String... tags) {
        return counters.computeIfAbsent(key(name, tags), InMemoryCounter::new);
    }

    @Override
    public Gauge gauge(String name, String... tags) {
        return gauges.computeIfAbsent(key(name, tags), InMemoryGauge::new);
    }

    @Override
    public Timer timer(String name, String... tags) {
        return timers.computeIfAbsent(key(name, tags), InMemoryTimer::new);
    }

    // Test helper methods

    public long getCounterValue(String name, String... tags) {
        Counter counter = counters.get(key(name, tags));
        return counter != null ? counter.count() : 0L;
    }

    public double getGaugeValue(String name, String... tags) {
        Gauge gauge = gauges.get(key(name, tags));
        return gauge != null ? gauge.value() : 0.0;
    }

    public List<Duration> getTimerRecordings(String name, String... tags) {
        InMemoryTimer timer = timers.get(key(name, tags));
        return timer != null ? timer.getRecordings() : Collections.emptyList();
    }

    public void reset() {
        counters.clear();
        gauges.clear();
        timers.clear();
    }

    static String key(String name, String[] tags) {
        if (tags == null || tags.length == 0) {
            return name;
        }
        return name + "{" + String.join(",", tags) + "}";
    }
}
