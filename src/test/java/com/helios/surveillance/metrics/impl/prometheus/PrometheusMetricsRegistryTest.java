package com.helios.surveillance.metrics.impl.prometheus;

import com.helios.surveillance.metrics.Counter;
import com.helios.surveillance.metrics.MetricsRegistry;
import com.helios.surveillance.metrics.Timer;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.StringWriter;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PrometheusMetricsRegistryTest {

    private CollectorRegistry collectorRegistry;
    private PrometheusMetricsRegistry metrics;

    @BeforeEach
    void setUp() {
        collectorRegistry = new CollectorRegistry();
        metrics = new PrometheusMetricsRegistry(collectorRegistry);
    }

    private String scrape() throws Exception {
        StringWriter writer = new StringWriter();
        TextFormat.write004(writer, collectorRegistry.metricFamilySamples());
        return writer.toString();
    }

    @Test
    void shouldExposeCountersPerLabelSet() throws Exception {
        metrics.counter("surveillance_reloads_total", "outcome", "success").increment();
        metrics.counter("surveillance_reloads_total", "outcome", "success").increment(2);
        metrics.counter("surveillance_reloads_total", "outcome", "failure").increment();

        assertThat(metrics.counter("surveillance_reloads_total", "outcome", "success").count()).isEqualTo(3);
        assertThat(collectorRegistry.getSampleValue("surveillance_reloads_total",
                new String[]{"outcome"}, new String[]{"failure"})).isEqualTo(1.0);
        assertThat(scrape()).contains("surveillance_reloads_total{outcome=\"success\",} 3.0");
    }

    @Test
    void shouldReturnSameCounterForSameKey() {
        Counter first = metrics.counter("surveillance_matches_dropped_total");

        assertThat(metrics.counter("surveillance_matches_dropped_total")).isSameAs(first);
    }

    @Test
    void shouldRejectNegativeIncrements() {
        Counter counter = metrics.counter("surveillance_matches_flushed_total");

        assertThatThrownBy(() -> counter.increment(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldSetGauges() {
        metrics.gauge("surveillance_profiles_loaded").set(42);

        assertThat(metrics.gauge("surveillance_profiles_loaded").value()).isEqualTo(42.0);
        assertThat(collectorRegistry.getSampleValue("surveillance_profiles_loaded")).isEqualTo(42.0);
    }

    @Test
    void shouldRecordTimersAsSecondsHistogram() throws Exception {
        Timer timer = metrics.timer("surveillance_match_latency");
        timer.record(Duration.ofMillis(2));
        timer.record(Duration.ofMillis(3));
        timer.record(Duration.ofMillis(300));

        assertThat(timer.count()).isEqualTo(3);
        assertThat(timer.percentile(0.5)).isEqualTo(Duration.ofMillis(5));
        assertThat(timer.percentile(1.0)).isEqualTo(Duration.ofMillis(500));
        assertThat(collectorRegistry.getSampleValue("surveillance_match_latency_seconds_count")).isEqualTo(3.0);
        assertThat(scrape()).contains("surveillance_match_latency_seconds_bucket");
    }

    @Test
    void shouldReturnZeroPercentileWhenEmpty() {
        assertThat(metrics.timer("surveillance_idle").percentile(0.99)).isEqualTo(Duration.ZERO);
    }

    @Test
    void shouldBeDiscoveredAsDefaultProvider() {
        PrometheusMetricsRegistryProvider provider = new PrometheusMetricsRegistryProvider();

        assertThat(provider.name()).isEqualTo("Prometheus");
        assertThat(provider.priority()).isEqualTo(100);
        assertThat(MetricsRegistry.getInstance()).isInstanceOf(PrometheusMetricsRegistry.class);
    }
}
