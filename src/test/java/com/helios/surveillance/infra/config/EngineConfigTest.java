package com.helios.surveillance.infra.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EngineConfigTest {

    @AfterEach
    void clearSystemProperties() {
        System.clearProperty("surveillance.engine.max.candidates");
    }

    @Test
    void shouldUseDocumentedDefaults() {
        EngineConfig config = EngineConfig.defaults();

        assertThat(config.maxCandidates()).isEqualTo(100);
        assertThat(config.sequentialThreshold()).isEqualTo(10);
        assertThat(config.profileTimeout()).isEqualTo(Duration.ofSeconds(1));
        assertThat(config.matchTimeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(config.flushInterval()).isEqualTo(Duration.ofSeconds(5));
        assertThat(config.pendingCapacity()).isEqualTo(10_000);
        assertThat(config.frequencyDecay()).isEqualTo(0.9);
        assertThat(config.cacheEnabled()).isTrue();
        assertThat(config.cacheTtl()).isEqualTo(Duration.ofSeconds(60));
        assertThat(config.evaluateUnindexedAlways()).isFalse();
    }

    @Test
    void shouldParseProperties() {
        Properties props = new Properties();
        props.setProperty("engine.max.candidates", "50");
        props.setProperty("engine.match.timeout.ms", "2500");
        props.setProperty("engine.evaluate.unindexed.always", "TRUE");
        props.setProperty("cache.max.size", "99");

        EngineConfig config = EngineConfig.fromProperties(props);

        assertThat(config.maxCandidates()).isEqualTo(50);
        assertThat(config.matchTimeout()).isEqualTo(Duration.ofMillis(2500));
        assertThat(config.evaluateUnindexedAlways()).isTrue();
        assertThat(config.cacheMaxSize()).isEqualTo(99);
    }

    @Test
    void shouldKeepDefaultsForInvalidValues() {
        Properties props = new Properties();
        props.setProperty("engine.max.candidates", "lots");
        props.setProperty("engine.evaluator.parallelism", "-2");
        props.setProperty("recorder.frequency.decay", "1.5");
        props.setProperty("cache.ttl.ms", "  ");

        EngineConfig config = EngineConfig.fromProperties(props);

        assertThat(config.maxCandidates()).isEqualTo(100);
        assertThat(config.evaluatorParallelism()).isEqualTo(4);
        assertThat(config.frequencyDecay()).isEqualTo(0.9);
        assertThat(config.cacheTtl()).isEqualTo(Duration.ofSeconds(60));
    }

    @Test
    void shouldLoadClasspathFileAndApplySystemPropertyOverrides() {
        System.setProperty("surveillance.engine.max.candidates", "7");

        EngineConfig config = EngineConfig.loadFromProperties("surveillance-test.properties");

        assertThat(config.maxCandidates()).isEqualTo(7);
        assertThat(config.profileTimeout()).isEqualTo(Duration.ofMillis(250));
        assertThat(config.cacheEnabled()).isFalse();
        assertThat(config.frequencyDecay()).isEqualTo(0.5);
    }

    @Test
    void shouldFallBackToDefaultsWhenFileIsMissing() {
        EngineConfig config = EngineConfig.loadFromProperties("does-not-exist.properties");

        assertThat(config.maxCandidates()).isEqualTo(100);
    }

    @Test
    void shouldMapPropertyKeysToEnvironmentNames() {
        assertThat(EngineConfig.envKey("engine.max.candidates")).isEqualTo("SURVEILLANCE_ENGINE_MAX_CANDIDATES");
    }

    @Test
    void shouldValidateBuilderArguments() {
        assertThatThrownBy(() -> EngineConfig.builder().maxCandidates(0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> EngineConfig.builder().cacheTtl(Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> EngineConfig.builder().frequencyDecay(-0.1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
