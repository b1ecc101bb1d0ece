package com.helios.surveillance.core.model;

import com.helios.surveillance.core.compiler.FilterCompiler;
import com.helios.surveillance.core.index.IndexBuilder;
import com.helios.surveillance.model.Killmail;
import com.helios.surveillance.model.Profile;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static com.helios.surveillance.Fixtures.JITA;
import static com.helios.surveillance.Fixtures.and;
import static com.helios.surveillance.Fixtures.or;
import static com.helios.surveillance.Fixtures.profile;
import static com.helios.surveillance.Fixtures.rule;
import static io.opentelemetry.api.common.AttributeKey.longKey;
import static org.assertj.core.api.Assertions.assertThat;

class GenerationBuilderTest {

    private static final Instant BUILT_AT = Instant.parse("2024-05-01T00:00:00Z");

    private InMemorySpanExporter spanExporter;
    private GenerationBuilder builder;

    @BeforeEach
    void setUp() {
        spanExporter = InMemorySpanExporter.create();
        SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
                .addSpanProcessor(SimpleSpanProcessor.create(spanExporter))
                .build();
        builder = new GenerationBuilder(new FilterCompiler(), new IndexBuilder(), tracerProvider.get("test-tracer"));
    }

    @Test
    @DisplayName("A profile that fails to compile is excluded and reported, the rest still load")
    void shouldIsolateCompileFailures() {
        // Given
        List<Profile> profiles = List.of(
                profile("jita", and(rule("solar_system_id", "eq", JITA))),
                profile("broken", and(rule("total_value", "between", List.of(1, 2)))),
                profile("rich", and(rule("total_value", "gt", 1_000_000_000L))));

        // When
        Generation generation = builder.build(3L, profiles, BUILT_AT);

        // Then
        assertThat(generation.id()).isEqualTo(3L);
        assertThat(generation.builtAt()).isEqualTo(BUILT_AT);
        assertThat(generation.size()).isEqualTo(2);
        assertThat(generation.ordinalOf("jita")).isZero();
        assertThat(generation.ordinalOf("rich")).isEqualTo(1);
        assertThat(generation.ordinalOf("broken")).isEqualTo(-1);
        assertThat(generation.failures()).containsOnlyKeys("broken");
        assertThat(generation.failures().get("broken")).contains("unsupported operator");
    }

    @Test
    void shouldSkipInactiveAndDuplicateProfiles() {
        List<Profile> profiles = List.of(
                profile("a", and(rule("solar_system_id", "eq", JITA))),
                profile("b", and(rule("solar_system_id", "eq", JITA))).withActive(false),
                profile("a", and(rule("total_value", "gt", 5))));

        Generation generation = builder.build(1L, profiles, BUILT_AT);

        assertThat(generation.size()).isEqualTo(1);
        assertThat(generation.findProfile("a").filter().toString()).contains("solar_system_id");
        assertThat(generation.findProfile("b")).isNull();
    }

    @Test
    void shouldTrackIndexedAndUnindexedProfiles() {
        List<Profile> profiles = List.of(
                profile("indexed", and(rule("solar_system_id", "eq", JITA))),
                profile("or-rooted", or(rule("solar_system_id", "eq", JITA), rule("attacker_count", "eq", 1))),
                profile("name-only", and(rule("solar_system_name", "eq", "Jita"))));

        Generation generation = builder.build(1L, profiles, BUILT_AT);

        assertThat(generation.indexedCount()).isEqualTo(1);
        assertThat(generation.unindexed().toArray()).containsExactly(1, 2);
        assertThat(generation.allProfiles().getCardinality()).isEqualTo(3);
    }

    @Test
    void shouldProduceWorkingPredicates() {
        Generation generation = builder.build(1L,
                List.of(profile("jita", and(rule("solar_system_id", "eq", JITA)))), BUILT_AT);

        CompiledProfile jita = generation.findProfile("jita");

        assertThat(jita.matches(Killmail.builder(1L).solarSystemId(JITA).build())).isTrue();
        assertThat(jita.matches(Killmail.builder(2L).solarSystemId(1L).build())).isFalse();
        assertThat(jita.name()).isEqualTo("Profile jita");
    }

    @Test
    void shouldRecordBuildSpan() {
        builder.build(7L, List.of(
                profile("ok", and(rule("solar_system_id", "eq", JITA))),
                profile("bad", and(rule("solar_system_name", "regex", "J.*")))), BUILT_AT);

        List<SpanData> spans = spanExporter.getFinishedSpanItems();
        assertThat(spans).hasSize(1);
        SpanData span = spans.get(0);
        assertThat(span.getName()).isEqualTo("build-generation");
        assertThat(span.getAttributes().get(longKey("generation"))).isEqualTo(7L);
        assertThat(span.getAttributes().get(longKey("profiles.compiled"))).isEqualTo(1L);
        assertThat(span.getAttributes().get(longKey("profiles.failed"))).isEqualTo(1L);
    }

    @Test
    void shouldBuildEmptyGeneration() {
        Generation generation = builder.build(1L, List.of(), BUILT_AT);

        assertThat(generation.size()).isZero();
        assertThat(generation.failures()).isEmpty();
    }
}
