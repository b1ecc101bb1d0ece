package com.helios.surveillance.core.evaluation;

import com.helios.surveillance.core.compiler.KillmailPredicate;
import com.helios.surveillance.core.index.IndexContribution;
import com.helios.surveillance.core.index.ProfileIndexes;
import com.helios.surveillance.core.model.CompiledProfile;
import com.helios.surveillance.core.model.Generation;
import com.helios.surveillance.metrics.impl.inmemory.InMemoryMetricsRegistry;
import com.helios.surveillance.model.FilterNode;
import com.helios.surveillance.model.FilterOperator;
import com.helios.surveillance.model.Killmail;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.roaringbitmap.RoaringBitmap;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class EvaluatorTest {

    private static final FilterNode DUMMY = new FilterNode.Rule("total_value", FilterOperator.GT, 0L);

    private InMemoryMetricsRegistry metrics;
    private Evaluator evaluator;
    private final Killmail killmail = Killmail.builder(1L).totalValue(100.0).build();

    @BeforeEach
    void setUp() {
        metrics = new InMemoryMetricsRegistry();
        evaluator = new Evaluator(10, 4, Duration.ofMillis(200), metrics);
    }

    @AfterEach
    void tearDown() {
        evaluator.close();
    }

    private static CompiledProfile profile(String id, KillmailPredicate predicate) {
        return new CompiledProfile(id, id, DUMMY, predicate, IndexContribution.EMPTY);
    }

    private static Generation generation(List<CompiledProfile> profiles) {
        return new Generation(1L, Instant.EPOCH, profiles, ProfileIndexes.builder().build(), Map.of());
    }

    private static List<CompiledProfile> alternating(int count) {
        List<CompiledProfile> profiles = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            boolean even = i % 2 == 0;
            profiles.add(profile("p" + i, k -> even));
        }
        return profiles;
    }

    @Test
    void shouldEvaluateSmallSetsSequentially() {
        Generation generation = generation(alternating(6));

        Set<String> matched = evaluator.evaluate(killmail, generation, generation.allProfiles());

        assertThat(matched).containsExactly("p0", "p2", "p4");
        assertThat(metrics.getCounterValue("surveillance_profile_evaluations_total")).isEqualTo(6);
    }

    @Test
    void shouldStopEarlyAndKeepInterruptFlagWhenInterrupted() {
        Generation small = generation(alternating(6));
        Generation large = generation(alternating(40));

        Thread.currentThread().interrupt();
        try {
            assertThat(evaluator.evaluate(killmail, small, small.allProfiles())).isEmpty();
            assertThat(Thread.currentThread().isInterrupted()).isTrue();

            assertThat(evaluator.evaluate(killmail, large, large.allProfiles())).isEmpty();
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void shouldEvaluateLargeSetsInParallel() {
        Generation generation = generation(alternating(40));

        Set<String> matched = evaluator.evaluate(killmail, generation, generation.allProfiles());

        assertThat(matched).hasSize(20).contains("p0", "p38").doesNotContain("p1");
    }

    @Test
    void shouldOnlyEvaluateCandidates() {
        Generation generation = generation(alternating(6));

        Set<String> matched = evaluator.evaluate(killmail, generation, RoaringBitmap.bitmapOf(1, 2));

        assertThat(matched).containsExactly("p2");
        assertThat(evaluator.evaluate(killmail, generation, new RoaringBitmap())).isEmpty();
    }

    @Test
    void shouldTreatSlowProfileAsNoMatch() {
        List<CompiledProfile> profiles = alternating(12);
        profiles.set(0, profile("slow", k -> {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return true;
        }));
        Generation generation = generation(profiles);

        Set<String> matched = evaluator.evaluate(killmail, generation, generation.allProfiles());

        assertThat(matched).doesNotContain("slow").contains("p2", "p10");
        assertThat(metrics.getCounterValue("surveillance_profile_evaluation_timeouts_total")).isEqualTo(1);
    }

    @Test
    void shouldStartProfileTimeoutWhenItsResultIsCollected() {
        List<CompiledProfile> profiles = alternating(12);
        profiles.set(0, profile("stuck", sleepingThenTrue(5_000)));
        // runs longer than the 200 ms timeout, but its wait only starts once "stuck" has timed out
        profiles.set(1, profile("late", sleepingThenTrue(250)));
        Generation generation = generation(profiles);

        Set<String> matched = evaluator.evaluate(killmail, generation, generation.allProfiles());

        assertThat(matched).doesNotContain("stuck").contains("late", "p2");
        assertThat(metrics.getCounterValue("surveillance_profile_evaluation_timeouts_total")).isEqualTo(1);
    }

    private static KillmailPredicate sleepingThenTrue(long millis) {
        return k -> {
            try {
                Thread.sleep(millis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return true;
        };
    }

    @Test
    void shouldTreatFailingProfileAsNoMatch() {
        KillmailPredicate failing = k -> {
            throw new IllegalStateException("boom");
        };
        List<CompiledProfile> small = List.of(profile("bad", failing), profile("good", k -> true));
        List<CompiledProfile> large = new ArrayList<>(alternating(12));
        large.add(profile("bad", failing));

        Generation smallGeneration = generation(small);
        Generation largeGeneration = generation(large);

        assertThat(evaluator.evaluate(killmail, smallGeneration, smallGeneration.allProfiles()))
                .containsExactly("good");
        assertThat(evaluator.evaluate(killmail, largeGeneration, largeGeneration.allProfiles()))
                .doesNotContain("bad")
                .hasSize(6);
        assertThat(metrics.getCounterValue("surveillance_profile_evaluation_failures_total")).isEqualTo(2);
    }
}
