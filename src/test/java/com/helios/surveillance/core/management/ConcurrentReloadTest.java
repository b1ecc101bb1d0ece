package com.helios.surveillance.core.management;

import com.helios.surveillance.infra.config.EngineConfig;
import com.helios.surveillance.model.Killmail;
import com.helios.surveillance.model.MatchResult;
import com.helios.surveillance.model.Profile;
import com.helios.surveillance.store.InMemoryMatchStore;
import com.helios.surveillance.store.InMemoryProfileStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import static com.helios.surveillance.Fixtures.JITA;
import static com.helios.surveillance.Fixtures.and;
import static com.helios.surveillance.Fixtures.or;
import static com.helios.surveillance.Fixtures.profile;
import static com.helios.surveillance.Fixtures.rule;
import static org.assertj.core.api.Assertions.assertThat;

class ConcurrentReloadTest {

    private static final int PROFILES_PER_SET = 15;
    private static final int MATCH_THREADS = 4;
    private static final int MATCHES_PER_THREAD = 250;

    private MatchCoordinator coordinator;
    private ExecutorService workers;

    @AfterEach
    void tearDown() throws InterruptedException {
        if (workers != null) {
            workers.shutdownNow();
            workers.awaitTermination(5, TimeUnit.SECONDS);
        }
        if (coordinator != null) {
            coordinator.shutdown();
        }
    }

    /**
     * Every profile in a set matches a Jita kill, so a result from one generation is exactly one whole set.
     */
    private static List<Profile> profileSet(String prefix) {
        List<Profile> profiles = new ArrayList<>();
        for (int i = 0; i < PROFILES_PER_SET; i++) {
            if (i % 3 == 0) {
                profiles.add(profile(prefix + i, or(
                        rule("solar_system_name", "eq", "Jita"),
                        rule("attacker_count", "gt", 1_000))));
            } else {
                profiles.add(profile(prefix + i, and(rule("system_id", "in", List.of(JITA)))));
            }
        }
        return profiles;
    }

    private static Set<String> ids(List<Profile> profiles) {
        Set<String> ids = new TreeSet<>();
        profiles.forEach(p -> ids.add(p.id()));
        return ids;
    }

    @Test
    @DisplayName("Matches interleaved with reloads always see exactly one generation")
    void shouldNeverMixGenerations() throws Exception {
        // Given
        List<Profile> setA = profileSet("a-");
        List<Profile> setB = profileSet("b-");
        InMemoryProfileStore profileStore = new InMemoryProfileStore(setA);
        coordinator = MatchCoordinator.builder(profileStore)
                .matchStore(new InMemoryMatchStore())
                .config(EngineConfig.builder()
                        .flushInterval(Duration.ofMillis(50))
                        .profileTimeout(Duration.ofSeconds(5))
                        .evaluateUnindexedAlways(true)
                        .build())
                .build();
        coordinator.start();

        workers = Executors.newFixedThreadPool(MATCH_THREADS + 1);
        CountDownLatch startGate = new CountDownLatch(1);
        AtomicBoolean matching = new AtomicBoolean(true);
        AtomicLong killmailIds = new AtomicLong();
        Queue<MatchResult> results = new ConcurrentLinkedQueue<>();

        // When
        Future<Integer> reloader = workers.submit(() -> {
            startGate.await();
            int reloads = 0;
            while (matching.get()) {
                profileStore.clear();
                (reloads % 2 == 0 ? setB : setA).forEach(profileStore::put);
                assertThat(coordinator.reload()).isTrue();
                reloads++;
            }
            return reloads;
        });

        List<Future<?>> matchers = new ArrayList<>();
        for (int t = 0; t < MATCH_THREADS; t++) {
            matchers.add(workers.submit(() -> {
                startGate.await();
                for (int i = 0; i < MATCHES_PER_THREAD; i++) {
                    Killmail killmail = Killmail.builder(killmailIds.incrementAndGet())
                            .solarSystem(JITA, "Jita")
                            .totalValue(1_000.0)
                            .build();
                    results.add(coordinator.evaluate(killmail));
                }
                return null;
            }));
        }

        startGate.countDown();
        for (Future<?> matcher : matchers) {
            matcher.get(60, TimeUnit.SECONDS);
        }
        matching.set(false);
        int reloads = reloader.get(60, TimeUnit.SECONDS);

        // Then
        Set<String> idsA = ids(setA);
        Set<String> idsB = ids(setB);
        assertThat(reloads).isPositive();
        assertThat(results).hasSize(MATCH_THREADS * MATCHES_PER_THREAD);
        for (MatchResult result : results) {
            assertThat(result.generation()).isPositive();
            assertThat(new TreeSet<>(result.matchedProfileIds()))
                    .as("killmail %d under generation %d", result.killmailId(), result.generation())
                    .isIn(idsA, idsB);
        }
    }
}
