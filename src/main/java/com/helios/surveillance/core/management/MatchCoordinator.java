/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.surveillance.core.management;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.helios.surveillance.api.IFilterCompiler;
import com.helios.surveillance.api.ISurveillanceEngine;
import com.helios.surveillance.core.cache.CacheFactory;
import com.helios.surveillance.core.cache.MatchCache;
import com.helios.surveillance.core.cache.MatchFingerprint;
import com.helios.surveillance.core.compiler.CompilationException;
import com.helios.surveillance.core.compiler.CompiledFilter;
import com.helios.surveillance.core.compiler.FilterCompiler;
import com.helios.surveillance.core.compiler.FilterInterpreter;
import com.helios.surveillance.core.evaluation.Evaluator;
import com.helios.surveillance.core.index.IndexBuilder;
import com.helios.surveillance.core.model.CompiledProfile;
import com.helios.surveillance.core.model.Generation;
import com.helios.surveillance.core.model.GenerationBuilder;
import com.helios.surveillance.core.recording.FrequencyTracker;
import com.helios.surveillance.core.recording.MatchRecorder;
import com.helios.surveillance.core.selection.CandidateSelector;
import com.helios.surveillance.core.selection.CandidateSet;
import com.helios.surveillance.infra.config.EngineConfig;
import com.helios.surveillance.infrastructure.telemetry.TracingService;
import com.helios.surveillance.metrics.Counter;
import com.helios.surveillance.metrics.Gauge;
import com.helios.surveillance.metrics.MetricsRegistry;
import com.helios.surveillance.metrics.Timer;
import com.helios.surveillance.model.EngineStats;
import com.helios.surveillance.model.ExplanationResult;
import com.helios.surveillance.model.Killmail;
import com.helios.surveillance.model.MatchResult;
import com.helios.surveillance.model.Profile;
import com.helios.surveillance.store.MatchListener;
import com.helios.surveillance.store.MatchStore;
import com.helios.surveillance.store.ProfileStore;
import com.helios.surveillance.store.ProfileStoreException;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns the active profile generation, the match cache and the match recorder.
 *
 * <h2>Concurrency</h2>
 * <p>The active generation is held in an {@link AtomicReference}. A match reads it once and works
 * on that snapshot for the rest of the call, so a concurrent reload never shows it a half-built
 * index. Reloads are serialized by a lock and build the next generation completely before the
 * swap. Predicate evaluation runs outside any lock.
 *
 * <p>Match calls run on a bounded executor so the overall timeout can be enforced; a call that
 * exceeds it returns an empty result.
 */
public class MatchCoordinator implements ISurveillanceEngine {
    private static final Logger logger = Logger.getLogger(MatchCoordinator.class.getName());

    private final EngineConfig config;
    private final ProfileStore profileStore;
    private final Clock clock;
    private final Tracer tracer;

    private final IFilterCompiler compiler;
    private final GenerationBuilder generationBuilder;
    private final FrequencyTracker frequencies;
    private final CandidateSelector selector;
    private final Evaluator evaluator;
    private final MatchCache cache;
    private final MatchRecorder recorder;
    private final ExecutorService matchExecutor;

    private final AtomicReference<Generation> current = new AtomicReference<>(Generation.empty());
    private final AtomicLong generationIds = new AtomicLong();
    private final ReentrantLock reloadLock = new ReentrantLock();
    private final LongAdder matchesProcessed = new LongAdder();
    private volatile Instant lastReloadAt;

    private final Timer matchLatency;
    private final Counter matchCounter;
    private final Counter matchTimeouts;
    private final Counter reloadSuccess;
    private final Counter reloadFailure;
    private final Gauge profilesLoaded;

    private MatchCoordinator(Builder builder) {
        this.config = builder.config;
        this.profileStore = builder.profileStore;
        this.clock = builder.clock;
        this.tracer = builder.tracer;
        MetricsRegistry metrics = builder.metrics;

        this.compiler = new FilterCompiler();
        this.generationBuilder = new GenerationBuilder(compiler, new IndexBuilder(), tracer);
        this.frequencies = new FrequencyTracker(config.frequencyDecay());
        this.selector = new CandidateSelector(config.maxCandidates(), config.evaluateUnindexedAlways(), frequencies);
        this.evaluator = new Evaluator(config.sequentialThreshold(), config.evaluatorParallelism(),
                config.profileTimeout(), metrics);
        this.cache = builder.cache != null ? builder.cache : CacheFactory.create(config);
        this.recorder = new MatchRecorder(config, builder.matchStore, builder.listener, frequencies,
                tracer, metrics, clock);
        this.matchExecutor = Executors.newFixedThreadPool(config.matchThreads(),
                new ThreadFactoryBuilder()
                        .setNameFormat("surveillance-match-%d")
                        .setDaemon(true)
                        .build());

        this.matchLatency = metrics.timer("surveillance_match_latency");
        this.matchCounter = metrics.counter("surveillance_matches_processed_total");
        this.matchTimeouts = metrics.counter("surveillance_match_timeouts_total");
        this.reloadSuccess = metrics.counter("surveillance_reloads_total", "outcome", "success");
        this.reloadFailure = metrics.counter("surveillance_reloads_total", "outcome", "failure");
        this.profilesLoaded = metrics.gauge("surveillance_profiles_loaded");

        logger.info("MatchCoordinator created with " + config);
    }

    public static Builder builder(ProfileStore profileStore) {
        return new Builder(profileStore);
    }

    // ================================================================
    // LIFECYCLE
    // ================================================================

    @Override
    public void start() throws ProfileStoreException {
        loadGeneration(); // Initial load, fail fast
        recorder.start();
    }

    @Override
    public void shutdown() {
        logger.info("Shutting down match coordinator...");
        matchExecutor.shutdown();
        try {
            if (!matchExecutor.awaitTermination(config.matchTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                matchExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            matchExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        recorder.close();
        evaluator.close();
    }

    // ================================================================
    // RELOAD
    // ================================================================

    @Override
    public boolean reload() {
        try {
            loadGeneration();
            return true;
        } catch (ProfileStoreException e) {
            reloadFailure.increment();
            logger.log(Level.SEVERE, "Failed to load profiles. Generation "
                    + current.get().id() + " remains active.", e);
            return false;
        }
    }

    private void loadGeneration() throws ProfileStoreException {
        reloadLock.lock();
        Span span = tracer.spanBuilder("reload-profiles").startSpan();
        try (Scope scope = span.makeCurrent()) {
            List<Profile> profiles = profileStore.findActiveProfiles();
            span.setAttribute("profiles.active", profiles.size());

            Generation next = generationBuilder.build(generationIds.incrementAndGet(), profiles, clock.instant());
            Generation previous = current.getAndSet(next);
            cache.invalidateAll();

            List<String> ids = new ArrayList<>(next.size());
            for (int i = 0; i < next.size(); i++) {
                ids.add(next.profile(i).id());
            }
            frequencies.retainAll(ids);

            lastReloadAt = next.builtAt();
            reloadSuccess.increment();
            profilesLoaded.set(next.size());
            span.setAttribute("generation", next.id());
            logger.info("Swapped generation " + previous.id() + " -> " + next.id()
                    + " (" + next.size() + " profiles, " + next.failures().size() + " failed)");
        } catch (ProfileStoreException | RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR);
            throw e;
        } finally {
            span.end();
            reloadLock.unlock();
        }
    }

    // ================================================================
    // MATCH
    // ================================================================

    @Override
    public Set<String> match(Killmail killmail) {
        return evaluate(killmail).matchedProfileIds();
    }

    @Override
    public MatchResult evaluate(Killmail killmail) {
        Objects.requireNonNull(killmail, "killmail cannot be null");
        Span span = tracer.spanBuilder("match-killmail").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("killmail.id", killmail.killmailId());
            Callable<MatchResult> task = () -> doMatch(killmail);
            Future<MatchResult> future = matchExecutor.submit(Context.current().wrap(task));
            try {
                MatchResult result = future.get(config.matchTimeout().toMillis(), TimeUnit.MILLISECONDS);
                span.setAttribute("matches", result.matchedProfileIds().size());
                span.setAttribute("fromCache", result.fromCache());
                return result;
            } catch (TimeoutException e) {
                future.cancel(true);
                matchTimeouts.increment();
                span.addEvent("Match timed out");
                logger.warning("Match of killmail " + killmail.killmailId() + " timed out after "
                        + config.matchTimeout().toMillis() + " ms");
                return MatchResult.empty(killmail.killmailId());
            } catch (ExecutionException e) {
                span.recordException(e.getCause());
                logger.log(Level.SEVERE, "Match of killmail " + killmail.killmailId() + " failed", e.getCause());
                return MatchResult.empty(killmail.killmailId());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return MatchResult.empty(killmail.killmailId());
            }
        } catch (RejectedExecutionException e) {
            span.recordException(e);
            logger.warning("Match of killmail " + killmail.killmailId() + " rejected: engine is shut down");
            return MatchResult.empty(killmail.killmailId());
        } finally {
            span.end();
        }
    }

    private MatchResult doMatch(Killmail killmail) {
        long start = System.nanoTime();
        Generation generation = current.get();
        long fingerprint = MatchFingerprint.of(killmail, generation.id());

        Optional<Set<String>> cached = cache.lookup(fingerprint);
        if (cached.isPresent()) {
            matchesProcessed.increment();
            matchCounter.increment();
            long elapsed = System.nanoTime() - start;
            matchLatency.record(Duration.ofNanos(elapsed));
            return new MatchResult(killmail.killmailId(), cached.get(), generation.id(), true, 0, elapsed);
        }

        CandidateSet candidates = selector.select(killmail, generation);
        Set<String> matched = evaluator.evaluate(killmail, generation, candidates.ordinals());
        if (Thread.currentThread().isInterrupted()) {
            // Timed out by the caller: the set may be partial, keep it out of the cache and the recorder
            logger.fine(() -> "Discarding interrupted match of killmail " + killmail.killmailId());
            return MatchResult.empty(killmail.killmailId());
        }
        cache.store(fingerprint, matched, config.cacheTtl());

        Instant matchedAt = clock.instant();
        for (String profileId : matched) {
            CompiledProfile profile = generation.findProfile(profileId);
            recorder.record(profileId, profile.name(), killmail, matchedAt);
        }

        matchesProcessed.increment();
        matchCounter.increment();
        long elapsed = System.nanoTime() - start;
        matchLatency.record(Duration.ofNanos(elapsed));
        logger.fine(() -> String.format("Killmail %d: %d candidates via %s, %d matches",
                killmail.killmailId(), candidates.size(), candidates.path(), matched.size()));
        return new MatchResult(killmail.killmailId(), matched, generation.id(), false, candidates.size(), elapsed);
    }

    /**
     * Writes out pending matches now instead of waiting for the next scheduled flush.
     *
     * @return number of matches written
     */
    public int flush() {
        return recorder.flush();
    }

    // ================================================================
    // INSPECTION
    // ================================================================

    @Override
    public Set<String> forceMatchAll(Killmail killmail) {
        Generation generation = current.get();
        return evaluator.evaluate(killmail, generation, generation.allProfiles());
    }

    @Override
    public Optional<ExplanationResult> explain(String profileId, Killmail killmail) {
        CompiledProfile profile = current.get().findProfile(profileId);
        if (profile == null) {
            return Optional.empty();
        }
        ExplanationResult.Node root = FilterInterpreter.explain(profile.filter(), killmail);
        return Optional.of(new ExplanationResult(profileId, root.matched(), root));
    }

    @Override
    public ExplanationResult testFilter(Map<String, ?> filterTree, Killmail killmail) throws CompilationException {
        CompiledFilter filter = compiler.compile(filterTree);
        ExplanationResult.Node root = FilterInterpreter.explain(filter.ast(), killmail);
        return new ExplanationResult(null, root.matched(), root);
    }

    @Override
    public EngineStats stats() {
        Generation generation = current.get();
        return new EngineStats(
                generation.id(),
                generation.size(),
                generation.indexedCount(),
                generation.size() - generation.indexedCount(),
                generation.failures().size(),
                generation.failures(),
                matchesProcessed.sum(),
                cache.hitCount(),
                cache.missCount(),
                cache.size(),
                recorder.pendingSize(),
                recorder.droppedMatches(),
                generation.indexes().cardinalities(),
                lastReloadAt,
                recorder.lastFlushAt());
    }

    public Generation currentGeneration() {
        return current.get();
    }

    public FrequencyTracker frequencies() {
        return frequencies;
    }

    // ================================================================
    // BUILDER
    // ================================================================

    public static final class Builder {
        private final ProfileStore profileStore;
        private EngineConfig config = EngineConfig.defaults();
        private MatchStore matchStore;
        private MatchListener listener = MatchListener.NONE;
        private Tracer tracer = TracingService.noopTracer();
        private MetricsRegistry metrics = MetricsRegistry.noop();
        private Clock clock = Clock.systemUTC();
        private MatchCache cache;

        private Builder(ProfileStore profileStore) {
            this.profileStore = Objects.requireNonNull(profileStore, "ProfileStore cannot be null");
        }

        public Builder config(EngineConfig config) {
            this.config = Objects.requireNonNull(config);
            return this;
        }

        public Builder matchStore(MatchStore matchStore) {
            this.matchStore = matchStore;
            return this;
        }

        public Builder listener(MatchListener listener) {
            this.listener = Objects.requireNonNull(listener);
            return this;
        }

        public Builder tracer(Tracer tracer) {
            this.tracer = Objects.requireNonNull(tracer);
            return this;
        }

        public Builder metrics(MetricsRegistry metrics) {
            this.metrics = Objects.requireNonNull(metrics);
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock);
            return this;
        }

        /**
         * Overrides the cache chosen from configuration.
         */
        public Builder cache(MatchCache cache) {
            this.cache = cache;
            return this;
        }

        public MatchCoordinator build() {
            Objects.requireNonNull(matchStore, "MatchStore cannot be null");
            return new MatchCoordinator(this);
        }
    }
}
