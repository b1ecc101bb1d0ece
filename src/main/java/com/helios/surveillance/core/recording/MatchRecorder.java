/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.surveillance.core.recording;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.helios.surveillance.infra.config.EngineConfig;
import com.helios.surveillance.metrics.Counter;
import com.helios.surveillance.metrics.MetricsRegistry;
import com.helios.surveillance.model.Killmail;
import com.helios.surveillance.model.MatchRecord;
import com.helios.surveillance.store.MatchListener;
import com.helios.surveillance.store.MatchStore;
import com.helios.surveillance.store.MatchStoreException;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Buffers matches and writes them out in periodic batches.
 *
 * <h2>Flush</h2>
 * <ol>
 *   <li>drain the pending queue</li>
 *   <li>group by profile</li>
 *   <li>publish one alert per match to the {@link MatchListener}</li>
 *   <li>persist each profile's records and bump its match counter</li>
 *   <li>fold the batch counts into the {@link FrequencyTracker}</li>
 * </ol>
 * A profile whose batch fails to persist loses that batch; nothing is retried.
 *
 * <h2>Thread Safety</h2>
 * <p>{@link #record} may be called from any thread. Flushes are serialized.
 */
public class MatchRecorder implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(MatchRecorder.class.getName());

    private final BlockingQueue<PendingMatch> pending;
    private final Duration offerTimeout;
    private final Duration flushInterval;
    private final MatchStore matchStore;
    private final MatchListener listener;
    private final FrequencyTracker frequencies;
    private final Clock clock;
    private final Tracer tracer;
    private final ScheduledExecutorService flushExecutor;
    private final Object flushLock = new Object();

    private final AtomicLong droppedMatches = new AtomicLong();
    private final Counter droppedCounter;
    private final Counter flushedCounter;
    private final Counter persistFailures;
    private volatile Instant lastFlushAt;
    private volatile boolean started;

    public MatchRecorder(EngineConfig config, MatchStore matchStore, MatchListener listener,
                         FrequencyTracker frequencies, Tracer tracer, MetricsRegistry metrics, Clock clock) {
        this.pending = new ArrayBlockingQueue<>(config.pendingCapacity());
        this.offerTimeout = config.offerTimeout();
        this.flushInterval = config.flushInterval();
        this.matchStore = matchStore;
        this.listener = listener;
        this.frequencies = frequencies;
        this.tracer = tracer;
        this.clock = clock;
        this.flushExecutor = Executors.newSingleThreadScheduledExecutor(
                new ThreadFactoryBuilder()
                        .setNameFormat("match-recorder-flush-%d")
                        .setDaemon(true)
                        .build());
        this.droppedCounter = metrics.counter("surveillance_matches_dropped_total");
        this.flushedCounter = metrics.counter("surveillance_matches_flushed_total");
        this.persistFailures = metrics.counter("surveillance_match_persist_failures_total");
    }

    public void start() {
        if (started) {
            return;
        }
        started = true;
        long intervalMs = flushInterval.toMillis();
        flushExecutor.scheduleWithFixedDelay(this::scheduledFlush, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        logger.info("Match recorder started, flushing every " + intervalMs + " ms");
    }

    /**
     * Queues one match for the next flush.
     *
     * @return false if the queue stayed full past the offer timeout, or the caller was interrupted
     *         while waiting, and the match was dropped
     */
    public boolean record(String profileId, String profileName, Killmail killmail, Instant matchedAt) {
        PendingMatch match = new PendingMatch(profileId, profileName, killmail, matchedAt);
        String reason = "Pending match queue full";
        boolean accepted;
        try {
            accepted = pending.offer(match, offerTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            reason = "Interrupted while queueing";
            accepted = false;
        }
        if (!accepted) {
            droppedMatches.incrementAndGet();
            droppedCounter.increment();
            logger.warning(reason + ", dropping match of profile " + profileId
                    + " on killmail " + killmail.killmailId());
        }
        return accepted;
    }

    /**
     * Drains and writes out everything queued so far.
     *
     * @return number of matches drained
     */
    public int flush() {
        synchronized (flushLock) {
            List<PendingMatch> batch = new ArrayList<>(pending.size());
            pending.drainTo(batch);
            lastFlushAt = clock.instant();
            if (batch.isEmpty()) {
                return 0;
            }

            Span span = tracer.spanBuilder("flush-matches").startSpan();
            try (Scope scope = span.makeCurrent()) {
                span.setAttribute("batch.size", batch.size());
                Map<String, List<PendingMatch>> byProfile = groupByProfile(batch);
                span.setAttribute("batch.profiles", byProfile.size());

                publishAlerts(batch);

                Map<String, Integer> counts = new LinkedHashMap<>();
                int failedProfiles = 0;
                for (Map.Entry<String, List<PendingMatch>> entry : byProfile.entrySet()) {
                    counts.put(entry.getKey(), entry.getValue().size());
                    if (!persist(entry.getKey(), entry.getValue())) {
                        failedProfiles++;
                    }
                }
                frequencies.recordBatch(counts);
                flushedCounter.increment(batch.size());

                if (failedProfiles > 0) {
                    span.setStatus(StatusCode.ERROR, failedProfiles + " profile batches failed to persist");
                }
                logger.fine(() -> "Flushed " + batch.size() + " matches for " + byProfile.size() + " profiles");
                return batch.size();
            } finally {
                span.end();
            }
        }
    }

    private static Map<String, List<PendingMatch>> groupByProfile(List<PendingMatch> batch) {
        Map<String, List<PendingMatch>> byProfile = new LinkedHashMap<>();
        for (PendingMatch match : batch) {
            byProfile.computeIfAbsent(match.profileId(), id -> new ArrayList<>()).add(match);
        }
        return byProfile;
    }

    private void publishAlerts(List<PendingMatch> batch) {
        for (PendingMatch match : batch) {
            try {
                listener.onMatch(match.toAlert());
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Match listener failed for profile " + match.profileId()
                        + " on killmail " + match.killmail().killmailId(), e);
            }
        }
    }

    private boolean persist(String profileId, List<PendingMatch> matches) {
        List<MatchRecord> records = new ArrayList<>(matches.size());
        Instant lastMatch = Instant.MIN;
        for (PendingMatch match : matches) {
            records.add(match.toRecord());
            if (match.matchedAt().isAfter(lastMatch)) {
                lastMatch = match.matchedAt();
            }
        }
        try {
            matchStore.saveAll(profileId, records);
            matchStore.incrementMatchCount(profileId, records.size(), lastMatch);
            return true;
        } catch (MatchStoreException | RuntimeException e) {
            persistFailures.increment();
            logger.log(Level.SEVERE, "Failed to persist " + records.size() + " matches for profile "
                    + profileId + ", dropping batch", e);
            return false;
        }
    }

    private void scheduledFlush() {
        try {
            flush();
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Scheduled match flush failed", e);
        }
    }

    public int pendingSize() {
        return pending.size();
    }

    public long droppedMatches() {
        return droppedMatches.get();
    }

    public Instant lastFlushAt() {
        return lastFlushAt;
    }

    /**
     * Stops the schedule and writes out whatever is still queued.
     */
    @Override
    public void close() {
        flushExecutor.shutdown();
        try {
            if (!flushExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                flushExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            flushExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        int remaining = flush();
        logger.info("Match recorder stopped, final flush wrote " + remaining + " matches");
    }
}
