package com.helios.surveillance.api;

import com.helios.surveillance.core.compiler.CompilationException;
import com.helios.surveillance.model.EngineStats;
import com.helios.surveillance.model.ExplanationResult;
import com.helios.surveillance.model.Killmail;
import com.helios.surveillance.model.MatchResult;
import com.helios.surveillance.store.ProfileStoreException;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Contract for the profile matching engine.
 */
public interface ISurveillanceEngine extends AutoCloseable {

    /**
     * Loads the initial generation and starts background flushing.
     *
     * @throws ProfileStoreException if the initial profile load fails
     */
    void start() throws ProfileStoreException;

    /**
     * Matches a killmail against the active profiles.
     *
     * @return ids of the matching profiles; empty if the call timed out
     */
    Set<String> match(Killmail killmail);

    /**
     * Like {@link #match} but with the generation, cache and candidate details.
     */
    MatchResult evaluate(Killmail killmail);

    /**
     * Rebuilds the generation from the profile store and swaps it in.
     *
     * @return false if the store could not be read; the previous generation stays active
     */
    boolean reload();

    EngineStats stats();

    /**
     * Evaluates every active profile, ignoring indexes and cache. Nothing is recorded.
     */
    Set<String> forceMatchAll(Killmail killmail);

    /**
     * Per-node trace of one active profile's filter against a killmail.
     */
    Optional<ExplanationResult> explain(String profileId, Killmail killmail);

    /**
     * Compiles an ad-hoc filter tree and traces it against a killmail.
     *
     * @throws CompilationException if the tree is malformed
     */
    ExplanationResult testFilter(Map<String, ?> filterTree, Killmail killmail) throws CompilationException;

    /**
     * Flushes pending matches and releases worker threads.
     */
    void shutdown();

    @Override
    default void close() {
        shutdown();
    }
}
