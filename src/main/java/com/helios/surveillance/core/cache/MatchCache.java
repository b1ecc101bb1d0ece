package com.helios.surveillance.core.cache;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

/**
 * Short-lived memo of killmail fingerprint to matched profile ids.
 * <p>
 * Purely an optimization: callers must get the same answer with a cache that never hits.
 * Implementations are thread-safe.
 */
public interface MatchCache {

    Optional<Set<String>> lookup(long fingerprint);

    /**
     * Stores {@code matches} under {@code fingerprint}. The entry expires {@code ttl} after the write.
     */
    void store(long fingerprint, Set<String> matches, Duration ttl);

    void invalidateAll();

    /**
     * Runs pending expiry and eviction work.
     */
    void cleanUp();

    long size();

    long hitCount();

    long missCount();
}
