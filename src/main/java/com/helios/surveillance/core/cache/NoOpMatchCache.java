package com.helios.surveillance.core.cache;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.LongAdder;

/**
 * Cache that never stores anything. Every lookup is a miss.
 */
public final class NoOpMatchCache implements MatchCache {

    private final LongAdder misses = new LongAdder();

    @Override
    public Optional<Set<String>> lookup(long fingerprint) {
        misses.increment();
        return Optional.empty();
    }

    @Override
    public void store(long fingerprint, Set<String> matches, Duration ttl) {
    }

    @Override
    public void invalidateAll() {
    }

    @Override
    public void cleanUp() {
    }

    @Override
    public long size() {
        return 0;
    }

    @Override
    public long hitCount() {
        return 0;
    }

    @Override
    public long missCount() {
        return misses.sum();
    }
}
