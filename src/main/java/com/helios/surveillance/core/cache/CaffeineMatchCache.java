package com.helios.surveillance.core.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.benmanes.caffeine.cache.stats.CacheStats;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Caffeine-backed {@link MatchCache}.
 * <p>
 * Entries expire a per-entry TTL after they are written and the cache is bounded by entry
 * count. Values are stored as immutable sets.
 */
public class CaffeineMatchCache implements MatchCache {
    private static final Logger logger = Logger.getLogger(CaffeineMatchCache.class.getName());

    private final Cache<Long, Entry> cache;

    private record Entry(Set<String> matches, long ttlNanos) {
    }

    public CaffeineMatchCache(long maxSize) {
        this(maxSize, Ticker.systemTicker());
    }

    /**
     * @param ticker time source; tests pass a controllable one
     */
    public CaffeineMatchCache(long maxSize, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .expireAfter(new Expiry<Long, Entry>() {
                    @Override
                    public long expireAfterCreate(Long key, Entry value, long currentTime) {
                        return value.ttlNanos();
                    }

                    @Override
                    public long expireAfterUpdate(Long key, Entry value, long currentTime, long currentDuration) {
                        return value.ttlNanos();
                    }

                    @Override
                    public long expireAfterRead(Long key, Entry value, long currentTime, long currentDuration) {
                        return currentDuration;
                    }
                })
                .ticker(ticker)
                .recordStats()
                .build();
        logger.info(String.format("CaffeineMatchCache initialized: maxSize=%d", maxSize));
    }

    @Override
    public Optional<Set<String>> lookup(long fingerprint) {
        Entry entry = cache.getIfPresent(fingerprint);
        return entry == null ? Optional.empty() : Optional.of(entry.matches());
    }

    @Override
    public void store(long fingerprint, Set<String> matches, Duration ttl) {
        cache.put(fingerprint, new Entry(Set.copyOf(matches), ttl.toNanos()));
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
    }

    @Override
    public void cleanUp() {
        cache.cleanUp();
    }

    @Override
    public long size() {
        return cache.estimatedSize();
    }

    @Override
    public long hitCount() {
        return cache.stats().hitCount();
    }

    @Override
    public long missCount() {
        return cache.stats().missCount();
    }

    public CacheStats stats() {
        return cache.stats();
    }
}
