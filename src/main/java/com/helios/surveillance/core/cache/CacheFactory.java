package com.helios.surveillance.core.cache;

import com.helios.surveillance.infra.config.EngineConfig;

/**
 * Creates the match cache selected by configuration.
 */
public final class CacheFactory {

    private CacheFactory() {
    }

    public static MatchCache create(EngineConfig config) {
        if (!config.cacheEnabled()) {
            return new NoOpMatchCache();
        }
        return new CaffeineMatchCache(config.cacheMaxSize());
    }
}
