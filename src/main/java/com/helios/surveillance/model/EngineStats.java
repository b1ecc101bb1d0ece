package com.helios.surveillance.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * Administrative snapshot returned by {@code stats()}.
 *
 * @param indexCardinalities distinct keys per index: {@code tags}, {@code systems},
 *                           {@code ship_types}, {@code isk_thresholds}
 * @param failedProfiles     profile id to compile error for profiles excluded from the generation
 */
public record EngineStats(
        @JsonProperty("generation") long generation,
        @JsonProperty("profiles_loaded") int profilesLoaded,
        @JsonProperty("profiles_indexed") int profilesIndexed,
        @JsonProperty("profiles_unindexed") int profilesUnindexed,
        @JsonProperty("profiles_failed") int profilesFailed,
        @JsonProperty("failed_profiles") Map<String, String> failedProfiles,
        @JsonProperty("matches_processed") long matchesProcessed,
        @JsonProperty("cache_hits") long cacheHits,
        @JsonProperty("cache_misses") long cacheMisses,
        @JsonProperty("cache_size") long cacheSize,
        @JsonProperty("pending_batch_size") int pendingBatchSize,
        @JsonProperty("dropped_matches") long droppedMatches,
        @JsonProperty("index_cardinalities") Map<String, Integer> indexCardinalities,
        @JsonProperty("last_reload_at") Instant lastReloadAt,
        @JsonProperty("last_flush_at") Instant lastFlushAt
) {
}
