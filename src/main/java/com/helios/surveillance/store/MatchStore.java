package com.helios.surveillance.store;

import com.helios.surveillance.model.MatchRecord;

import java.time.Instant;
import java.util.List;

/**
 * Sink for flushed matches.
 */
public interface MatchStore {

    /**
     * Persists one profile's batch of match records.
     */
    void saveAll(String profileId, List<MatchRecord> records) throws MatchStoreException;

    /**
     * Adds {@code count} to the profile's match counter and sets its last-match timestamp.
     */
    void incrementMatchCount(String profileId, long count, Instant lastMatchAt) throws MatchStoreException;
}
