package com.helios.surveillance.core.recording;

import java.util.Collection;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Decayed recent-match counter per profile, used to prioritise fallback candidates.
 * <p>
 * Updated once per flush for the profiles present in the batch: {@code new = old * decay + matches}.
 * Keyed by profile id so the history survives reloads.
 */
public class FrequencyTracker {

    private final double decay;
    private final Map<String, Double> frequencies = new ConcurrentHashMap<>();

    public FrequencyTracker(double decay) {
        this.decay = decay;
    }

    public double frequency(String profileId) {
        return frequencies.getOrDefault(profileId, 0.0);
    }

    public void recordBatch(Map<String, Integer> matchesByProfile) {
        matchesByProfile.forEach((profileId, count) ->
                frequencies.merge(profileId, (double) count, (old, added) -> old * decay + added));
    }

    /**
     * Drops history for profiles no longer loaded.
     */
    public void retainAll(Collection<String> profileIds) {
        Set<String> keep = Set.copyOf(profileIds);
        frequencies.keySet().retainAll(keep);
    }

    public Map<String, Double> snapshot() {
        return Map.copyOf(frequencies);
    }
}
