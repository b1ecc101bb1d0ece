package com.helios.surveillance.store;

import com.helios.surveillance.model.MatchRecord;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Match store held in memory.
 */
public class InMemoryMatchStore implements MatchStore {

    private final Map<String, List<MatchRecord>> records = new ConcurrentHashMap<>();
    private final Map<String, Long> matchCounts = new ConcurrentHashMap<>();
    private final Map<String, Instant> lastMatchAt = new ConcurrentHashMap<>();

    @Override
    public void saveAll(String profileId, List<MatchRecord> batch) {
        records.computeIfAbsent(profileId, id -> new CopyOnWriteArrayList<>()).addAll(batch);
    }

    @Override
    public void incrementMatchCount(String profileId, long count, Instant at) {
        matchCounts.merge(profileId, count, Long::sum);
        lastMatchAt.merge(profileId, at, (old, added) -> added.isAfter(old) ? added : old);
    }

    public List<MatchRecord> records(String profileId) {
        return new ArrayList<>(records.getOrDefault(profileId, List.of()));
    }

    public long matchCount(String profileId) {
        return matchCounts.getOrDefault(profileId, 0L);
    }

    public Instant lastMatchAt(String profileId) {
        return lastMatchAt.get(profileId);
    }

    public int totalRecords() {
        return records.values().stream().mapToInt(List::size).sum();
    }
}
