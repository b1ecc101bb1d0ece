/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.surveillance.core.model;

import com.helios.surveillance.core.index.ProfileIndexes;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntMaps;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.roaringbitmap.RoaringBitmap;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One immutable snapshot of compiled profiles and the indexes built from them.
 * <p>
 * Profiles are addressed by ordinal (their position in the profile array); index postings
 * hold ordinals. Because both live in this one object, swapping the generation reference swaps
 * profiles and indexes together.
 */
public final class Generation {

    private final long id;
    private final Instant builtAt;
    private final CompiledProfile[] profiles;
    private final Object2IntMap<String> ordinalById;
    private final ProfileIndexes indexes;
    private final RoaringBitmap allProfiles;
    private final RoaringBitmap unindexed;
    private final Map<String, String> failures;

    public Generation(long id, Instant builtAt, List<CompiledProfile> profiles, ProfileIndexes indexes,
                      Map<String, String> failures) {
        this.id = id;
        this.builtAt = builtAt;
        this.profiles = profiles.toArray(new CompiledProfile[0]);
        this.indexes = indexes;
        this.failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));

        Object2IntOpenHashMap<String> ordinals = new Object2IntOpenHashMap<>(this.profiles.length);
        ordinals.defaultReturnValue(-1);
        this.allProfiles = new RoaringBitmap();
        this.unindexed = new RoaringBitmap();
        for (int i = 0; i < this.profiles.length; i++) {
            ordinals.put(this.profiles[i].id(), i);
            allProfiles.add(i);
            if (!this.profiles[i].isIndexed()) {
                unindexed.add(i);
            }
        }
        this.ordinalById = Object2IntMaps.unmodifiable(ordinals);
    }

    public static Generation empty() {
        return new Generation(0L, Instant.EPOCH, List.of(), ProfileIndexes.builder().build(), Map.of());
    }

    public long id() {
        return id;
    }

    public Instant builtAt() {
        return builtAt;
    }

    public int size() {
        return profiles.length;
    }

    public CompiledProfile profile(int ordinal) {
        return profiles[ordinal];
    }

    /**
     * @return the ordinal of {@code profileId}, or -1 if it is not part of this generation
     */
    public int ordinalOf(String profileId) {
        return ordinalById.getInt(profileId);
    }

    public CompiledProfile findProfile(String profileId) {
        int ordinal = ordinalOf(profileId);
        return ordinal >= 0 ? profiles[ordinal] : null;
    }

    public ProfileIndexes indexes() {
        return indexes;
    }

    /** Shared instance; callers must clone before mutating. */
    public RoaringBitmap allProfiles() {
        return allProfiles;
    }

    /** Shared instance; callers must clone before mutating. */
    public RoaringBitmap unindexed() {
        return unindexed;
    }

    public int indexedCount() {
        return profiles.length - unindexed.getCardinality();
    }

    /**
     * Profile id to compile error for profiles that failed to compile and were left out.
     */
    public Map<String, String> failures() {
        return failures;
    }
}
