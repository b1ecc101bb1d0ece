package com.helios.surveillance.core.selection;

import org.roaringbitmap.RoaringBitmap;

/**
 * Profile ordinals selected for evaluation, and how they were chosen.
 */
public record CandidateSet(RoaringBitmap ordinals, Path path) {

    public enum Path {
        /** No index fired: all profiles, capped by recent-match frequency. */
        FALLBACK_ALL,
        /** Exactly one index fired. */
        SINGLE_INDEX,
        /** Several indexes fired and their intersection was non-empty. */
        INTERSECTION,
        /** Several indexes fired, the intersection was empty: capped union. */
        UNION_FALLBACK
    }

    public int size() {
        return ordinals.getCardinality();
    }

    public boolean contains(int ordinal) {
        return ordinals.contains(ordinal);
    }
}
