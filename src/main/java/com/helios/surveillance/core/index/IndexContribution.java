package com.helios.surveillance.core.index;

import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import it.unimi.dsi.fastutil.longs.LongSet;
import it.unimi.dsi.fastutil.longs.LongSets;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Index keys extracted from one profile's top-level AND rules.
 */
public record IndexContribution(
        Set<String> tags,
        LongSet systemIds,
        LongSet shipTypeIds,
        List<IskThreshold> iskThresholds
) {

    public static final IndexContribution EMPTY =
            new IndexContribution(Set.of(), LongSets.EMPTY_SET, LongSets.EMPTY_SET, List.of());

    public IndexContribution {
        tags = Set.copyOf(tags);
        systemIds = LongSets.unmodifiable(new LongOpenHashSet(systemIds));
        shipTypeIds = LongSets.unmodifiable(new LongOpenHashSet(shipTypeIds));
        iskThresholds = List.copyOf(iskThresholds);
    }

    public boolean isEmpty() {
        return mask() == 0;
    }

    /**
     * Bit mask of the {@link IndexKind}s this profile is indexed under.
     */
    public int mask() {
        int mask = 0;
        if (!tags.isEmpty()) {
            mask |= IndexKind.TAG.bit();
        }
        if (!systemIds.isEmpty()) {
            mask |= IndexKind.SYSTEM.bit();
        }
        if (!shipTypeIds.isEmpty()) {
            mask |= IndexKind.SHIP_TYPE.bit();
        }
        if (!iskThresholds.isEmpty()) {
            mask |= IndexKind.ISK.bit();
        }
        return mask;
    }

    static final class Builder {
        final Set<String> tags = new LinkedHashSet<>();
        final LongSet systemIds = new LongOpenHashSet();
        final LongSet shipTypeIds = new LongOpenHashSet();
        final List<IskThreshold> iskThresholds = new ArrayList<>();

        IndexContribution build() {
            if (tags.isEmpty() && systemIds.isEmpty() && shipTypeIds.isEmpty() && iskThresholds.isEmpty()) {
                return EMPTY;
            }
            return new IndexContribution(tags, systemIds, shipTypeIds, iskThresholds);
        }
    }
}
