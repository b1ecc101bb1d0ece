package com.helios.surveillance.core.selection;

import com.helios.surveillance.core.index.IndexKind;
import com.helios.surveillance.core.index.ProfileIndexes;
import com.helios.surveillance.core.model.Generation;
import com.helios.surveillance.core.recording.FrequencyTracker;
import com.helios.surveillance.model.Killmail;
import com.helios.surveillance.model.Victim;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.IntArrays;
import org.roaringbitmap.RoaringBitmap;

import java.util.EnumMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Chooses which profiles of a generation are worth evaluating for one killmail.
 * <p>
 * The four indexes are probed with the killmail's tags, system id, victim ship type and total
 * value. Then:
 * <ul>
 *   <li>no probe hit: every profile, capped at {@code maxCandidates} by recent-match frequency;</li>
 *   <li>one probe hit: that probe's profiles;</li>
 *   <li>several probes hit: the intersection, computed per profile over the index kinds that
 *       profile is actually indexed under; if empty, the capped union.</li>
 * </ul>
 * The per-profile intersection keeps a profile when it appears in every hit probe it has a
 * constraint for. A plain cross-probe intersection would drop a profile indexed only under the
 * system index when a ship-type probe also fires for an unrelated profile.
 */
public class CandidateSelector {
    private static final Logger logger = Logger.getLogger(CandidateSelector.class.getName());

    private final int maxCandidates;
    private final boolean includeUnindexed;
    private final FrequencyTracker frequencies;

    public CandidateSelector(int maxCandidates, boolean includeUnindexed, FrequencyTracker frequencies) {
        if (maxCandidates <= 0) {
            throw new IllegalArgumentException("maxCandidates must be > 0");
        }
        this.maxCandidates = maxCandidates;
        this.includeUnindexed = includeUnindexed;
        this.frequencies = frequencies;
    }

    public CandidateSet select(Killmail killmail, Generation generation) {
        Map<IndexKind, RoaringBitmap> hits = probe(killmail, generation.indexes());

        if (hits.isEmpty()) {
            return new CandidateSet(prioritize(generation.allProfiles(), generation), CandidateSet.Path.FALLBACK_ALL);
        }

        if (hits.size() == 1) {
            RoaringBitmap single = hits.values().iterator().next();
            return new CandidateSet(withUnindexed(single, generation), CandidateSet.Path.SINGLE_INDEX);
        }

        RoaringBitmap intersection = intersect(hits, generation.indexes().maskGroups());
        if (!intersection.isEmpty()) {
            return new CandidateSet(withUnindexed(intersection, generation), CandidateSet.Path.INTERSECTION);
        }

        RoaringBitmap union = new RoaringBitmap();
        hits.values().forEach(union::or);
        logger.fine(() -> "Empty intersection for killmail " + killmail.killmailId()
                + ", falling back to union of " + union.getCardinality() + " profiles");
        return new CandidateSet(withUnindexed(prioritize(union, generation), generation),
                CandidateSet.Path.UNION_FALLBACK);
    }

    private static Map<IndexKind, RoaringBitmap> probe(Killmail killmail, ProfileIndexes indexes) {
        Victim victim = killmail.victim();
        Long shipTypeId = victim != null ? victim.shipTypeId() : null;
        double totalValue = killmail.totalValue() != null ? killmail.totalValue() : 0.0;

        Map<IndexKind, RoaringBitmap> hits = new EnumMap<>(IndexKind.class);
        for (IndexKind kind : IndexKind.values()) {
            RoaringBitmap set = indexes.probe(kind, killmail.moduleTags(), killmail.solarSystemId(),
                    shipTypeId, totalValue);
            if (!set.isEmpty()) {
                hits.put(kind, set);
            }
        }
        return hits;
    }

    /**
     * Union over index-kind masks of: profiles with that mask, present in every hit probe of the mask.
     * Masks that include a kind with no hit are skipped; such profiles cannot match.
     */
    static RoaringBitmap intersect(Map<IndexKind, RoaringBitmap> hits, Int2ObjectMap<RoaringBitmap> maskGroups) {
        int hitMask = 0;
        for (IndexKind kind : hits.keySet()) {
            hitMask |= kind.bit();
        }

        RoaringBitmap result = new RoaringBitmap();
        for (Int2ObjectMap.Entry<RoaringBitmap> group : maskGroups.int2ObjectEntrySet()) {
            int mask = group.getIntKey();
            if ((mask & ~hitMask) != 0) {
                continue;
            }
            RoaringBitmap survivors = group.getValue().clone();
            for (IndexKind kind : IndexKind.values()) {
                if (kind.in(mask)) {
                    survivors.and(hits.get(kind));
                }
            }
            result.or(survivors);
        }
        return result;
    }

    private RoaringBitmap withUnindexed(RoaringBitmap candidates, Generation generation) {
        if (!includeUnindexed || generation.unindexed().isEmpty()) {
            return candidates;
        }
        return RoaringBitmap.or(candidates, generation.unindexed());
    }

    /**
     * Caps {@code ordinals} at {@code maxCandidates}, keeping the most frequently matching profiles.
     * Ties go to the lower ordinal.
     */
    RoaringBitmap prioritize(RoaringBitmap ordinals, Generation generation) {
        if (ordinals.getCardinality() <= maxCandidates) {
            return ordinals.clone();
        }
        int[] candidates = ordinals.toArray();
        double[] frequency = new double[generation.size()];
        for (int ordinal : candidates) {
            frequency[ordinal] = frequencies.frequency(generation.profile(ordinal).id());
        }
        IntArrays.quickSort(candidates, (a, b) -> {
            int byFrequency = Double.compare(frequency[b], frequency[a]);
            return byFrequency != 0 ? byFrequency : Integer.compare(a, b);
        });

        RoaringBitmap capped = new RoaringBitmap();
        for (int i = 0; i < maxCandidates; i++) {
            capped.add(candidates[i]);
        }
        return capped;
    }
}
