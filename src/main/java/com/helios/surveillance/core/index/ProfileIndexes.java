/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.surveillance.core.index;

import com.helios.surveillance.core.compiler.FilterValues;
import com.helios.surveillance.model.FilterOperator;
import it.unimi.dsi.fastutil.doubles.Double2ObjectRBTreeMap;
import it.unimi.dsi.fastutil.doubles.Double2ObjectSortedMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMaps;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.longs.LongIterator;
import it.unimi.dsi.fastutil.longs.LongSet;
import it.unimi.dsi.fastutil.objects.Object2ObjectOpenHashMap;
import org.roaringbitmap.RoaringBitmap;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The four inverted indexes of one generation, keyed to profile ordinals.
 * <p>
 * Immutable once built. A new instance is built for every generation and never mutated in place,
 * so readers need no locking. Postings are {@link RoaringBitmap}s of ordinals into
 * the generation's compiled profile array.
 */
public final class ProfileIndexes {

    private final Map<String, RoaringBitmap> tagIndex;
    private final Long2ObjectMap<RoaringBitmap> systemIndex;
    private final Long2ObjectMap<RoaringBitmap> shipTypeIndex;

    // Sorted thresholds and their postings, per ordering operator
    private final Map<FilterOperator, double[]> iskThresholds;
    private final Map<FilterOperator, RoaringBitmap[]> iskPostings;
    private final int iskKeyCount;

    // Profiles grouped by the exact set of index kinds they are indexed under
    private final Int2ObjectMap<RoaringBitmap> maskGroups;

    private ProfileIndexes(Builder builder) {
        this.tagIndex = builder.tagIndex;
        this.systemIndex = builder.systemIndex;
        this.shipTypeIndex = builder.shipTypeIndex;
        this.maskGroups = Int2ObjectMaps.unmodifiable(builder.maskGroups);

        this.iskThresholds = new EnumMap<>(FilterOperator.class);
        this.iskPostings = new EnumMap<>(FilterOperator.class);
        int keys = 0;
        for (Map.Entry<FilterOperator, Double2ObjectSortedMap<RoaringBitmap>> entry : builder.isk.entrySet()) {
            Double2ObjectSortedMap<RoaringBitmap> sorted = entry.getValue();
            double[] thresholds = sorted.keySet().toDoubleArray();
            RoaringBitmap[] postings = sorted.values().toArray(new RoaringBitmap[0]);
            iskThresholds.put(entry.getKey(), thresholds);
            iskPostings.put(entry.getKey(), postings);
            keys += thresholds.length;
        }
        this.iskKeyCount = keys;
    }

    public static Builder builder() {
        return new Builder();
    }

    public RoaringBitmap probeTags(List<String> tags) {
        RoaringBitmap result = new RoaringBitmap();
        for (String tag : tags) {
            RoaringBitmap posting = tagIndex.get(tag);
            if (posting != null) {
                result.or(posting);
            }
        }
        return result;
    }

    public RoaringBitmap probeSystem(Long systemId) {
        return probe(systemIndex, systemId);
    }

    public RoaringBitmap probeShipType(Long shipTypeId) {
        return probe(shipTypeIndex, shipTypeId);
    }

    /**
     * Profiles with at least one ISK threshold satisfied by {@code totalValue}.
     */
    public RoaringBitmap probeIsk(double totalValue) {
        RoaringBitmap result = new RoaringBitmap();
        for (Map.Entry<FilterOperator, double[]> entry : iskThresholds.entrySet()) {
            FilterOperator operator = entry.getKey();
            double[] thresholds = entry.getValue();
            RoaringBitmap[] postings = iskPostings.get(operator);
            switch (operator) {
                case GT, GTE -> {
                    // ascending: satisfied thresholds form a prefix
                    for (int i = 0; i < thresholds.length && satisfies(operator, totalValue, thresholds[i]); i++) {
                        result.or(postings[i]);
                    }
                }
                default -> {
                    // LT, LTE: satisfied thresholds form a suffix
                    for (int i = thresholds.length - 1; i >= 0 && satisfies(operator, totalValue, thresholds[i]); i--) {
                        result.or(postings[i]);
                    }
                }
            }
        }
        return result;
    }

    public RoaringBitmap probe(IndexKind kind, List<String> tags, Long systemId, Long shipTypeId, double totalValue) {
        return switch (kind) {
            case TAG -> probeTags(tags);
            case SYSTEM -> probeSystem(systemId);
            case SHIP_TYPE -> probeShipType(shipTypeId);
            case ISK -> probeIsk(totalValue);
        };
    }

    public Int2ObjectMap<RoaringBitmap> maskGroups() {
        return maskGroups;
    }

    /**
     * Distinct keys per index, keyed by {@link IndexKind#statsName()}.
     */
    public Map<String, Integer> cardinalities() {
        Map<String, Integer> result = new LinkedHashMap<>();
        result.put(IndexKind.TAG.statsName(), tagIndex.size());
        result.put(IndexKind.SYSTEM.statsName(), systemIndex.size());
        result.put(IndexKind.SHIP_TYPE.statsName(), shipTypeIndex.size());
        result.put(IndexKind.ISK.statsName(), iskKeyCount);
        return result;
    }

    private static boolean satisfies(FilterOperator operator, double value, double threshold) {
        return FilterValues.compare(operator, value, threshold);
    }

    private static RoaringBitmap probe(Long2ObjectMap<RoaringBitmap> index, Long key) {
        if (key == null) {
            return new RoaringBitmap();
        }
        RoaringBitmap posting = index.get(key.longValue());
        return posting != null ? posting.clone() : new RoaringBitmap();
    }

    public static final class Builder {
        private final Map<String, RoaringBitmap> tagIndex = new Object2ObjectOpenHashMap<>();
        private final Long2ObjectMap<RoaringBitmap> systemIndex = new Long2ObjectOpenHashMap<>();
        private final Long2ObjectMap<RoaringBitmap> shipTypeIndex = new Long2ObjectOpenHashMap<>();
        private final Map<FilterOperator, Double2ObjectSortedMap<RoaringBitmap>> isk =
                new EnumMap<>(FilterOperator.class);
        private final Int2ObjectMap<RoaringBitmap> maskGroups = new Int2ObjectOpenHashMap<>();

        private Builder() {
        }

        public Builder add(int ordinal, IndexContribution contribution) {
            if (contribution.isEmpty()) {
                return this;
            }
            for (String tag : contribution.tags()) {
                tagIndex.computeIfAbsent(tag, t -> new RoaringBitmap()).add(ordinal);
            }
            addPostings(systemIndex, contribution.systemIds(), ordinal);
            addPostings(shipTypeIndex, contribution.shipTypeIds(), ordinal);
            for (IskThreshold threshold : contribution.iskThresholds()) {
                Double2ObjectSortedMap<RoaringBitmap> byThreshold =
                        isk.computeIfAbsent(threshold.operator(), op -> new Double2ObjectRBTreeMap<>());
                RoaringBitmap posting = byThreshold.get(threshold.threshold());
                if (posting == null) {
                    posting = new RoaringBitmap();
                    byThreshold.put(threshold.threshold(), posting);
                }
                posting.add(ordinal);
            }
            RoaringBitmap group = maskGroups.get(contribution.mask());
            if (group == null) {
                group = new RoaringBitmap();
                maskGroups.put(contribution.mask(), group);
            }
            group.add(ordinal);
            return this;
        }

        private static void addPostings(Long2ObjectMap<RoaringBitmap> index, LongSet ids, int ordinal) {
            for (LongIterator it = ids.iterator(); it.hasNext(); ) {
                long id = it.nextLong();
                RoaringBitmap posting = index.get(id);
                if (posting == null) {
                    posting = new RoaringBitmap();
                    index.put(id, posting);
                }
                posting.add(ordinal);
            }
        }

        public ProfileIndexes build() {
            tagIndex.values().forEach(RoaringBitmap::runOptimize);
            systemIndex.values().forEach(RoaringBitmap::runOptimize);
            shipTypeIndex.values().forEach(RoaringBitmap::runOptimize);
            return new ProfileIndexes(this);
        }
    }
}
