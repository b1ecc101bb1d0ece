package com.helios.surveillance.core.index;

import com.helios.surveillance.model.FilterNode;
import com.helios.surveillance.model.FilterOperator;
import it.unimi.dsi.fastutil.longs.LongSet;

import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Extracts inverted-index keys from a parsed filter tree.
 * <p>
 * Only the direct {@link FilterNode.Rule} children of a root AND group are considered: every
 * such rule must hold for a match, so indexing them can never hide a matching profile. OR-rooted
 * trees and rules below a nested group contribute nothing and leave the profile on the fallback
 * path.
 * <table>
 *   <caption>Indexable rules</caption>
 *   <tr><td>{@code module_tags contains_any|contains_all [...]}</td><td>tag index</td></tr>
 *   <tr><td>{@code system_id in [...]}</td><td>system index</td></tr>
 *   <tr><td>{@code victim_ship_type_id in [...]}</td><td>ship type index</td></tr>
 *   <tr><td>{@code total_value gt|gte|lt|lte n}</td><td>ISK threshold index</td></tr>
 * </table>
 */
public class IndexBuilder {
    private static final Logger logger = Logger.getLogger(IndexBuilder.class.getName());

    private static final Set<String> TAG_FIELDS = Set.of("module_tags", "noteworthy_modules");
    private static final Set<String> SYSTEM_FIELDS = Set.of("system_id", "solar_system_id");
    private static final String SHIP_TYPE_FIELD = "victim_ship_type_id";
    private static final String ISK_FIELD = "total_value";

    public IndexContribution build(String profileId, FilterNode root) {
        if (!(root instanceof FilterNode.Group group) || group.combinator() != FilterNode.Combinator.AND) {
            logger.fine(() -> "Profile " + profileId + " is not AND-rooted; leaving it unindexed");
            return IndexContribution.EMPTY;
        }

        IndexContribution.Builder builder = new IndexContribution.Builder();
        for (FilterNode child : group.children()) {
            if (child instanceof FilterNode.Rule rule) {
                collect(rule, builder);
            }
        }
        IndexContribution contribution = builder.build();
        if (contribution.isEmpty()) {
            logger.fine(() -> "Profile " + profileId + " has no indexable top-level rules");
        }
        return contribution;
    }

    private static void collect(FilterNode.Rule rule, IndexContribution.Builder builder) {
        String field = rule.field();
        FilterOperator operator = rule.operator();

        if (TAG_FIELDS.contains(field)
                && (operator == FilterOperator.CONTAINS_ANY || operator == FilterOperator.CONTAINS_ALL)) {
            // Event tags are strings; any other element can never match
            for (Object tag : asList(rule.value())) {
                if (tag instanceof String s) {
                    builder.tags.add(s);
                }
            }
        } else if (SYSTEM_FIELDS.contains(field) && operator == FilterOperator.IN) {
            addIds(rule.value(), builder.systemIds);
        } else if (SHIP_TYPE_FIELD.equals(field) && operator == FilterOperator.IN) {
            addIds(rule.value(), builder.shipTypeIds);
        } else if (ISK_FIELD.equals(field) && operator.isOrdering() && rule.value() instanceof Number n) {
            builder.iskThresholds.add(new IskThreshold(operator, n.doubleValue()));
        }
    }

    private static void addIds(Object value, LongSet target) {
        for (Object id : asList(value)) {
            // Non-integral values can never equal an integral id
            if (id instanceof Long l) {
                target.add(l.longValue());
            }
        }
    }

    private static List<?> asList(Object value) {
        return value instanceof List<?> list ? list : List.of();
    }
}
