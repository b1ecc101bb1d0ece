package com.helios.surveillance.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

public enum FilterOperator {
    EQ("eq"),
    NE("ne"),
    GT("gt"),
    LT("lt"),
    GTE("gte"),
    LTE("lte"),
    IN("in"),
    NOT_IN("not_in"),
    CONTAINS_ANY("contains_any"),
    CONTAINS_ALL("contains_all"),
    NOT_CONTAINS("not_contains");

    private static final Set<FilterOperator> ORDERING = EnumSet.of(GT, LT, GTE, LTE);
    private static final Set<FilterOperator> MEMBERSHIP = EnumSet.of(IN, NOT_IN);
    private static final Set<FilterOperator> ARRAY = EnumSet.of(CONTAINS_ANY, CONTAINS_ALL, NOT_CONTAINS);

    private final String wireName;

    FilterOperator(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Resolves a wire name such as {@code "contains_any"}. Returns null for unknown operators.
     */
    public static FilterOperator fromString(String text) {
        if (text == null) {
            return null;
        }
        for (FilterOperator op : values()) {
            if (op.wireName.equalsIgnoreCase(text.trim())) {
                return op;
            }
        }
        return null;
    }

    public boolean isOrdering() {
        return ORDERING.contains(this);
    }

    /** Operators whose value must be a non-empty list. */
    public boolean requiresList() {
        return MEMBERSHIP.contains(this) || ARRAY.contains(this);
    }

    public boolean isArrayOperator() {
        return ARRAY.contains(this);
    }
}
