package com.helios.surveillance.core.compiler;

import com.helios.surveillance.model.FilterOperator;
import org.apache.commons.lang3.math.NumberUtils;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Value normalisation and operator semantics shared by compiled predicates and the
 * tree-walking {@link FilterInterpreter}.
 * <p>
 * Numbers compare by value regardless of their boxed type: {@code 5}, {@code 5L} and
 * {@code 5.0} are the same key.
 */
public final class FilterValues {

    private static final double MAX_EXACT_LONG = 9.223372036854776E18;

    private FilterValues() {
    }

    /**
     * Normalises a raw JSON value: integral numbers become Long, other numbers Double,
     * lists become immutable lists of normalised elements.
     */
    public static Object normalize(Object raw) {
        if (raw instanceof Number n) {
            return normalizeNumber(n);
        }
        if (raw instanceof Collection<?> collection) {
            List<Object> out = new ArrayList<>(collection.size());
            for (Object element : collection) {
                out.add(normalize(element));
            }
            return Collections.unmodifiableList(out);
        }
        return raw;
    }

    /**
     * Equality key: numbers collapse to Long when integral, Double otherwise.
     */
    public static Object key(Object value) {
        if (value instanceof Number n) {
            return normalizeNumber(n);
        }
        if (value instanceof List<?>) {
            return normalize(value);
        }
        return value;
    }

    public static boolean valuesEqual(Object actual, Object expected) {
        return Objects.equals(key(actual), key(expected));
    }

    /**
     * Parses a value as a number. Numeric strings are accepted; anything else yields null.
     */
    public static Double toNumber(Object value) {
        if (value instanceof Number n) {
            double d = n.doubleValue();
            return Double.isNaN(d) ? null : d;
        }
        if (value instanceof String s) {
            String trimmed = s.trim();
            if (!NumberUtils.isCreatable(trimmed)) {
                return null;
            }
            try {
                double d = NumberUtils.createNumber(trimmed).doubleValue();
                return Double.isNaN(d) ? null : d;
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    public static Set<Object> keySet(Collection<?> values) {
        Set<Object> keys = new HashSet<>(Math.max(4, values.size() * 2));
        for (Object value : values) {
            keys.add(key(value));
        }
        return keys;
    }

    public static boolean compare(FilterOperator operator, double actual, double threshold) {
        return switch (operator) {
            case GT -> actual > threshold;
            case GTE -> actual >= threshold;
            case LT -> actual < threshold;
            case LTE -> actual <= threshold;
            default -> throw new IllegalArgumentException("Not an ordering operator: " + operator);
        };
    }

    /**
     * Reference semantics of every operator. {@code expected} is the normalised rule value.
     */
    public static boolean apply(FilterOperator operator, Object actual, Object expected) {
        switch (operator) {
            case EQ:
                return valuesEqual(actual, expected);
            case NE:
                return !valuesEqual(actual, expected);
            case GT:
            case GTE:
            case LT:
            case LTE: {
                Double left = toNumber(actual);
                Double right = toNumber(expected);
                return left != null && right != null && compare(operator, left, right);
            }
            case IN:
                return contains(expected, actual);
            case NOT_IN:
                return !contains(expected, actual);
            case CONTAINS_ANY:
            case CONTAINS_ALL:
            case NOT_CONTAINS: {
                if (!(actual instanceof List<?> actualList) || !(expected instanceof List<?> expectedList)) {
                    return false;
                }
                Set<Object> present = keySet(actualList);
                int hits = 0;
                for (Object wanted : expectedList) {
                    if (present.contains(key(wanted))) {
                        hits++;
                    }
                }
                if (operator == FilterOperator.CONTAINS_ANY) {
                    return hits > 0;
                } else if (operator == FilterOperator.CONTAINS_ALL) {
                    return hits == expectedList.size();
                }
                return hits == 0;
            }
            default:
                throw new IllegalArgumentException("Unhandled operator: " + operator);
        }
    }

    private static boolean contains(Object list, Object actual) {
        if (!(list instanceof List<?> values)) {
            return false;
        }
        Object wanted = key(actual);
        for (Object value : values) {
            if (Objects.equals(key(value), wanted)) {
                return true;
            }
        }
        return false;
    }

    private static Object normalizeNumber(Number n) {
        if (n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte) {
            return n.longValue();
        }
        if (n instanceof BigInteger big) {
            return big.bitLength() < 64 ? (Object) big.longValue() : (Object) big.doubleValue();
        }
        double d = n instanceof BigDecimal decimal ? decimal.doubleValue() : n.doubleValue();
        if (!Double.isInfinite(d) && !Double.isNaN(d) && d == Math.rint(d) && Math.abs(d) < MAX_EXACT_LONG) {
            return (long) d;
        }
        return d;
    }
}
