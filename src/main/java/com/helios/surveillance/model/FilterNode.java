package com.helios.surveillance.model;

import java.util.List;
import java.util.Objects;

/**
 * Parsed filter tree. A node is either a leaf {@link Rule} or a {@link Group} of children.
 */
public interface FilterNode {

    enum Combinator {
        AND, OR;

        public static Combinator fromString(String text) {
            if (text == null) {
                return null;
            }
            return switch (text.trim().toLowerCase()) {
                case "and" -> AND;
                case "or" -> OR;
                default -> null;
            };
        }
    }

    /**
     * Leaf comparison. {@code value} is already normalised (integral numbers as Long,
     * other numbers as Double, lists as immutable lists).
     */
    record Rule(String field, FilterOperator operator, Object value) implements FilterNode {
        public Rule {
            Objects.requireNonNull(field, "field");
            Objects.requireNonNull(operator, "operator");
        }
    }

    record Group(Combinator combinator, List<FilterNode> children) implements FilterNode {
        public Group {
            Objects.requireNonNull(combinator, "combinator");
            children = List.copyOf(children);
        }
    }
}
