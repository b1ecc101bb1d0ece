package com.helios.surveillance.core.compiler;

import com.helios.surveillance.model.FilterNode;
import com.helios.surveillance.model.FilterOperator;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Parses the JSON-shaped filter definition into a {@link FilterNode} tree and validates
 * operator and value shapes.
 * <pre>
 * { "condition": "and" | "or", "rules": [ node, ... ] }
 * node := group | { "field": string, "operator": string, "value": any }
 * </pre>
 */
final class FilterTreeParser {

    static final int MAX_DEPTH = 32;

    private FilterTreeParser() {
    }

    static FilterNode parse(Map<String, ?> tree) {
        if (tree == null) {
            throw new CompilationException("filter tree is missing");
        }
        if (!isGroup(tree)) {
            throw new CompilationException("filter tree root must have 'condition' and 'rules'");
        }
        return parseGroup(tree, "$", 0);
    }

    private static boolean isGroup(Map<?, ?> node) {
        return node.containsKey("condition") || node.containsKey("rules");
    }

    private static FilterNode parseNode(Object raw, String path, int depth) {
        if (!(raw instanceof Map<?, ?> node)) {
            throw new CompilationException("invalid rule at " + path + ": expected an object");
        }
        return isGroup(node) ? parseGroup(node, path, depth) : parseRule(node, path);
    }

    private static FilterNode.Group parseGroup(Map<?, ?> node, String path, int depth) {
        if (depth >= MAX_DEPTH) {
            throw new CompilationException("filter tree nested deeper than " + MAX_DEPTH + " at " + path);
        }
        Object condition = node.get("condition");
        FilterNode.Combinator combinator =
                condition instanceof String s ? FilterNode.Combinator.fromString(s) : null;
        if (combinator == null) {
            throw new CompilationException("invalid condition at " + path + ": " + condition);
        }
        Object rules = node.get("rules");
        if (!(rules instanceof List<?> children) || children.isEmpty()) {
            throw new CompilationException("rules at " + path + " must be a non-empty list");
        }
        List<FilterNode> parsed = new ArrayList<>(children.size());
        for (int i = 0; i < children.size(); i++) {
            parsed.add(parseNode(children.get(i), path + ".rules[" + i + "]", depth + 1));
        }
        return new FilterNode.Group(combinator, parsed);
    }

    private static FilterNode.Rule parseRule(Map<?, ?> node, String path) {
        Object field = node.get("field");
        if (!(field instanceof String fieldName) || fieldName.isBlank()) {
            throw new CompilationException("missing field at " + path);
        }
        Object operatorText = node.get("operator");
        if (!(operatorText instanceof String)) {
            throw new CompilationException("missing operator at " + path);
        }
        FilterOperator operator = FilterOperator.fromString((String) operatorText);
        if (operator == null) {
            throw new CompilationException("unsupported operator at " + path + ": " + operatorText);
        }
        if (!node.containsKey("value")) {
            throw new CompilationException("missing value at " + path);
        }
        Object value = FilterValues.normalize(node.get("value"));

        if (operator.requiresList()) {
            if (!(value instanceof List<?> list) || list.isEmpty()) {
                throw new CompilationException(
                        "operator " + operator.wireName() + " at " + path + " requires a non-empty list");
            }
        } else if (operator.isOrdering()) {
            Double threshold = FilterValues.toNumber(value);
            if (threshold == null) {
                throw new CompilationException(
                        "operator " + operator.wireName() + " at " + path + " requires a numeric value, got " + value);
            }
            value = value instanceof Number ? value : FilterValues.normalize(threshold);
        }
        return new FilterNode.Rule(fieldName.trim(), operator, value);
    }
}
