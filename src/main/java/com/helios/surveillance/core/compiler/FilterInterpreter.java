package com.helios.surveillance.core.compiler;

import com.helios.surveillance.core.extraction.FieldExtractor;
import com.helios.surveillance.model.ExplanationResult;
import com.helios.surveillance.model.FilterNode;
import com.helios.surveillance.model.Killmail;

import java.util.ArrayList;
import java.util.List;

/**
 * Tree-walking evaluation of a {@link FilterNode}, re-resolving every field on each call.
 * <p>
 * Slower than a compiled predicate; used for explanations, ad-hoc filter testing, and as the
 * reference the compiled form must agree with.
 */
public final class FilterInterpreter {

    private FilterInterpreter() {
    }

    public static boolean evaluate(FilterNode node, Killmail killmail) {
        try {
            return evaluateNode(node, killmail);
        } catch (RuntimeException e) {
            return false;
        }
    }

    private static boolean evaluateNode(FilterNode node, Killmail killmail) {
        if (node instanceof FilterNode.Rule rule) {
            Object actual = FieldExtractor.resolve(killmail, rule.field());
            return FilterValues.apply(rule.operator(), actual, rule.value());
        }
        FilterNode.Group group = (FilterNode.Group) node;
        boolean and = group.combinator() == FilterNode.Combinator.AND;
        for (FilterNode child : group.children()) {
            boolean result = evaluateNode(child, killmail);
            if (and && !result) {
                return false;
            }
            if (!and && result) {
                return true;
            }
        }
        return and;
    }

    /**
     * Evaluates every node without short-circuiting and records each outcome.
     */
    public static ExplanationResult.Node explain(FilterNode node, Killmail killmail) {
        if (node instanceof FilterNode.Rule rule) {
            Object actual = FieldExtractor.resolve(killmail, rule.field());
            boolean matched;
            try {
                matched = FilterValues.apply(rule.operator(), actual, rule.value());
            } catch (RuntimeException e) {
                matched = false;
            }
            String description = rule.field() + " " + rule.operator().wireName() + " " + rule.value();
            return new ExplanationResult.Node(description, matched, actual, null);
        }
        FilterNode.Group group = (FilterNode.Group) node;
        boolean and = group.combinator() == FilterNode.Combinator.AND;
        List<ExplanationResult.Node> children = new ArrayList<>(group.children().size());
        boolean matched = and;
        for (FilterNode child : group.children()) {
            ExplanationResult.Node explained = explain(child, killmail);
            children.add(explained);
            matched = and ? matched && explained.matched() : matched || explained.matched();
        }
        return new ExplanationResult.Node(group.combinator().name(), matched, null, children);
    }
}
