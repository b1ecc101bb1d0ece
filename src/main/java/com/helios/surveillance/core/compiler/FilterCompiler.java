package com.helios.surveillance.core.compiler;

import com.helios.surveillance.api.IFilterCompiler;
import com.helios.surveillance.core.extraction.FieldExtractor;
import com.helios.surveillance.model.FilterNode;
import com.helios.surveillance.model.FilterOperator;
import com.helios.surveillance.model.Killmail;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Compiles filter trees into composed {@link KillmailPredicate} closures.
 * <p>
 * Field names are resolved to accessors and rule values are normalised once, here, so that
 * evaluation does no parsing or map lookups. AND / OR groups short-circuit. The returned
 * predicate is {@linkplain KillmailPredicate#guarded guarded}: it never throws.
 */
public class FilterCompiler implements IFilterCompiler {
    private static final Logger logger = Logger.getLogger(FilterCompiler.class.getName());

    @Override
    public CompiledFilter compile(Map<String, ?> filterTree) throws CompilationException {
        FilterNode ast = FilterTreeParser.parse(filterTree);
        return new CompiledFilter(ast, KillmailPredicate.guarded(compileNode(ast)));
    }

    /**
     * Compiles an already-parsed tree.
     */
    public KillmailPredicate compileNode(FilterNode node) {
        if (node instanceof FilterNode.Rule rule) {
            return compileRule(rule);
        }
        FilterNode.Group group = (FilterNode.Group) node;
        List<FilterNode> children = group.children();
        if (children.size() == 1) {
            return compileNode(children.get(0));
        }
        KillmailPredicate[] compiled = new KillmailPredicate[children.size()];
        for (int i = 0; i < compiled.length; i++) {
            compiled[i] = compileNode(children.get(i));
        }
        if (group.combinator() == FilterNode.Combinator.AND) {
            return killmail -> {
                for (KillmailPredicate child : compiled) {
                    if (!child.test(killmail)) {
                        return false;
                    }
                }
                return true;
            };
        }
        return killmail -> {
            for (KillmailPredicate child : compiled) {
                if (child.test(killmail)) {
                    return true;
                }
            }
            return false;
        };
    }

    private KillmailPredicate compileRule(FilterNode.Rule rule) {
        if (!FieldExtractor.isKnownField(rule.field())) {
            logger.fine("Rule references unknown field '" + rule.field() + "'; it always resolves to null");
        }
        Function<Killmail, Object> accessor = FieldExtractor.accessor(rule.field());
        FilterOperator operator = rule.operator();
        Object value = rule.value();

        switch (operator) {
            case EQ: {
                Object expected = FilterValues.key(value);
                return k -> Objects.equals(FilterValues.key(accessor.apply(k)), expected);
            }
            case NE: {
                Object expected = FilterValues.key(value);
                return k -> !Objects.equals(FilterValues.key(accessor.apply(k)), expected);
            }
            case GT:
            case GTE:
            case LT:
            case LTE: {
                Double parsed = FilterValues.toNumber(value);
                if (parsed == null) {
                    throw new CompilationException("operator " + operator.wireName() + " requires a numeric value");
                }
                double threshold = parsed;
                return k -> {
                    Double actual = FilterValues.toNumber(accessor.apply(k));
                    return actual != null && FilterValues.compare(operator, actual, threshold);
                };
            }
            case IN: {
                Set<Object> members = FilterValues.keySet((List<?>) value);
                return k -> members.contains(FilterValues.key(accessor.apply(k)));
            }
            case NOT_IN: {
                Set<Object> members = FilterValues.keySet((List<?>) value);
                return k -> !members.contains(FilterValues.key(accessor.apply(k)));
            }
            case CONTAINS_ANY:
                return arrayPredicate(accessor, (List<?>) value, ArrayMode.ANY);
            case CONTAINS_ALL:
                return arrayPredicate(accessor, (List<?>) value, ArrayMode.ALL);
            case NOT_CONTAINS:
                return arrayPredicate(accessor, (List<?>) value, ArrayMode.NONE);
            default:
                throw new CompilationException("unsupported operator: " + operator.wireName());
        }
    }

    private enum ArrayMode { ANY, ALL, NONE }

    private static KillmailPredicate arrayPredicate(Function<Killmail, Object> accessor, List<?> expected,
                                                    ArrayMode mode) {
        Object[] wanted = expected.stream().map(FilterValues::key).toArray();
        return k -> {
            Object actual = accessor.apply(k);
            if (!(actual instanceof List<?> list)) {
                return false;
            }
            Set<Object> present = FilterValues.keySet(list);
            switch (mode) {
                case ANY:
                    for (Object w : wanted) {
                        if (present.contains(w)) {
                            return true;
                        }
                    }
                    return false;
                case ALL:
                    for (Object w : wanted) {
                        if (!present.contains(w)) {
                            return false;
                        }
                    }
                    return true;
                default:
                    for (Object w : wanted) {
                        if (present.contains(w)) {
                            return false;
                        }
                    }
                    return true;
            }
        };
    }
}
