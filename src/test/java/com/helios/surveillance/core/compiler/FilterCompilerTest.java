package com.helios.surveillance.core.compiler;

import com.helios.surveillance.model.FilterNode;
import com.helios.surveillance.model.FilterOperator;
import com.helios.surveillance.model.Killmail;
import com.helios.surveillance.model.Victim;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.helios.surveillance.Fixtures.JITA;
import static com.helios.surveillance.Fixtures.PERIMETER;
import static com.helios.surveillance.Fixtures.and;
import static com.helios.surveillance.Fixtures.attacker;
import static com.helios.surveillance.Fixtures.or;
import static com.helios.surveillance.Fixtures.rule;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FilterCompilerTest {

    private final FilterCompiler compiler = new FilterCompiler();

    private final Killmail jitaKill = Killmail.builder(1L)
            .solarSystem(JITA, "Jita")
            .victim(new Victim(90L, 98L, null, 670L, "Pilot", null, null, "Typhoon"))
            .attacker(attacker(11L, true))
            .attacker(attacker(12L, false))
            .totalValue(2_000_000_000.0)
            .moduleTags("cyno", "cloak")
            .build();

    private boolean matches(Map<String, Object> tree, Killmail killmail) {
        return compiler.compile(tree).predicate().test(killmail);
    }

    @Test
    @DisplayName("System plus ISK profile matches only in its system")
    void shouldMatchSystemAndValue() {
        Map<String, Object> tree = and(
                rule("system_id", "eq", JITA),
                rule("total_value", "gt", 1_000_000_000L));

        Killmail elsewhere = Killmail.builder(2L).solarSystemId(PERIMETER).totalValue(2e9).build();

        assertThat(matches(tree, jitaKill)).isTrue();
        assertThat(matches(tree, elsewhere)).isFalse();
    }

    @Test
    void shouldEvaluateOrGroups() {
        Map<String, Object> tree = or(
                rule("module_tags", "contains_any", List.of("bubble")),
                rule("victim_ship_type_id", "in", List.of(670, 671)));

        assertThat(matches(tree, jitaKill)).isTrue();
        assertThat(matches(tree, Killmail.builder(3L).build())).isFalse();
    }

    @Test
    void shouldEvaluateNestedGroups() {
        Map<String, Object> tree = and(
                rule("total_value", "gte", 1e9),
                or(rule("attacker_character_ids", "contains_any", List.of(99)),
                        rule("final_blow_character_id", "eq", 11)));

        assertThat(matches(tree, jitaKill)).isTrue();
    }

    @Test
    void shouldApplyArrayOperators() {
        assertThat(matches(and(rule("module_tags", "contains_all", List.of("cyno", "cloak"))), jitaKill)).isTrue();
        assertThat(matches(and(rule("module_tags", "contains_all", List.of("cyno", "bubble"))), jitaKill)).isFalse();
        assertThat(matches(and(rule("module_tags", "not_contains", List.of("bubble"))), jitaKill)).isTrue();
        assertThat(matches(and(rule("module_tags", "not_contains", List.of("cloak"))), jitaKill)).isFalse();
    }

    @Test
    @DisplayName("Array operators on a field that is not a list never match")
    void shouldNotMatchArrayOperatorOnScalar() {
        assertThat(matches(and(rule("system_id", "contains_any", List.of(JITA))), jitaKill)).isFalse();
        assertThat(matches(and(rule("no_such_field", "not_contains", List.of("x"))), jitaKill)).isFalse();
    }

    @Test
    void shouldCompareNumbersAcrossBoxedTypes() {
        assertThat(matches(and(rule("victim_ship_type_id", "eq", 670)), jitaKill)).isTrue();
        assertThat(matches(and(rule("victim_ship_type_id", "eq", 670.0)), jitaKill)).isTrue();
        assertThat(matches(and(rule("victim_ship_type_id", "in", List.of(670.0))), jitaKill)).isTrue();
        assertThat(matches(and(rule("total_value", "lt", "3000000000")), jitaKill)).isTrue();
    }

    @Test
    void shouldTreatMissingFieldsAsNull() {
        assertThat(matches(and(rule("victim_alliance_id", "eq", null)), jitaKill)).isTrue();
        assertThat(matches(and(rule("victim_alliance_id", "not_in", List.of(1, 2))), jitaKill)).isTrue();
        assertThat(matches(and(rule("victim_alliance_id", "gt", 0)), jitaKill)).isFalse();
        assertThat(matches(and(rule("victim_alliance_id", "ne", 5)), jitaKill)).isTrue();
    }

    @Test
    void shouldExposeParsedTree() {
        CompiledFilter filter = compiler.compile(and(rule("total_value", "gt", "100")));

        FilterNode.Group root = (FilterNode.Group) filter.ast();
        FilterNode.Rule rule = (FilterNode.Rule) root.children().get(0);
        assertThat(root.combinator()).isEqualTo(FilterNode.Combinator.AND);
        assertThat(rule.operator()).isEqualTo(FilterOperator.GT);
        assertThat(rule.value()).isEqualTo(100L);
    }

    @Test
    void shouldRejectUnsupportedOperator() {
        assertThatThrownBy(() -> compiler.compile(and(rule("total_value", "between", List.of(1, 2)))))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("unsupported operator")
                .hasMessageContaining("$.rules[0]");
    }

    @Test
    void shouldRejectMalformedTrees() {
        assertThatThrownBy(() -> compiler.compile(null))
                .isInstanceOf(CompilationException.class);
        assertThatThrownBy(() -> compiler.compile(rule("total_value", "gt", 1)))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("root");
        assertThatThrownBy(() -> compiler.compile(Map.of("condition", "xor", "rules", List.of())))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("invalid condition");
        assertThatThrownBy(() -> compiler.compile(Map.of("condition", "and", "rules", List.of())))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("non-empty list");
    }

    @Test
    void shouldRejectInvalidRuleShapes() {
        Map<String, Object> noValue = new HashMap<>(rule("total_value", "gt", 1));
        noValue.remove("value");

        assertThatThrownBy(() -> compiler.compile(and(noValue)))
                .hasMessageContaining("missing value");
        assertThatThrownBy(() -> compiler.compile(and(rule("system_id", "in", 30000142))))
                .hasMessageContaining("requires a non-empty list");
        assertThatThrownBy(() -> compiler.compile(and(rule("system_id", "in", List.of()))))
                .hasMessageContaining("requires a non-empty list");
        assertThatThrownBy(() -> compiler.compile(and(rule("total_value", "gt", "lots"))))
                .hasMessageContaining("requires a numeric value");
        assertThatThrownBy(() -> compiler.compile(and(rule("", "eq", 1))))
                .hasMessageContaining("missing field");
    }

    @Test
    void shouldRejectExcessiveNesting() {
        Map<String, Object> tree = and(rule("total_value", "gt", 1));
        for (int i = 0; i < FilterTreeParser.MAX_DEPTH; i++) {
            tree = and(tree);
        }
        Map<String, Object> deep = tree;

        assertThatThrownBy(() -> compiler.compile(deep))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("nested deeper");
    }

    @Test
    @DisplayName("A predicate never throws, even for odd values")
    void shouldNeverThrowFromPredicate() {
        List<Object> mixed = new ArrayList<>();
        mixed.add(null);
        mixed.add("x");
        mixed.add(List.of(1));
        CompiledFilter filter = compiler.compile(and(
                rule("module_tags", "contains_any", mixed),
                rule("victim_ship_type_id", "in", mixed)));

        assertThat(filter.predicate().test(jitaKill)).isFalse();
        assertThat(filter.predicate().test(Killmail.builder(9L).build())).isFalse();
    }
}
