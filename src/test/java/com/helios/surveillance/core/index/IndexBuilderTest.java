package com.helios.surveillance.core.index;

import com.helios.surveillance.core.compiler.FilterCompiler;
import com.helios.surveillance.model.FilterNode;
import com.helios.surveillance.model.FilterOperator;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.helios.surveillance.Fixtures.JITA;
import static com.helios.surveillance.Fixtures.and;
import static com.helios.surveillance.Fixtures.or;
import static com.helios.surveillance.Fixtures.rule;
import static org.assertj.core.api.Assertions.assertThat;

class IndexBuilderTest {

    private final FilterCompiler compiler = new FilterCompiler();
    private final IndexBuilder indexBuilder = new IndexBuilder();

    private IndexContribution contributionOf(Map<String, Object> tree) {
        FilterNode ast = compiler.compile(tree).ast();
        return indexBuilder.build("p", ast);
    }

    @Test
    void shouldIndexTopLevelAndRules() {
        IndexContribution contribution = contributionOf(and(
                rule("module_tags", "contains_any", List.of("cyno", "cloak")),
                rule("solar_system_id", "in", List.of(JITA, 30000144)),
                rule("victim_ship_type_id", "in", List.of(670)),
                rule("total_value", "gte", 1_000_000_000)));

        assertThat(contribution.tags()).containsExactlyInAnyOrder("cyno", "cloak");
        assertThat(contribution.systemIds()).containsExactlyInAnyOrder(JITA, 30000144L);
        assertThat(contribution.shipTypeIds()).containsExactly(670L);
        assertThat(contribution.iskThresholds()).containsExactly(new IskThreshold(FilterOperator.GTE, 1e9));
        assertThat(contribution.mask()).isEqualTo(0b1111);
    }

    @Test
    void shouldIgnoreRulesTheIndexesCannotAnswer() {
        IndexContribution contribution = contributionOf(and(
                rule("system_id", "eq", JITA),
                rule("module_tags", "not_contains", List.of("cyno")),
                rule("victim_ship_type_id", "not_in", List.of(670)),
                rule("attacker_count", "gt", 10)));

        assertThat(contribution.isEmpty()).isTrue();
    }

    @Test
    void shouldLeaveOrRootedProfilesUnindexed() {
        IndexContribution contribution = contributionOf(or(
                rule("module_tags", "contains_any", List.of("cyno")),
                rule("victim_ship_type_id", "in", List.of(670, 671))));

        assertThat(contribution).isSameAs(IndexContribution.EMPTY);
    }

    @Test
    void shouldNotDescendIntoNestedGroups() {
        IndexContribution contribution = contributionOf(and(
                rule("total_value", "lt", 5e8),
                and(rule("solar_system_id", "in", List.of(JITA)))));

        assertThat(contribution.systemIds()).isEmpty();
        assertThat(contribution.mask()).isEqualTo(IndexKind.ISK.bit());
    }

    @Test
    void shouldSkipValuesThatCanNeverMatch() {
        IndexContribution contribution = contributionOf(and(
                rule("module_tags", "contains_any", List.of(7)),
                rule("solar_system_id", "in", List.of("30000142", 1.5))));

        assertThat(contribution.isEmpty()).isTrue();
    }
}
