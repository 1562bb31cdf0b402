package com.overseer.core.policy;

import com.overseer.core.model.PolicyRule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link RuleFactory}.
 */
class RuleFactoryTest {

    private static PolicyRule rule(String name, String type) {
        PolicyRule rule = new PolicyRule();
        rule.setName(name);
        rule.setType(type);
        rule.setTitle(name);
        rule.setField("f");
        rule.setValue("v");
        return rule;
    }

    @Test
    @DisplayName("Should create the rule class matching each type")
    void shouldCreateByType() {
        assertThat(RuleFactory.create(rule("t", "threshold"))).isInstanceOf(ThresholdRule.class);
        assertThat(RuleFactory.create(rule("m", "Match"))).isInstanceOf(MatchRule.class);
        assertThat(RuleFactory.create(rule("r", "row_count"))).isInstanceOf(RowCountRule.class);
    }

    @Test
    @DisplayName("Should create all rules in order")
    void shouldCreateAll() {
        List<AlertRule> rules = RuleFactory.createAll(List.of(rule("a", "threshold"), rule("b", "match")));

        assertThat(rules).extracting(AlertRule::getRuleName).containsExactly("a", "b");
    }

    @Test
    @DisplayName("Should throw for unknown rule type")
    void shouldThrowForUnknownType() {
        assertThatThrownBy(() -> RuleFactory.create(rule("x", "histogram")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown rule type");
    }

    @Test
    @DisplayName("Should throw for null rule")
    void shouldThrowForNull() {
        assertThatThrownBy(() -> RuleFactory.create(null))
                .isInstanceOf(NullPointerException.class);
    }
}
