package com.overseer.core.policy;

import com.overseer.core.model.AlertBody;
import com.overseer.core.model.AttrValue;
import com.overseer.core.model.CacheEntry;
import com.overseer.core.model.PolicyRule;
import com.overseer.core.model.QueryResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ThresholdRule}.
 */
class ThresholdRuleTest {

    private ThresholdRule rule;

    @BeforeEach
    void setUp() {
        PolicyRule config = new PolicyRule();
        config.setName("failed_logins");
        config.setType("threshold");
        config.setTitle("Too many failed logins");
        config.setDescription("Account exceeded the failure threshold");
        config.setField("failures");
        config.setThreshold(10);
        config.setTimestampField("last_seen");
        config.setAttrFields(List.of("user", "failures"));
        rule = new ThresholdRule(config);
    }

    private static CacheEntry entry(Object... userFailurePairs) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < userFailurePairs.length; i += 2) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("user", userFailurePairs[i]);
            row.put("failures", userFailurePairs[i + 1]);
            row.put("last_seen", "2024-05-01T10:00:00Z");
            row.put("ip", "10.0.0.1");
            rows.add(row);
        }
        return new CacheEntry("auth_failures",
                new QueryResult(List.of("user", "failures", "last_seen", "ip"), rows),
                Instant.parse("2024-05-01T12:00:00Z"));
    }

    @Test
    @DisplayName("Should fire once per row above the threshold")
    void shouldFirePerRow() {
        List<AlertBody> bodies = rule.evaluate(entry("alice", 12, "bob", 3, "carol", 40));

        assertThat(bodies).hasSize(2);
        assertThat(bodies).extracting(b -> b.getAttrs().get("user")).containsExactly(
                AttrValue.of("alice"), AttrValue.of("carol"));
    }

    @Test
    @DisplayName("Should NOT fire when value equals threshold exactly")
    void shouldNotFireAtExactThreshold() {
        assertThat(rule.evaluate(entry("alice", 10))).isEmpty();
    }

    @Test
    @DisplayName("Should skip rows where the field is missing or not numeric")
    void shouldSkipNonNumeric() {
        assertThat(rule.evaluate(entry("alice", null, "bob", "many"))).isEmpty();
    }

    @Test
    @DisplayName("Should handle string-encoded numeric values")
    void shouldHandleStringEncodedNumbers() {
        assertThat(rule.evaluate(entry("alice", "20"))).hasSize(1);
    }

    @Test
    @DisplayName("Should copy title, raw timestamp and selected columns into the body")
    void shouldBuildBody() {
        AlertBody body = rule.evaluate(entry("alice", 12)).get(0);

        assertThat(body.getTitle()).isEqualTo("Too many failed logins");
        assertThat(body.getDescription()).isEqualTo("Account exceeded the failure threshold");
        assertThat(body.getTimestamp()).isEqualTo("2024-05-01T10:00:00Z");
        assertThat(body.getAttrs()).containsOnlyKeys(
                AbstractAlertRule.ATTR_RULE, AbstractAlertRule.ATTR_TASK_ID, "user", "failures");
        assertThat(body.getAttrs().get(AbstractAlertRule.ATTR_TASK_ID)).isEqualTo(AttrValue.of("auth_failures"));
    }

    @Test
    @DisplayName("Should keep rule and task attributes when a row has columns of the same name")
    void shouldNotLetColumnsOverrideReservedAttrs() {
        PolicyRule config = new PolicyRule();
        config.setName("failed_logins");
        config.setType("threshold");
        config.setTitle("Too many failed logins");
        config.setField("failures");
        config.setThreshold(10);
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("rule", "spoofed");
        row.put("task_id", "other_task");
        row.put("failures", 12);
        CacheEntry entry = new CacheEntry("auth_failures",
                new QueryResult(List.of("rule", "task_id", "failures"), List.of(row)),
                Instant.parse("2024-05-01T12:00:00Z"));

        AlertBody body = new ThresholdRule(config).evaluate(entry).get(0);

        assertThat(body.getAttrs().get(AbstractAlertRule.ATTR_RULE)).isEqualTo(AttrValue.of("failed_logins"));
        assertThat(body.getAttrs().get(AbstractAlertRule.ATTR_TASK_ID)).isEqualTo(AttrValue.of("auth_failures"));
        assertThat(body.getAttrs().get("failures")).isEqualTo(AttrValue.of(12L));
    }
}
