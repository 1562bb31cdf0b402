package com.overseer.core.config;

import com.overseer.core.model.PolicyRule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Top-level POJO for the policy YAML configuration.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * rules:
 *   - name: failed_logins
 *     type: threshold
 *     task: auth_failures
 *     field: failures
 *     threshold: 10
 *     title: Too many failed logins
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading to verify every rule is valid.
 * </p>
 *
 * @since 1.0.0
 */
public class PolicyConfig {

    private List<PolicyRule> rules = new ArrayList<>();

    /**
     * Return the rules list. The returned list is <strong>unmodifiable</strong>.
     *
     * @return unmodifiable list of policy rules
     */
    public List<PolicyRule> getRules() {
        return Collections.unmodifiableList(rules);
    }

    /**
     * Set the rules list (used by SnakeYAML during deserialization).
     *
     * @param rules the policy rules
     */
    public void setRules(List<PolicyRule> rules) {
        this.rules = rules != null ? new ArrayList<>(rules) : new ArrayList<>();
    }

    /**
     * Validate every rule in this configuration and check that rule names are
     * unique.
     *
     * <p>
     * Collects all errors and throws a single exception if any rule is invalid.
     * </p>
     *
     * @throws IllegalStateException if one or more rules are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        Set<String> names = new HashSet<>();

        for (int i = 0; i < rules.size(); i++) {
            PolicyRule rule = Objects.requireNonNull(rules.get(i),
                    "Rule at index " + i + " is null");
            try {
                rule.validate();
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
            }
            if (rule.getName() != null && !names.add(rule.getName())) {
                errors.add("Duplicate rule name: '" + rule.getName() + "'");
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Policy configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    @Override
    public String toString() {
        return "PolicyConfig{rules=" + rules + '}';
    }
}
