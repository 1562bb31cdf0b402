package com.overseer.core.policy;

import com.overseer.core.model.PolicyRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Factory that creates {@link AlertRule} instances from {@link PolicyRule}
 * configurations.
 *
 * <p>
 * This is the single point of extension when adding new rule types:
 * register the new type string here and create the corresponding rule.
 * </p>
 *
 * @since 1.0.0
 */
public final class RuleFactory {

    private static final Logger LOG = LoggerFactory.getLogger(RuleFactory.class);

    private RuleFactory() {
        // utility class - not instantiable
    }

    /**
     * Create a rule for the given configuration.
     *
     * @param rule the policy rule configuration; must not be {@code null}
     * @return an appropriate {@link AlertRule} instance
     * @throws NullPointerException     if {@code rule} or its type is {@code null}
     * @throws IllegalArgumentException if the rule type is unknown
     */
    public static AlertRule create(PolicyRule rule) {
        Objects.requireNonNull(rule, "PolicyRule must not be null");
        Objects.requireNonNull(rule.getType(), "Rule type must not be null");

        String type = rule.getType().toLowerCase(Locale.ROOT);
        return switch (type) {
            case "threshold" -> new ThresholdRule(rule);
            case "match" -> new MatchRule(rule);
            case "row_count" -> new RowCountRule(rule);
            default -> throw new IllegalArgumentException(
                    "Unknown rule type: '" + rule.getType()
                            + "'. Supported types: threshold, match, row_count");
        };
    }

    /**
     * Create rules for every configuration in the supplied list.
     *
     * @param rules list of rule configurations; must not be {@code null}
     * @return unmodifiable list of rules (one per configuration)
     * @throws NullPointerException if {@code rules} is {@code null}
     */
    public static List<AlertRule> createAll(List<PolicyRule> rules) {
        Objects.requireNonNull(rules, "Rules list must not be null");
        LOG.info("Creating {} policy rule(s) from configuration", rules.size());
        return rules.stream()
                .map(RuleFactory::create)
                .toList();
    }
}
