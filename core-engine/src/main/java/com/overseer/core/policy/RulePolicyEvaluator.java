package com.overseer.core.policy;

import com.overseer.core.model.AlertBody;
import com.overseer.core.model.CacheEntry;
import com.overseer.core.model.PolicyRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link PolicyEvaluator} that runs every configured {@link AlertRule} whose
 * task filter matches the cache entry, concatenating their candidates in rule
 * order.
 *
 * <p>
 * A rule that throws fails the whole entry; the Eval phase records it against
 * the task and moves on to the next entry.
 * </p>
 *
 * @since 1.0.0
 */
public class RulePolicyEvaluator implements PolicyEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(RulePolicyEvaluator.class);

    private final List<AlertRule> rules;

    public RulePolicyEvaluator(List<AlertRule> rules) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules must not be null"));
    }

    /**
     * @param rules validated rule configurations
     * @return evaluator over the corresponding rules
     */
    public static RulePolicyEvaluator fromConfig(List<PolicyRule> rules) {
        return new RulePolicyEvaluator(RuleFactory.createAll(rules));
    }

    @Override
    public List<AlertBody> evaluate(CacheEntry entry) {
        Objects.requireNonNull(entry, "CacheEntry must not be null");

        List<AlertBody> candidates = new ArrayList<>();
        int applied = 0;
        for (AlertRule rule : rules) {
            if (rule.appliesTo(entry.getTaskId())) {
                applied++;
                candidates.addAll(rule.evaluate(entry));
            }
        }
        if (applied == 0) {
            LOG.debug("No rule applies to task [{}]", entry.getTaskId());
        }
        return candidates;
    }

    public List<AlertRule> getRules() {
        return rules;
    }
}
