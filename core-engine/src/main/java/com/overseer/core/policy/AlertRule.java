package com.overseer.core.policy;

import com.overseer.core.model.AlertBody;
import com.overseer.core.model.CacheEntry;

import java.util.List;

/**
 * Contract for all policy rules.
 *
 * <p>
 * Rules are stateless: each cache entry is evaluated independently, so one
 * instance may be shared across entries and jobs.
 * </p>
 */
public interface AlertRule {

    /**
     * Evaluate one cached result.
     *
     * @param entry the cached query result
     * @return alert candidates, empty if the rule does not fire
     */
    List<AlertBody> evaluate(CacheEntry entry);

    /**
     * @param taskId ID of the task that produced a cache entry
     * @return {@code true} if this rule should see that task's results
     */
    boolean appliesTo(String taskId);

    /**
     * Return the unique name of this rule.
     *
     * @return rule name
     */
    String getRuleName();
}
