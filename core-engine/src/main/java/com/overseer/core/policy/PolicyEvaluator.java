package com.overseer.core.policy;

import com.overseer.core.model.AlertBody;
import com.overseer.core.model.CacheEntry;

import java.util.List;

/**
 * Applies policy rules to one cached query result.
 *
 * <p>
 * Returning an empty list means "no alert triggered". Any exception is
 * recorded as a failure of that cache entry alone.
 * </p>
 */
@FunctionalInterface
public interface PolicyEvaluator {

    /**
     * @param entry cached query result
     * @return alert candidates, possibly empty, never {@code null}
     */
    List<AlertBody> evaluate(CacheEntry entry);
}
