package com.overseer.core.policy;

import com.overseer.core.model.AlertBody;
import com.overseer.core.model.CacheEntry;
import com.overseer.core.model.PolicyRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Row count rule.
 *
 * <p>
 * Fires a single alert when a result holds more rows than the configured
 * threshold; a threshold of {@code 0} therefore fires on any non-empty
 * result. The alert is timestamped with the moment the result was cached.
 * </p>
 *
 * @since 1.0.0
 */
public class RowCountRule extends AbstractAlertRule {

    private static final Logger LOG = LoggerFactory.getLogger(RowCountRule.class);

    static final String ATTR_ROW_COUNT = "row_count";

    private final double threshold;

    public RowCountRule(PolicyRule rule) {
        super(rule);
        this.threshold = rule.getThreshold();
        if (threshold < 0) {
            throw new IllegalArgumentException(
                    "threshold must be >= 0 for rule '" + rule.getName() + "', got: " + threshold);
        }
    }

    @Override
    public List<AlertBody> evaluate(CacheEntry entry) {
        Objects.requireNonNull(entry, "CacheEntry must not be null");

        int count = entry.getResult().size();
        if (count <= threshold) {
            return List.of();
        }
        LOG.debug("Rule [{}] fired: rows={} > threshold={}", getRuleName(), count, threshold);
        return List.of(newBody(entry.getTaskId())
                .timestamp(entry.getStoredAt().toString())
                .attr(ATTR_ROW_COUNT, count)
                .build());
    }
}
