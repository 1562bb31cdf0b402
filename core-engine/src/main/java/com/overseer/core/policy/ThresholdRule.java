package com.overseer.core.policy;

import com.overseer.core.model.AlertBody;
import com.overseer.core.model.CacheEntry;
import com.overseer.core.model.PolicyRule;
import com.overseer.core.model.ResultRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Threshold rule.
 *
 * <p>
 * Fires once for every row whose numeric column value exceeds the configured
 * threshold. Rows where the column is missing or not numeric are skipped.
 * </p>
 *
 * @since 1.0.0
 */
public class ThresholdRule extends AbstractAlertRule {

    private static final Logger LOG = LoggerFactory.getLogger(ThresholdRule.class);

    private final String field;
    private final double threshold;

    /**
     * @param rule the policy rule configuration
     * @throws NullPointerException if {@code rule} or required fields are
     *                              {@code null}
     */
    public ThresholdRule(PolicyRule rule) {
        super(rule);
        this.field = Objects.requireNonNull(rule.getField(),
                "Field must not be null for threshold rule '" + rule.getName() + "'");
        this.threshold = rule.getThreshold();
    }

    @Override
    public List<AlertBody> evaluate(CacheEntry entry) {
        Objects.requireNonNull(entry, "CacheEntry must not be null");

        List<AlertBody> bodies = new ArrayList<>();
        for (ResultRow row : entry.getResult().resultRows()) {
            Optional<Double> value = row.getNumericField(field);
            if (value.isEmpty()) {
                LOG.trace("Rule [{}]: field '{}' not present or not numeric - skipping", getRuleName(), field);
                continue;
            }
            if (value.get() > threshold) {
                LOG.debug("Rule [{}] fired: {}={} > threshold={}", getRuleName(), field, value.get(), threshold);
                bodies.add(rowBody(entry.getTaskId(), row));
            }
        }
        return bodies;
    }
}
