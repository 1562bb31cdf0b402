package com.overseer.core.policy;

import com.overseer.core.model.AlertBody;
import com.overseer.core.model.CacheEntry;
import com.overseer.core.model.PolicyRule;
import com.overseer.core.model.ResultRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Match rule: fires for every row whose column, rendered as a string, equals
 * the configured value.
 *
 * @since 1.0.0
 */
public class MatchRule extends AbstractAlertRule {

    private static final Logger LOG = LoggerFactory.getLogger(MatchRule.class);

    private final String field;
    private final String value;

    public MatchRule(PolicyRule rule) {
        super(rule);
        this.field = Objects.requireNonNull(rule.getField(),
                "Field must not be null for match rule '" + rule.getName() + "'");
        this.value = Objects.requireNonNull(rule.getValue(),
                "Value must not be null for match rule '" + rule.getName() + "'");
    }

    @Override
    public List<AlertBody> evaluate(CacheEntry entry) {
        Objects.requireNonNull(entry, "CacheEntry must not be null");

        List<AlertBody> bodies = entry.getResult().resultRows().stream()
                .filter(row -> row.getStringField(field).map(value::equals).orElse(false))
                .map(row -> rowBody(entry.getTaskId(), row))
                .toList();
        if (!bodies.isEmpty()) {
            LOG.debug("Rule [{}] fired for {} row(s) of task [{}]", getRuleName(), bodies.size(), entry.getTaskId());
        }
        return bodies;
    }
}
