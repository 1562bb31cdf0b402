package com.overseer.core.policy;

import com.overseer.core.model.AlertBody;
import com.overseer.core.model.PolicyRule;
import com.overseer.core.model.ResultRow;

import java.util.List;
import java.util.Objects;

/**
 * Shared configuration and alert-body assembly for the built-in rules.
 */
abstract class AbstractAlertRule implements AlertRule {

    /** Attribute naming the rule that produced an alert. */
    static final String ATTR_RULE = "rule";

    /** Attribute naming the task whose result produced an alert. */
    static final String ATTR_TASK_ID = "task_id";

    private final String ruleName;
    private final String task;
    private final String title;
    private final String description;
    private final String timestampField;
    private final List<String> attrFields;

    AbstractAlertRule(PolicyRule rule) {
        Objects.requireNonNull(rule, "PolicyRule must not be null");
        this.ruleName = Objects.requireNonNull(rule.getName(), "Rule name must not be null");
        this.title = Objects.requireNonNull(rule.getTitle(),
                "Title must not be null for rule '" + ruleName + "'");
        this.task = rule.getTask();
        this.description = rule.getDescription();
        this.timestampField = rule.getTimestampField();
        this.attrFields = List.copyOf(rule.getAttrFields());
    }

    @Override
    public boolean appliesTo(String taskId) {
        return task == null || task.isBlank() || task.equals(taskId);
    }

    @Override
    public String getRuleName() {
        return ruleName;
    }

    /**
     * @return a body builder pre-filled with title, description and the rule
     *         and task attributes
     */
    AlertBody.Builder newBody(String taskId) {
        return AlertBody.builder()
                .title(title)
                .description(description)
                .attr(ATTR_RULE, ruleName)
                .attr(ATTR_TASK_ID, taskId);
    }

    /**
     * Build the alert body for a row that fired the rule.
     *
     * <p>
     * The configured timestamp column is passed through raw; it is decoded
     * when the alert is constructed. Row columns never replace the
     * {@value #ATTR_RULE} and {@value #ATTR_TASK_ID} attributes.
     * </p>
     */
    AlertBody rowBody(String taskId, ResultRow row) {
        AlertBody.Builder builder = newBody(taskId);
        if (timestampField != null && !timestampField.isBlank()) {
            builder.timestamp(row.getField(timestampField).orElse(null));
        }
        if (attrFields.isEmpty()) {
            row.getFields().forEach(builder::attr);
        } else {
            for (String f : attrFields) {
                builder.attr(f, row.getField(f).orElse(null));
            }
        }
        return builder
                .attr(ATTR_RULE, ruleName)
                .attr(ATTR_TASK_ID, taskId)
                .build();
    }
}
