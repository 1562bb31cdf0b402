package com.overseer.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Describes a single policy rule loaded from configuration.
 *
 * <p>
 * Supported rule types:
 * </p>
 * <ul>
 * <li>{@code threshold} - one alert per row whose numeric {@code field}
 * exceeds {@code threshold}</li>
 * <li>{@code match} - one alert per row whose {@code field} equals
 * {@code value}</li>
 * <li>{@code row_count} - one alert per result with more than
 * {@code threshold} rows</li>
 * </ul>
 *
 * <p>
 * Call {@link #validate()} after construction / deserialization to verify
 * that all required fields for the declared rule type are present and valid.
 * </p>
 *
 * @since 1.0.0
 */
public class PolicyRule {

    /** Unique rule name, copied into every alert as the {@code rule} attribute. */
    private String name;

    /** Rule type: "threshold", "match" or "row_count". */
    private String type;

    /** Task ID the rule applies to; blank means every task. */
    private String task;

    /** Alert title. */
    private String title;

    /** Alert description. */
    private String description;

    // --- Row rule fields ---
    /** Column evaluated by threshold and match rules. */
    private String field;

    /** Expected column value for match rules. */
    private String value;

    /** Threshold value; semantics depend on the rule type. */
    private double threshold;

    /** Column whose raw value becomes the alert timestamp. */
    private String timestampField;

    /** Columns copied into alert attributes; empty means all columns. */
    private List<String> attrFields = new ArrayList<>();

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate that all required fields for the declared rule type are present
     * and contain legal values.
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (name == null || name.isBlank()) {
            errors.add("Rule 'name' is required");
        }
        if (type == null || type.isBlank()) {
            errors.add("Rule 'type' is required");
        }
        if (title == null || title.isBlank()) {
            errors.add("Rule '" + name + "' requires 'title'");
        }

        if (type != null) {
            switch (type) {
                case "threshold" -> {
                    if (field == null || field.isBlank()) {
                        errors.add("Threshold rule '" + name + "' requires 'field'");
                    }
                }
                case "match" -> {
                    if (field == null || field.isBlank()) {
                        errors.add("Match rule '" + name + "' requires 'field'");
                    }
                    if (value == null) {
                        errors.add("Match rule '" + name + "' requires 'value'");
                    }
                }
                case "row_count" -> {
                    if (threshold < 0) {
                        errors.add("Row count rule '" + name + "' requires 'threshold' >= 0");
                    }
                }
                default -> errors.add("Unknown rule type: '" + type
                        + "'. Supported: threshold, match, row_count");
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid PolicyRule: " + String.join("; ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getType() {
        return type;
    }

    /**
     * Set the rule type, normalised to lowercase.
     *
     * @param type rule type string
     */
    public void setType(String type) {
        this.type = type != null ? type.toLowerCase(Locale.ROOT) : null;
    }

    public String getTask() {
        return task;
    }

    public void setTask(String task) {
        this.task = task;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getField() {
        return field;
    }

    public void setField(String field) {
        this.field = field;
    }

    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        this.value = value;
    }

    public double getThreshold() {
        return threshold;
    }

    public void setThreshold(double threshold) {
        this.threshold = threshold;
    }

    public String getTimestampField() {
        return timestampField;
    }

    public void setTimestampField(String timestampField) {
        this.timestampField = timestampField;
    }

    /**
     * @return unmodifiable list of attribute columns
     */
    public List<String> getAttrFields() {
        return Collections.unmodifiableList(attrFields);
    }

    public void setAttrFields(List<String> attrFields) {
        this.attrFields = attrFields != null ? new ArrayList<>(attrFields) : new ArrayList<>();
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PolicyRule that))
            return false;
        return Objects.equals(name, that.name) && Objects.equals(type, that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override
    public String toString() {
        return "PolicyRule{" +
                "name='" + name + '\'' +
                ", type='" + type + '\'' +
                ", task='" + task + '\'' +
                ", field='" + field + '\'' +
                ", value='" + value + '\'' +
                ", threshold=" + threshold +
                '}';
    }
}
