package com.overseer.core.model;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only accessor over a single result row.
 *
 * <p>
 * Policy rules query arbitrary columns through this class without requiring
 * a rigid schema. Numeric accessors coerce common JDBC/JSON number types and
 * numeric strings.
 * </p>
 */
public final class ResultRow {

    private final Map<String, Object> fields;

    public ResultRow(Map<String, Object> fields) {
        this.fields = Collections.unmodifiableMap(
                Objects.requireNonNull(fields, "fields must not be null"));
    }

    /**
     * @return unmodifiable view of all columns
     */
    public Map<String, Object> getFields() {
        return fields;
    }

    public boolean hasField(String fieldName) {
        return fields.containsKey(fieldName);
    }

    /**
     * @param fieldName column name
     * @return optional containing the value, or empty if absent or SQL NULL
     */
    public Optional<Object> getField(String fieldName) {
        return Optional.ofNullable(fields.get(fieldName));
    }

    /**
     * Retrieve a numeric column value.
     *
     * <p>
     * Handles {@link Number} subclasses natively and attempts
     * {@link Double#parseDouble(String)} for string-encoded numbers.
     * </p>
     *
     * @param fieldName column name
     * @return optional containing the value as a {@code double}
     */
    public Optional<Double> getNumericField(String fieldName) {
        Object raw = fields.get(fieldName);
        if (raw instanceof Number n) {
            return Optional.of(n.doubleValue());
        }
        if (raw instanceof String s) {
            try {
                return Optional.of(Double.parseDouble(s.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    /**
     * @param fieldName column name
     * @return optional containing the value rendered as a string
     */
    public Optional<String> getStringField(String fieldName) {
        Object raw = fields.get(fieldName);
        return raw == null ? Optional.empty() : Optional.of(raw.toString());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ResultRow that))
            return false;
        return fields.equals(that.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "ResultRow" + fields;
    }
}
