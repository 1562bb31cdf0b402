package com.overseer.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Raw result of executing one task's query: column names plus a list of rows.
 *
 * <p>
 * Rows are stored as free-form maps so that any query shape can be cached and
 * evaluated without a schema. Instances are immutable once built.
 * </p>
 *
 * @since 1.0.0
 */
public final class QueryResult {

    private final List<String> columns;
    private final List<Map<String, Object>> rows;

    /**
     * @param columns column names in select order, may be {@code null}
     * @param rows    row maps keyed by column name, may be {@code null}
     */
    @JsonCreator
    public QueryResult(@JsonProperty("columns") List<String> columns,
            @JsonProperty("rows") List<Map<String, Object>> rows) {
        this.columns = columns != null
                ? Collections.unmodifiableList(new ArrayList<>(columns))
                : Collections.emptyList();
        List<Map<String, Object>> copied = new ArrayList<>();
        if (rows != null) {
            for (Map<String, Object> row : rows) {
                copied.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
            }
        }
        this.rows = Collections.unmodifiableList(copied);
    }

    public static QueryResult empty() {
        return new QueryResult(List.of(), List.of());
    }

    @JsonProperty("columns")
    public List<String> getColumns() {
        return columns;
    }

    @JsonProperty("rows")
    public List<Map<String, Object>> getRows() {
        return rows;
    }

    /**
     * @return rows wrapped in {@link ResultRow} accessors
     */
    @JsonIgnore
    public List<ResultRow> resultRows() {
        return rows.stream().map(ResultRow::new).toList();
    }

    @JsonIgnore
    public int size() {
        return rows.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof QueryResult that))
            return false;
        return columns.equals(that.columns) && rows.equals(that.rows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columns, rows);
    }

    @Override
    public String toString() {
        return "QueryResult{columns=" + columns + ", rows=" + rows.size() + '}';
    }
}
