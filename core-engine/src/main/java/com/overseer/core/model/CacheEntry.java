package com.overseer.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * One cached query result, stored under a job partition by the Run phase and
 * read, never mutated, by the Eval phase.
 *
 * @since 1.0.0
 */
public final class CacheEntry {

    private final String taskId;
    private final QueryResult result;
    private final Instant storedAt;

    @JsonCreator
    public CacheEntry(@JsonProperty("task_id") String taskId,
            @JsonProperty("result") QueryResult result,
            @JsonProperty("stored_at") Instant storedAt) {
        this.taskId = Objects.requireNonNull(taskId, "taskId must not be null");
        this.result = Objects.requireNonNull(result, "result must not be null");
        this.storedAt = Objects.requireNonNull(storedAt, "storedAt must not be null");
    }

    @JsonProperty("task_id")
    public String getTaskId() {
        return taskId;
    }

    @JsonProperty("result")
    public QueryResult getResult() {
        return result;
    }

    @JsonProperty("stored_at")
    public Instant getStoredAt() {
        return storedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CacheEntry that))
            return false;
        return taskId.equals(that.taskId)
                && result.equals(that.result)
                && storedAt.equals(that.storedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(taskId, result, storedAt);
    }

    @Override
    public String toString() {
        return "CacheEntry{taskId='" + taskId + "', result=" + result + ", storedAt=" + storedAt + '}';
    }
}
