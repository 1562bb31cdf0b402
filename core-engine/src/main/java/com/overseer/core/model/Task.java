package com.overseer.core.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * One unit of query work.
 *
 * <p>
 * The query text is opaque to the pipeline; it is handed unchanged to the
 * configured {@code QueryExecutor}. Tasks are immutable.
 * </p>
 *
 * @since 1.0.0
 */
public final class Task {

    private final String id;
    private final Set<String> tags;
    private final String query;
    private final String source;

    private Task(Builder builder) {
        this.id = builder.id;
        this.tags = Collections.unmodifiableSet(new LinkedHashSet<>(builder.tags));
        this.query = builder.query;
        this.source = builder.source;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Task}. {@code id} and {@code query} are
     * checked by {@link Tasks#validate(java.util.List)}, not here, so that a
     * loader can report every broken file at once.
     */
    public static class Builder {
        private String id;
        private final Set<String> tags = new LinkedHashSet<>();
        private String query;
        private String source;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder tag(String tag) {
            this.tags.add(Objects.requireNonNull(tag, "tag must not be null"));
            return this;
        }

        public Builder tags(Iterable<String> tags) {
            tags.forEach(this::tag);
            return this;
        }

        public Builder query(String query) {
            this.query = query;
            return this;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Task build() {
            return new Task(this);
        }
    }

    public String getId() {
        return id;
    }

    /**
     * @return unmodifiable, insertion-ordered set of tags
     */
    public Set<String> getTags() {
        return tags;
    }

    public String getQuery() {
        return query;
    }

    /**
     * @return where the task was loaded from, or {@code null} if built in code
     */
    public String getSource() {
        return source;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Task task))
            return false;
        return Objects.equals(id, task.id)
                && Objects.equals(tags, task.tags)
                && Objects.equals(query, task.query);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, tags, query);
    }

    @Override
    public String toString() {
        return "Task{" +
                "id='" + id + '\'' +
                ", tags=" + tags +
                ", source='" + source + '\'' +
                '}';
    }
}
