package com.overseer.core.model;

import com.overseer.core.error.ErrorKind;
import com.overseer.core.error.OverseerException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Selection criterion over tasks: a set of tags and a set of task IDs.
 *
 * <p>
 * A task matches when its ID is listed, when it carries at least one listed
 * tag, or when the target is empty (select-all).
 * </p>
 *
 * @since 1.0.0
 */
public final class Target {

    private static final Target ALL = new Target(List.of(), List.of());

    private final Set<String> tags;
    private final Set<String> ids;

    /**
     * @param tags tag criteria, may be {@code null}
     * @param ids  ID criteria, may be {@code null}
     */
    public Target(Collection<String> tags, Collection<String> ids) {
        this.tags = copy(tags);
        this.ids = copy(ids);
    }

    public static Target all() {
        return ALL;
    }

    public static Target ofTags(String... tags) {
        return new Target(List.of(tags), List.of());
    }

    public static Target ofIds(String... ids) {
        return new Target(List.of(), List.of(ids));
    }

    public Set<String> getTags() {
        return tags;
    }

    public Set<String> getIds() {
        return ids;
    }

    public boolean isEmpty() {
        return tags.isEmpty() && ids.isEmpty();
    }

    /**
     * @param task candidate task
     * @return {@code true} if the task is selected by this target
     */
    public boolean matches(Task task) {
        if (isEmpty() || ids.contains(task.getId())) {
            return true;
        }
        for (String tag : task.getTags()) {
            if (tags.contains(tag)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @throws OverseerException with {@link ErrorKind#INVALID_TARGET} if any
     *                           tag or ID is blank
     */
    public void validate() {
        for (String tag : tags) {
            if (tag == null || tag.isBlank()) {
                throw new OverseerException(ErrorKind.INVALID_TARGET, "tag must not be empty")
                        .with("tags", tags);
            }
        }
        for (String id : ids) {
            if (id == null || id.isBlank()) {
                throw new OverseerException(ErrorKind.INVALID_TARGET, "task ID must not be empty")
                        .with("ids", ids);
            }
        }
    }

    private static Set<String> copy(Collection<String> values) {
        // LinkedHashSet tolerates null entries so validate() can report them
        return values == null
                ? Collections.emptySet()
                : Collections.unmodifiableSet(new LinkedHashSet<>(values));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Target that))
            return false;
        return tags.equals(that.tags) && ids.equals(that.ids);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tags, ids);
    }

    @Override
    public String toString() {
        return "Target{tags=" + tags + ", ids=" + ids + '}';
    }
}
