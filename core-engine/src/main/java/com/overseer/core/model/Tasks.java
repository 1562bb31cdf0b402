package com.overseer.core.model;

import com.overseer.core.error.ErrorKind;
import com.overseer.core.error.OverseerException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Validation over a configured set of {@link Task}s.
 */
public final class Tasks {

    private Tasks() {
        // utility class
    }

    /**
     * Check that every task has an ID and a query, and that IDs are unique.
     *
     * @param tasks configured tasks; must not be {@code null}
     * @throws OverseerException {@link ErrorKind#INVALID_CONFIGURATION} for a
     *                           task without ID or query,
     *                           {@link ErrorKind#DUPLICATE_TASK_ID} when two
     *                           tasks share an ID
     */
    public static void validate(List<Task> tasks) {
        Objects.requireNonNull(tasks, "tasks must not be null");

        List<String> errors = new ArrayList<>();
        for (int i = 0; i < tasks.size(); i++) {
            Task task = tasks.get(i);
            if (task.getId() == null || task.getId().isBlank()) {
                errors.add("Task at index " + i + " (" + task.getSource() + ") has no ID");
            }
            if (task.getQuery() == null || task.getQuery().isBlank()) {
                errors.add("Task '" + task.getId() + "' has an empty query");
            }
        }
        if (!errors.isEmpty()) {
            throw new OverseerException(ErrorKind.INVALID_CONFIGURATION,
                    "Invalid task definitions: " + String.join("; ", errors));
        }

        Map<String, Task> seen = new HashMap<>();
        for (Task task : tasks) {
            Task previous = seen.putIfAbsent(task.getId(), task);
            if (previous != null) {
                throw new OverseerException(ErrorKind.DUPLICATE_TASK_ID, "task ID is not unique")
                        .with("task_id", task.getId())
                        .with("first", previous.getSource())
                        .with("second", task.getSource());
            }
        }
    }
}
