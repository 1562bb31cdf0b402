package com.overseer.core.selection;

import com.overseer.core.error.ErrorKind;
import com.overseer.core.error.OverseerException;
import com.overseer.core.model.Target;
import com.overseer.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Narrows the configured tasks down to those matching a {@link Target}.
 *
 * <p>
 * Pure and order-preserving: selected tasks keep their original relative
 * order. A non-empty target that matches none of a non-empty task list is
 * almost always a mistyped tag or ID, so it fails instead of silently
 * selecting nothing.
 * </p>
 *
 * @since 1.0.0
 */
public final class TargetSelector {

    private static final Logger LOG = LoggerFactory.getLogger(TargetSelector.class);

    private TargetSelector() {
        // utility class
    }

    /**
     * @param tasks  candidate tasks; must not be {@code null}
     * @param target selection criteria; must not be {@code null}
     * @return matching tasks in input order
     * @throws OverseerException {@link ErrorKind#INVALID_TARGET} for a
     *                           malformed target,
     *                           {@link ErrorKind#NO_TASKS_SELECTED} when a
     *                           non-empty target matches nothing
     */
    public static List<Task> select(List<Task> tasks, Target target) {
        Objects.requireNonNull(tasks, "tasks must not be null");
        Objects.requireNonNull(target, "target must not be null");

        target.validate();
        if (target.isEmpty()) {
            return List.copyOf(tasks);
        }

        List<Task> selected = tasks.stream()
                .filter(target::matches)
                .toList();

        if (selected.isEmpty() && !tasks.isEmpty()) {
            throw new OverseerException(ErrorKind.NO_TASKS_SELECTED, "no task matches the target")
                    .with("tags", target.getTags())
                    .with("ids", target.getIds())
                    .with("candidates", tasks.size());
        }

        LOG.debug("Selected {} of {} task(s) for {}", selected.size(), tasks.size(), target);
        return selected;
    }
}
