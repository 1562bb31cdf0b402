package com.overseer.core.error;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Aggregate error reported after a whole batch has been attempted and at
 * least one item failed.
 *
 * <p>
 * The message lists every failure on its own line so that the command-line
 * surface can print it verbatim.
 * </p>
 *
 * @since 1.0.0
 */
public class BatchFailureException extends OverseerException {

    private static final long serialVersionUID = 1L;

    private final String phase;
    private final transient List<ItemFailure> failures;

    /**
     * @param phase    name of the phase that failed, e.g. {@code run}
     * @param failures collected failures; must not be empty
     * @throws IllegalArgumentException if {@code failures} is empty
     */
    public BatchFailureException(String phase, List<ItemFailure> failures) {
        super(ErrorKind.BATCH_FAILED, describe(phase, failures));
        this.phase = phase;
        this.failures = Collections.unmodifiableList(new ArrayList<>(failures));
    }

    public String getPhase() {
        return phase;
    }

    public List<ItemFailure> getFailures() {
        return failures;
    }

    private static String describe(String phase, List<ItemFailure> failures) {
        Objects.requireNonNull(failures, "failures must not be null");
        if (failures.isEmpty()) {
            throw new IllegalArgumentException("A batch failure needs at least one item failure");
        }
        StringBuilder sb = new StringBuilder()
                .append(phase).append(" finished with ").append(failures.size()).append(" failure(s):");
        for (ItemFailure failure : failures) {
            sb.append("\n  - ").append(failure);
        }
        return sb.toString();
    }
}
