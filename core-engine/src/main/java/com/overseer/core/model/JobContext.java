package com.overseer.core.model;

import com.overseer.core.error.ErrorKind;
import com.overseer.core.error.OverseerException;

import java.time.Duration;
import java.util.Objects;

/**
 * Explicit per-invocation context threaded through every call that needs the
 * job identity or the query deadline.
 *
 * <p>
 * Cancellation follows the thread's interrupt status: long-running steps call
 * {@link #checkCancelled()} between items and blocking collaborators are
 * expected to honour interruption.
 * </p>
 *
 * @since 1.0.0
 */
public final class JobContext {

    /** Deadline applied to a single query when none is configured. */
    public static final Duration DEFAULT_QUERY_TIMEOUT = Duration.ofMinutes(5);

    private final JobId jobId;
    private final Duration queryTimeout;

    public JobContext(JobId jobId) {
        this(jobId, DEFAULT_QUERY_TIMEOUT);
    }

    /**
     * @param jobId        job identity; must not be {@code null}
     * @param queryTimeout deadline for each query; must be positive
     * @throws IllegalArgumentException if {@code queryTimeout} is not positive
     */
    public JobContext(JobId jobId, Duration queryTimeout) {
        this.jobId = Objects.requireNonNull(jobId, "jobId must not be null");
        this.queryTimeout = Objects.requireNonNull(queryTimeout, "queryTimeout must not be null");
        if (queryTimeout.isNegative() || queryTimeout.isZero()) {
            throw new IllegalArgumentException("queryTimeout must be > 0, got: " + queryTimeout);
        }
    }

    public JobId getJobId() {
        return jobId;
    }

    public Duration getQueryTimeout() {
        return queryTimeout;
    }

    /**
     * @throws OverseerException with {@link ErrorKind#CANCELLED} if the current
     *                           thread has been interrupted
     */
    public void checkCancelled() {
        if (Thread.currentThread().isInterrupted()) {
            throw new OverseerException(ErrorKind.CANCELLED, "job was cancelled")
                    .with("job_id", jobId);
        }
    }

    @Override
    public String toString() {
        return "JobContext{jobId=" + jobId + ", queryTimeout=" + queryTimeout + '}';
    }
}
