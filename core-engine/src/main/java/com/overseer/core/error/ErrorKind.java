package com.overseer.core.error;

/**
 * Classification of every failure the pipeline reports.
 *
 * <p>
 * Fail-fast kinds ({@link #INVALID_TARGET}, {@link #NO_TASKS_SELECTED},
 * {@link #EMPTY_JOB_CACHE}) are raised before any I/O is attempted. Per-item
 * kinds ({@link #TASK_EXECUTION_FAILED}, {@link #POLICY_EVALUATION_FAILED},
 * {@link #ALERT_DISPATCH_FAILED} and the alert construction kinds) are
 * collected by the orchestrators and reported together as
 * {@link #BATCH_FAILED}.
 * </p>
 *
 * @since 1.0.0
 */
public enum ErrorKind {

    INVALID_TARGET,
    NO_TASKS_SELECTED,
    NO_TASKS_CONFIGURED,
    DUPLICATE_TASK_ID,
    INVALID_JOB_ID,
    INVALID_CONFIGURATION,

    MISSING_TITLE,
    MALFORMED_TIMESTAMP,
    UNSUPPORTED_TIMESTAMP_TYPE,
    UNSUPPORTED_ALERT_VERSION,

    DUPLICATE_CACHE_KEY,
    EMPTY_JOB_CACHE,
    CACHE_IO_FAILED,

    TASK_EXECUTION_FAILED,
    POLICY_EVALUATION_FAILED,
    ALERT_DISPATCH_FAILED,

    CANCELLED,
    BATCH_FAILED
}
