package com.overseer.core.pipeline;

import com.overseer.core.model.JobContext;
import com.overseer.core.model.QueryResult;
import com.overseer.core.model.Task;

/**
 * Executes one task's query against a data source.
 *
 * <p>
 * Implementations must honour {@link JobContext#getQueryTimeout()} and thread
 * interruption. Any exception is treated as a failure of that task alone and
 * is reported without interpretation.
 * </p>
 */
@FunctionalInterface
public interface QueryExecutor {

    /**
     * @param context job context carrying the query deadline
     * @param task    task whose query should run
     * @return the raw result
     */
    QueryResult execute(JobContext context, Task task);
}
