package com.overseer.core.pipeline;

import com.overseer.core.cache.JobCache;
import com.overseer.core.error.BatchFailureException;
import com.overseer.core.error.ErrorKind;
import com.overseer.core.error.ItemFailure;
import com.overseer.core.error.OverseerException;
import com.overseer.core.model.JobContext;
import com.overseer.core.model.QueryResult;
import com.overseer.core.model.Target;
import com.overseer.core.model.Task;
import com.overseer.core.model.Tasks;
import com.overseer.core.selection.TargetSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Run phase: executes the selected tasks' queries and caches their results.
 *
 * <h3>Failure policy</h3>
 * <p>
 * A failing task does not stop the others. Every selected task is attempted;
 * if any failed, a {@link BatchFailureException} naming each failed task is
 * thrown at the end. Target and selection errors fail fast before any query
 * runs.
 * </p>
 *
 * <h3>Concurrency</h3>
 * <p>
 * Tasks run on a fixed pool of at most {@code parallelism} threads. Results
 * are collected by the calling thread only. Interrupting the calling thread
 * cancels in-flight queries and fails the batch with
 * {@link ErrorKind#CANCELLED}.
 * </p>
 *
 * @since 1.0.0
 */
public class RunOrchestrator {

    private static final Logger LOG = LoggerFactory.getLogger(RunOrchestrator.class);

    private final QueryExecutor queryExecutor;
    private final JobCache cache;
    private final int parallelism;

    /**
     * @param queryExecutor query capability; must not be {@code null}
     * @param cache         cache to write results into; must not be
     *                      {@code null}
     * @param parallelism   maximum number of concurrent queries; must be
     *                      &gt;= 1
     * @throws IllegalArgumentException if {@code parallelism} is below 1
     */
    public RunOrchestrator(QueryExecutor queryExecutor, JobCache cache, int parallelism) {
        this.queryExecutor = Objects.requireNonNull(queryExecutor, "queryExecutor must not be null");
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
        }
        this.parallelism = parallelism;
    }

    /**
     * Execute the tasks selected by {@code target} and cache their results
     * under the context's job ID.
     *
     * @param context job context; must not be {@code null}
     * @param tasks   configured tasks; must not be {@code null}
     * @param target  selection criteria; must not be {@code null}
     * @return IDs of the cached tasks
     * @throws OverseerException      {@link ErrorKind#DUPLICATE_TASK_ID},
     *                                {@link ErrorKind#INVALID_TARGET},
     *                                {@link ErrorKind#NO_TASKS_SELECTED} or
     *                                {@link ErrorKind#CANCELLED}
     * @throws BatchFailureException if one or more tasks failed
     */
    public RunReport run(JobContext context, List<Task> tasks, Target target) {
        Objects.requireNonNull(context, "context must not be null");
        Tasks.validate(tasks);

        List<Task> selected = TargetSelector.select(tasks, target);
        if (selected.isEmpty()) {
            throw new OverseerException(ErrorKind.NO_TASKS_SELECTED, "no task to run")
                    .with("job_id", context.getJobId());
        }
        context.checkCancelled();

        LOG.info("Running {} task(s) for job={} with parallelism={}",
                selected.size(), context.getJobId(), Math.min(parallelism, selected.size()));

        ExecutorService pool = Executors.newFixedThreadPool(
                Math.min(parallelism, selected.size()), workerThreadFactory());
        List<Future<Optional<ItemFailure>>> futures = new ArrayList<>();
        try {
            for (Task task : selected) {
                futures.add(pool.submit(() -> runTask(context, task)));
            }

            List<ItemFailure> failures = new ArrayList<>();
            List<String> cached = new ArrayList<>();
            for (int i = 0; i < selected.size(); i++) {
                Optional<ItemFailure> failure = await(context, futures, i);
                if (failure.isPresent()) {
                    failures.add(failure.get());
                } else {
                    cached.add(selected.get(i).getId());
                }
            }

            if (!failures.isEmpty()) {
                LOG.error("Run for job={} finished with {} failed task(s) of {}",
                        context.getJobId(), failures.size(), selected.size());
                throw new BatchFailureException("run", failures);
            }

            LOG.info("Run for job={} cached {} result(s)", context.getJobId(), cached.size());
            return new RunReport(context.getJobId(), cached);
        } finally {
            pool.shutdownNow();
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private Optional<ItemFailure> runTask(JobContext context, Task task) {
        try {
            context.checkCancelled();
            long start = System.nanoTime();
            QueryResult result = queryExecutor.execute(context, task);
            cache.put(context.getJobId(), task.getId(), result);
            LOG.info("Task [{}] cached {} row(s) in {} ms",
                    task.getId(), result.size(), (System.nanoTime() - start) / 1_000_000);
            return Optional.empty();
        } catch (OverseerException e) {
            if (e.getKind() == ErrorKind.CANCELLED) {
                throw e;
            }
            return Optional.of(taskFailure(task, e));
        } catch (RuntimeException e) {
            return Optional.of(taskFailure(task, e));
        }
    }

    private static ItemFailure taskFailure(Task task, RuntimeException cause) {
        LOG.warn("Task [{}] failed: {}", task.getId(), cause.getMessage(), cause);
        return new ItemFailure(task.getId(), ErrorKind.TASK_EXECUTION_FAILED, cause);
    }

    private static Optional<ItemFailure> await(JobContext context,
            List<Future<Optional<ItemFailure>>> futures, int index) {
        try {
            return futures.get(index).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            futures.forEach(f -> f.cancel(true));
            throw new OverseerException(ErrorKind.CANCELLED, "run was cancelled", e)
                    .with("job_id", context.getJobId());
        } catch (ExecutionException e) {
            futures.forEach(f -> f.cancel(true));
            if (e.getCause() instanceof OverseerException oe && oe.getKind() == ErrorKind.CANCELLED) {
                throw oe;
            }
            // runTask converts every RuntimeException; anything else is a fault
            throw new IllegalStateException("Task worker failed unexpectedly", e.getCause());
        }
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "overseer-run-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
