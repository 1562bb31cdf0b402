package com.overseer.core.pipeline;

import com.overseer.core.cache.JobCache;
import com.overseer.core.error.BatchFailureException;
import com.overseer.core.error.ErrorKind;
import com.overseer.core.error.ItemFailure;
import com.overseer.core.error.OverseerException;
import com.overseer.core.model.Alert;
import com.overseer.core.model.AlertBody;
import com.overseer.core.model.AlertFactory;
import com.overseer.core.model.CacheEntry;
import com.overseer.core.model.JobContext;
import com.overseer.core.policy.PolicyEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Eval phase: applies policy to every cached result of a job and dispatches
 * the resulting alerts.
 *
 * <h3>Steps per cache entry</h3>
 * <ol>
 * <li>Ask the {@link PolicyEvaluator} for alert candidates.</li>
 * <li>Construct an {@link Alert} for each candidate via
 * {@link AlertFactory}.</li>
 * <li>Hand each alert to the {@link AlertNotifier}.</li>
 * </ol>
 *
 * <p>
 * Entries are read one at a time by task ID. Failures in any step, including an
 * unreadable cache entry, are recorded with the task or alert ID and do not stop
 * the remaining work; a {@link BatchFailureException} is thrown once every
 * entry has been processed. Queries are never re-run here: the cache is the
 * only input.
 * </p>
 *
 * @since 1.0.0
 */
public class EvalOrchestrator {

    private static final Logger LOG = LoggerFactory.getLogger(EvalOrchestrator.class);

    private final JobCache cache;
    private final PolicyEvaluator policy;
    private final AlertNotifier notifier;
    private final AlertFactory alertFactory;

    public EvalOrchestrator(JobCache cache, PolicyEvaluator policy, AlertNotifier notifier,
            AlertFactory alertFactory) {
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        this.notifier = Objects.requireNonNull(notifier, "notifier must not be null");
        this.alertFactory = Objects.requireNonNull(alertFactory, "alertFactory must not be null");
    }

    /**
     * Evaluate every cache entry of the context's job.
     *
     * @param context job context; must not be {@code null}
     * @return counts and the alerts that were dispatched
     * @throws OverseerException      {@link ErrorKind#EMPTY_JOB_CACHE} if the
     *                                job has no cached results,
     *                                {@link ErrorKind#CANCELLED} on
     *                                interruption
     * @throws BatchFailureException if any entry, alert or dispatch failed
     */
    public EvalReport eval(JobContext context) {
        Objects.requireNonNull(context, "context must not be null");

        List<String> taskIds;
        try (Stream<String> ids = cache.taskIds(context.getJobId())) {
            taskIds = ids.toList();
        }
        if (taskIds.isEmpty()) {
            throw new OverseerException(ErrorKind.EMPTY_JOB_CACHE, "no cached results for job; run it first")
                    .with("job_id", context.getJobId());
        }

        List<ItemFailure> failures = new ArrayList<>();
        List<Alert> dispatched = new ArrayList<>();
        int entries = taskIds.size();

        for (String taskId : taskIds) {
            context.checkCancelled();
            Optional<CacheEntry> entry = readEntry(context, taskId, failures);
            if (entry.isEmpty()) {
                continue;
            }
            for (Alert alert : buildAlerts(context, entry.get(), failures)) {
                dispatch(alert, dispatched, failures);
            }
        }

        if (!failures.isEmpty()) {
            LOG.error("Eval for job={} finished with {} failure(s); {} alert(s) dispatched",
                    context.getJobId(), failures.size(), dispatched.size());
            throw new BatchFailureException("eval", failures);
        }

        LOG.info("Eval for job={} evaluated {} entr(ies), dispatched {} alert(s)",
                context.getJobId(), entries, dispatched.size());
        return new EvalReport(context.getJobId(), entries, dispatched);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private Optional<CacheEntry> readEntry(JobContext context, String taskId, List<ItemFailure> failures) {
        try {
            Optional<CacheEntry> entry = cache.get(context.getJobId(), taskId);
            if (entry.isEmpty()) {
                throw new OverseerException(ErrorKind.CACHE_IO_FAILED, "cache entry disappeared during eval")
                        .with("job_id", context.getJobId())
                        .with("task_id", taskId);
            }
            return entry;
        } catch (OverseerException e) {
            rethrowIfCancelled(e);
            LOG.warn("Could not read cached result of task [{}]: {}", taskId, e.getMessage());
            failures.add(new ItemFailure(taskId, e.getKind(), e));
            return Optional.empty();
        }
    }

    private List<Alert> buildAlerts(JobContext context, CacheEntry entry, List<ItemFailure> failures) {
        List<AlertBody> bodies;
        try {
            bodies = Objects.requireNonNull(policy.evaluate(entry), "policy returned null");
        } catch (OverseerException e) {
            rethrowIfCancelled(e);
            LOG.warn("Policy failed for task [{}]: {}", entry.getTaskId(), e.getMessage());
            failures.add(new ItemFailure(entry.getTaskId(), ErrorKind.POLICY_EVALUATION_FAILED, e));
            return List.of();
        } catch (RuntimeException e) {
            LOG.warn("Policy failed for task [{}]: {}", entry.getTaskId(), e.getMessage(), e);
            failures.add(new ItemFailure(entry.getTaskId(), ErrorKind.POLICY_EVALUATION_FAILED, e));
            return List.of();
        }

        LOG.debug("Task [{}] produced {} alert candidate(s)", entry.getTaskId(), bodies.size());
        List<Alert> alerts = new ArrayList<>();
        for (AlertBody body : bodies) {
            if (body == null) {
                LOG.warn("Policy returned a null alert candidate for task [{}]", entry.getTaskId());
                OverseerException e = new OverseerException(ErrorKind.POLICY_EVALUATION_FAILED,
                        "policy returned a null alert candidate").with("task_id", entry.getTaskId());
                failures.add(new ItemFailure(entry.getTaskId(), ErrorKind.POLICY_EVALUATION_FAILED, e));
                continue;
            }
            try {
                alerts.add(alertFactory.create(context, body));
            } catch (OverseerException e) {
                LOG.warn("Rejected alert candidate from task [{}]: {}", entry.getTaskId(), e.getMessage());
                failures.add(new ItemFailure(entry.getTaskId(), e.getKind(), e));
            }
        }
        return alerts;
    }

    private void dispatch(Alert alert, List<Alert> dispatched, List<ItemFailure> failures) {
        try {
            notifier.publish(alert);
            dispatched.add(alert);
            LOG.info("Alert dispatched: id={} title={}", alert.getId(), alert.getTitle());
        } catch (OverseerException e) {
            rethrowIfCancelled(e);
            LOG.warn("Failed to dispatch alert {}: {}", alert.getId(), e.getMessage());
            failures.add(new ItemFailure(alert.getId(), ErrorKind.ALERT_DISPATCH_FAILED, e));
        } catch (RuntimeException e) {
            LOG.warn("Failed to dispatch alert {}: {}", alert.getId(), e.getMessage(), e);
            failures.add(new ItemFailure(alert.getId(), ErrorKind.ALERT_DISPATCH_FAILED, e));
        }
    }

    private static void rethrowIfCancelled(OverseerException e) {
        if (e.getKind() == ErrorKind.CANCELLED) {
            throw e;
        }
    }
}
