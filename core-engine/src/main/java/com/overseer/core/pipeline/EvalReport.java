package com.overseer.core.pipeline;

import com.overseer.core.model.Alert;
import com.overseer.core.model.JobId;

import java.util.List;

/**
 * Outcome of a successful Eval phase.
 */
public final class EvalReport {

    private final JobId jobId;
    private final int entriesEvaluated;
    private final List<Alert> dispatchedAlerts;

    public EvalReport(JobId jobId, int entriesEvaluated, List<Alert> dispatchedAlerts) {
        this.jobId = jobId;
        this.entriesEvaluated = entriesEvaluated;
        this.dispatchedAlerts = List.copyOf(dispatchedAlerts);
    }

    public JobId getJobId() {
        return jobId;
    }

    public int getEntriesEvaluated() {
        return entriesEvaluated;
    }

    public List<Alert> getDispatchedAlerts() {
        return dispatchedAlerts;
    }

    @Override
    public String toString() {
        return "EvalReport{jobId=" + jobId
                + ", entriesEvaluated=" + entriesEvaluated
                + ", alerts=" + dispatchedAlerts.size() + '}';
    }
}
