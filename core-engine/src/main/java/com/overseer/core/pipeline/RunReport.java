package com.overseer.core.pipeline;

import com.overseer.core.model.JobId;

import java.util.List;

/**
 * Outcome of a successful Run phase.
 */
public final class RunReport {

    private final JobId jobId;
    private final List<String> cachedTaskIds;

    public RunReport(JobId jobId, List<String> cachedTaskIds) {
        this.jobId = jobId;
        this.cachedTaskIds = List.copyOf(cachedTaskIds);
    }

    public JobId getJobId() {
        return jobId;
    }

    /**
     * @return IDs of the tasks whose results were cached, in selection order
     */
    public List<String> getCachedTaskIds() {
        return cachedTaskIds;
    }

    @Override
    public String toString() {
        return "RunReport{jobId=" + jobId + ", cachedTaskIds=" + cachedTaskIds + '}';
    }
}
