package com.elis.analysis.service;

import com.elis.analysis.model.JobStatus;

import java.util.UUID;

/**
 * What one delivery of a job amounted to. The queue runtime acts on {@link #retry()};
 * everything else is already persisted.
 */
public record ExecutionOutcome(UUID jobId, Disposition disposition, JobStatus status, RetryDecision retry) {

    public enum Disposition {
        /** Another worker owns the job, or it no longer exists. */
        SKIPPED,
        FINALIZED,
        RETRY_SCHEDULED
    }

    public static ExecutionOutcome skipped(UUID jobId) {
        return new ExecutionOutcome(jobId, Disposition.SKIPPED, null, null);
    }

    public static ExecutionOutcome finalized(UUID jobId, JobStatus status) {
        return new ExecutionOutcome(jobId, Disposition.FINALIZED, status, null);
    }

    public static ExecutionOutcome retryScheduled(UUID jobId, RetryDecision retry) {
        return new ExecutionOutcome(jobId, Disposition.RETRY_SCHEDULED, JobStatus.QUEUED, retry);
    }

    public boolean retryScheduled() {
        return disposition == Disposition.RETRY_SCHEDULED;
    }
}
