package com.elis.analysis.model;

import java.util.EnumSet;
import java.util.Set;

public enum JobStatus {
    QUEUED,
    PROCESSING,
    COMPLETED,
    COMPLETED_WITH_ERRORS,
    FAILED;

    /**
     * Statuses a worker may claim from. FAILED is final for workers; only a user retry
     * puts the job back to QUEUED.
     */
    public static final Set<JobStatus> CLAIMABLE = EnumSet.of(QUEUED);

    public boolean carriesResult() {
        return this == COMPLETED || this == COMPLETED_WITH_ERRORS;
    }
}
