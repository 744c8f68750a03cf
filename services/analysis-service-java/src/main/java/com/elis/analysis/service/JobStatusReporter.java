package com.elis.analysis.service;

import java.util.UUID;

/**
 * Progress channel the executor reports through while a job runs.
 */
public interface JobStatusReporter {

    /**
     * Records {@code message} for a job the caller holds the lease of. Never throws.
     */
    void report(UUID jobId, String leaseOwner, String message);
}
