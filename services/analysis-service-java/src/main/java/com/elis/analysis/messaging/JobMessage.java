package com.elis.analysis.messaging;

import com.elis.analysis.model.JobKind;

import java.util.UUID;

/**
 * One execution request. {@code retryCount} names the attempt; a delivery for an attempt the
 * job has already moved past is dropped by the executor.
 */
public record JobMessage(UUID jobId, JobKind kind, int retryCount) {
}
