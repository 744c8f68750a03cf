package com.elis.analysis.service;

import com.elis.analysis.config.QueueProperties;
import com.elis.analysis.model.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.UUID;

/**
 * Writes progress to the job's status message and extends the reporter's lease on the way.
 * A report from a worker that lost its lease changes nothing.
 */
@Component
public class LeaseRenewingStatusReporter implements JobStatusReporter {

    private static final Logger log = LoggerFactory.getLogger(LeaseRenewingStatusReporter.class);

    private final JobStateStore store;
    private final QueueProperties properties;

    public LeaseRenewingStatusReporter(JobStateStore store, QueueProperties properties) {
        this.store = store;
        this.properties = properties;
    }

    @Override
    public void report(UUID jobId, String leaseOwner, String message) {
        try {
            boolean applied = store.transition(jobId, Set.of(JobStatus.PROCESSING), JobStatus.PROCESSING,
                    JobTransition.builder()
                            .expectLeaseOwner(leaseOwner)
                            .lease(leaseOwner, properties.leaseDuration())
                            .statusMessage(message)
                            .build());
            if (!applied) {
                log.warn("Job {} progress '{}' dropped: lease no longer held by {}", jobId, message, leaseOwner);
            }
        } catch (RuntimeException e) {
            log.error("Job {} failed to record progress '{}'", jobId, message, e);
        }
    }
}
