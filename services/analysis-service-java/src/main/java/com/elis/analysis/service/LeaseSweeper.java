package com.elis.analysis.service;

import com.elis.analysis.config.QueueProperties;
import com.elis.analysis.model.FailureType;
import com.elis.analysis.model.Job;
import com.elis.analysis.model.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.AmqpException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Periodic recovery. PROCESSING jobs whose lease ran out go back to QUEUED with one more retry
 * used, or to FAILED when none are left. QUEUED jobs whose message never reached the broker
 * are published again once they are older than {@code redispatch-after}.
 */
@Component
public class LeaseSweeper {

    private static final Logger log = LoggerFactory.getLogger(LeaseSweeper.class);

    private final JobStateStore store;
    private final TaskQueueRuntime runtime;
    private final QueueProperties properties;

    public LeaseSweeper(JobStateStore store, TaskQueueRuntime runtime, QueueProperties properties) {
        this.store = store;
        this.runtime = runtime;
        this.properties = properties;
    }

    @Scheduled(fixedDelayString = "${elis.queue.sweep-interval:60s}",
            initialDelayString = "${elis.queue.sweep-interval:60s}")
    public void sweep() {
        int expired = reclaimExpiredLeases();
        int redispatched = redispatchStranded();
        if (expired > 0 || redispatched > 0) {
            log.info("Sweep reclaimed {} expired lease(s), redispatched {} queued job(s)", expired, redispatched);
        }
    }

    public int reclaimExpiredLeases() {
        int reclaimed = 0;
        for (Job job : store.findExpiredLeases()) {
            if (job.hasRetriesRemaining()) {
                int next = job.getRetryCount() + 1;
                boolean requeued = store.transition(job.getId(), Set.of(JobStatus.PROCESSING), JobStatus.QUEUED,
                        JobTransition.builder()
                                .requireLeaseExpired()
                                .expectRetryCount(job.getRetryCount())
                                .retryCount(next)
                                .statusMessage("Retry " + next + "/" + job.getMaxRetries() + ": worker lease expired")
                                .build());
                if (requeued) {
                    log.warn("Job {} lease held by {} expired, requeued as attempt {}", job.getId(), job.getLeaseOwner(), next);
                    job.setRetryCount(next);
                    publish(job);
                    reclaimed++;
                }
            } else {
                boolean failed = store.transition(job.getId(), Set.of(JobStatus.PROCESSING), JobStatus.FAILED,
                        JobTransition.builder()
                                .requireLeaseExpired()
                                .expectRetryCount(job.getRetryCount())
                                .failure(FailureType.TIMEOUT, "worker lease expired with no retries left")
                                .statusMessage("Failed")
                                .build());
                if (failed) {
                    log.warn("Job {} lease expired with no retries left, marked failed", job.getId());
                    reclaimed++;
                }
            }
        }
        return reclaimed;
    }

    public int redispatchStranded() {
        int redispatched = 0;
        for (Job job : store.findStrandedQueued(properties.redispatchAfter())) {
            // resets next_attempt_at so a failed publish is retried after another full interval
            boolean touched = store.transition(job.getId(), Set.of(JobStatus.QUEUED), JobStatus.QUEUED,
                    JobTransition.builder()
                            .expectRetryCount(job.getRetryCount())
                            .statusMessage(job.getStatusMessage())
                            .build());
            if (touched) {
                log.warn("Job {} queued since {} and never dispatched, redispatching", job.getId(), job.getNextAttemptAt());
                publish(job);
                redispatched++;
            }
        }
        return redispatched;
    }

    private void publish(Job job) {
        try {
            runtime.enqueue(job);
        } catch (AmqpException e) {
            log.error("Job {} could not be republished, will retry on next sweep", job.getId(), e);
        }
    }
}
