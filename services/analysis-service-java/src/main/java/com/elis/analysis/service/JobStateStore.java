package com.elis.analysis.service;

import com.elis.analysis.model.FailureType;
import com.elis.analysis.model.Job;
import com.elis.analysis.model.JobStatus;
import com.elis.analysis.repository.JobRepository;
import jakarta.persistence.EntityManager;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaUpdate;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Persistence of job records. {@link #transition} is the only way a stored job changes status
 * and the only coordination point between workers: it is a single conditional UPDATE, so of
 * two workers racing on the same job exactly one sees {@code true}.
 */
@Service
public class JobStateStore {

    private static final Logger log = LoggerFactory.getLogger(JobStateStore.class);

    private final JobRepository jobRepository;
    private final EntityManager entityManager;
    private final Clock clock;

    public JobStateStore(JobRepository jobRepository, EntityManager entityManager, Clock clock) {
        this.jobRepository = jobRepository;
        this.entityManager = entityManager;
        this.clock = clock;
    }

    @Transactional
    public Job create(Job job) {
        job.setStatus(JobStatus.QUEUED);
        job.setRetryCount(0);
        job.setNextAttemptAt(clock.instant());
        job.setUpdatedAt(clock.instant());
        job.setStatusMessage("Queued");
        return jobRepository.save(job);
    }

    /**
     * Absent when no such job exists; a found job may still be in its initial QUEUED state.
     */
    @Transactional(readOnly = true)
    public Optional<Job> get(UUID jobId) {
        return jobRepository.findById(jobId);
    }

    /**
     * Moves a job to {@code to} if its current status is in {@code from} and every guard in
     * {@code fields} holds. Keeps {@code result} and {@code error} mutually exclusive: only
     * FAILED carries an error, only COMPLETED and COMPLETED_WITH_ERRORS carry a result.
     *
     * @return false when the precondition did not hold; nothing was written
     */
    @Transactional
    public boolean transition(UUID jobId, Set<JobStatus> from, JobStatus to, JobTransition fields) {
        Instant now = clock.instant();
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaUpdate<Job> update = cb.createCriteriaUpdate(Job.class);
        Root<Job> job = update.from(Job.class);

        update.set(job.<JobStatus>get("status"), to);
        update.set(job.<Instant>get("updatedAt"), now);
        if (fields.statusMessage() != null) {
            update.set(job.<String>get("statusMessage"), fields.statusMessage());
        }
        if (fields.retryCount() != null) {
            update.set(job.<Integer>get("retryCount"), fields.retryCount());
        }

        switch (to) {
            case PROCESSING -> {
                update.set(job.<Instant>get("startedAt"), cb.coalesce(job.<Instant>get("startedAt"), now));
                update.set(job.<String>get("leaseOwner"), fields.leaseOwner());
                update.set(job.<Instant>get("leaseExpiresAt"), now.plus(fields.leaseDuration()));
                update.set(job.<Instant>get("nextAttemptAt"), cb.nullLiteral(Instant.class));
            }
            case QUEUED -> {
                Duration delay = fields.nextAttemptDelay() != null ? fields.nextAttemptDelay() : Duration.ZERO;
                update.set(job.<Instant>get("nextAttemptAt"), now.plus(delay));
                update.set(job.<Instant>get("completedAt"), cb.nullLiteral(Instant.class));
                update.set(job.<Instant>get("dispatchedAt"), cb.nullLiteral(Instant.class));
                clearLease(cb, update, job);
            }
            default -> {
                update.set(job.<Instant>get("completedAt"), now);
                update.set(job.<Instant>get("nextAttemptAt"), cb.nullLiteral(Instant.class));
                clearLease(cb, update, job);
            }
        }

        if (to == JobStatus.FAILED) {
            update.set(job.<String>get("error"), fields.error());
            update.set(job.<FailureType>get("failureType"), fields.failureType());
            update.set(job.<String>get("result"), cb.nullLiteral(String.class));
        } else if (to.carriesResult()) {
            update.set(job.<String>get("result"), fields.result());
            update.set(job.<String>get("error"), cb.nullLiteral(String.class));
            update.set(job.<FailureType>get("failureType"), cb.nullLiteral(FailureType.class));
        } else {
            update.set(job.<String>get("result"), cb.nullLiteral(String.class));
            update.set(job.<String>get("error"), cb.nullLiteral(String.class));
            update.set(job.<FailureType>get("failureType"), cb.nullLiteral(FailureType.class));
        }

        List<Predicate> where = new ArrayList<>();
        where.add(cb.equal(job.get("id"), jobId));
        where.add(job.get("status").in(from));
        if (fields.expectedRetryCount() != null) {
            where.add(cb.equal(job.get("retryCount"), fields.expectedRetryCount()));
        }
        if (fields.retryCount() != null) {
            where.add(cb.greaterThanOrEqualTo(job.<Integer>get("maxRetries"), fields.retryCount()));
        }
        if (fields.requireRetriesRemaining()) {
            where.add(cb.or(
                    cb.notEqual(job.get("status"), JobStatus.FAILED),
                    cb.lessThan(job.<Integer>get("retryCount"), job.<Integer>get("maxRetries"))));
        }
        if (fields.expectedLeaseOwner() != null) {
            where.add(cb.equal(job.get("leaseOwner"), fields.expectedLeaseOwner()));
        }
        if (fields.requireLeaseExpired()) {
            where.add(cb.lessThan(job.<Instant>get("leaseExpiresAt"), now));
        }
        update.where(where.toArray(new Predicate[0]));

        boolean applied = entityManager.createQuery(update).executeUpdate() == 1;
        if (applied) {
            log.debug("Job {} moved to {}", jobId, to);
        } else {
            log.debug("Job {} not moved to {}: precondition failed", jobId, to);
        }
        return applied;
    }

    /**
     * Records that attempt {@code retryCount} of a job has a message on the broker. A no-op once a
     * worker has claimed that attempt or the job has moved on.
     */
    @Transactional
    public boolean markDispatched(UUID jobId, int retryCount) {
        return jobRepository.markDispatched(jobId, JobStatus.QUEUED, retryCount, clock.instant()) == 1;
    }

    @Transactional(readOnly = true)
    public List<Job> findExpiredLeases() {
        return jobRepository.findByStatusAndLeaseExpiresAtBefore(JobStatus.PROCESSING, clock.instant());
    }

    /**
     * Queued jobs whose current attempt was never confirmed on the broker. A dispatched job
     * waiting behind a backlog is not stranded, however old it is.
     */
    @Transactional(readOnly = true)
    public List<Job> findStrandedQueued(Duration olderThan) {
        return jobRepository.findByStatusAndDispatchedAtIsNullAndNextAttemptAtBefore(
                JobStatus.QUEUED, clock.instant().minus(olderThan));
    }

    private static void clearLease(CriteriaBuilder cb, CriteriaUpdate<Job> update, Root<Job> job) {
        update.set(job.<String>get("leaseOwner"), cb.nullLiteral(String.class));
        update.set(job.<Instant>get("leaseExpiresAt"), cb.nullLiteral(Instant.class));
    }
}
