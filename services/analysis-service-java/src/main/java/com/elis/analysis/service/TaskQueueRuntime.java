package com.elis.analysis.service;

import com.elis.analysis.config.QueueProperties;
import com.elis.analysis.messaging.JobMessage;
import com.elis.analysis.messaging.JobPublisher;
import com.elis.analysis.model.Job;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.AmqpException;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Process-wide queue runtime shared by submission and consumption. Each delivery runs on the
 * worker pool, one job per worker; a worker still busy after the hard limit plus teardown
 * grace is interrupted and its attempt abandoned.
 */
@Service
public class TaskQueueRuntime {

    private static final Logger log = LoggerFactory.getLogger(TaskQueueRuntime.class);

    private final JobExecutor executor;
    private final JobPublisher publisher;
    private final JobStateStore store;
    private final QueueProperties properties;
    private final ExecutorService workers;

    public TaskQueueRuntime(JobExecutor executor, JobPublisher publisher, JobStateStore store,
                            QueueProperties properties) {
        this.executor = executor;
        this.publisher = publisher;
        this.store = store;
        this.properties = properties;
        this.workers = Executors.newFixedThreadPool(properties.concurrency(),
                new CustomizableThreadFactory("elis-worker-"));
    }

    /**
     * Publishes the first (or manually retried) attempt of a job.
     *
     * @throws AmqpException if the broker rejects the message; the job stays QUEUED for the sweep
     */
    public void enqueue(Job job) {
        publisher.publishJob(job.getId(), job.getKind(), job.getRetryCount());
        store.markDispatched(job.getId(), job.getRetryCount());
        log.info("Job {} enqueued for attempt {}", job.getId(), job.getRetryCount());
    }

    /**
     * Runs one delivery to completion and schedules the retry it asks for. Returns only once the
     * job's state for this delivery is persisted.
     */
    public ExecutionOutcome execute(JobMessage message) {
        String leaseOwner = JobExecutor.newLeaseOwner();
        Future<ExecutionOutcome> future = workers.submit(() -> executor.execute(message, leaseOwner));
        ExecutionOutcome outcome;
        try {
            outcome = future.get(properties.watchdogLimit().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.error("Job {} still running after {}, abandoning attempt", message.jobId(), properties.watchdogLimit());
            outcome = executor.abandon(message, leaseOwner,
                    "worker did not finish within " + properties.watchdogLimit());
        } catch (ExecutionException e) {
            throw new IllegalStateException("Job " + message.jobId() + " execution failed", e.getCause());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while running job " + message.jobId(), e);
        }

        if (outcome.retryScheduled()) {
            scheduleRetry(message, outcome.retry());
        }
        return outcome;
    }

    private void scheduleRetry(JobMessage message, RetryDecision decision) {
        try {
            publisher.publishRetry(message.jobId(), message.kind(), decision.nextRetryCount(), decision.delay());
            store.markDispatched(message.jobId(), decision.nextRetryCount());
            log.info("Job {} attempt {} scheduled in {}", message.jobId(), decision.nextRetryCount(), decision.delay());
        } catch (AmqpException e) {
            log.error("Job {} retry could not be published; the redispatch sweep will pick it up", message.jobId(), e);
        }
    }

    @PreDestroy
    public void shutdown() {
        workers.shutdownNow();
    }
}
