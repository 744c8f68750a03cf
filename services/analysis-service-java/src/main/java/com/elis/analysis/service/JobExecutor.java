package com.elis.analysis.service;

import com.elis.analysis.config.QueueProperties;
import com.elis.analysis.exception.ConfigurationException;
import com.elis.analysis.exception.ToolUnavailableException;
import com.elis.analysis.messaging.JobMessage;
import com.elis.analysis.model.FailureType;
import com.elis.analysis.model.Job;
import com.elis.analysis.model.JobStatus;
import com.elis.analysis.service.handler.JobKindHandler;
import com.elis.analysis.service.handler.JobKindHandlers;
import com.elis.analysis.service.handler.PreparedInvocation;
import com.elis.analysis.service.handler.ToolOutcome;
import com.elis.analysis.tool.InvocationResult;
import com.elis.analysis.tool.ToolInvoker;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Runs one delivery of a job: claim, invoke the kind's tool, classify, persist. Every exit
 * path leaves the job either terminal, requeued for a later attempt, or untouched because
 * another worker owns it.
 */
@Service
public class JobExecutor {

    private static final Logger log = LoggerFactory.getLogger(JobExecutor.class);

    private static final String WORKER_ID = ManagementFactory.getRuntimeMXBean().getName();
    private static final TypeReference<Map<String, String>> OPTIONS_TYPE = new TypeReference<>() {};

    private final JobStateStore store;
    private final JobKindHandlers handlers;
    private final ToolInvoker invoker;
    private final OutcomeClassifier classifier;
    private final RetryPolicy retryPolicy;
    private final JobStatusReporter reporter;
    private final WorkspaceStorage storage;
    private final QueueProperties properties;
    private final ObjectMapper objectMapper;
    private final JobMetrics metrics;

    public JobExecutor(JobStateStore store, JobKindHandlers handlers, ToolInvoker invoker,
                       OutcomeClassifier classifier, RetryPolicy retryPolicy, JobStatusReporter reporter,
                       WorkspaceStorage storage, QueueProperties properties, ObjectMapper objectMapper,
                       JobMetrics metrics) {
        this.store = store;
        this.handlers = handlers;
        this.invoker = invoker;
        this.classifier = classifier;
        this.retryPolicy = retryPolicy;
        this.reporter = reporter;
        this.storage = storage;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
    }

    public static String newLeaseOwner() {
        return WORKER_ID + "/" + UUID.randomUUID();
    }

    public ExecutionOutcome execute(JobMessage message) {
        return execute(message, newLeaseOwner());
    }

    public ExecutionOutcome execute(JobMessage message, String leaseOwner) {
        UUID jobId = message.jobId();
        Optional<Job> found = store.get(jobId);
        if (found.isEmpty()) {
            log.warn("Job {} not found, dropping delivery", jobId);
            return ExecutionOutcome.skipped(jobId);
        }
        Job job = found.get();

        boolean claimed = store.transition(jobId, JobStatus.CLAIMABLE, JobStatus.PROCESSING,
                JobTransition.builder()
                        .expectRetryCount(message.retryCount())
                        .lease(leaseOwner, properties.leaseDuration())
                        .statusMessage("Starting " + job.getKind().label() + attemptSuffix(message.retryCount(), job))
                        .build());
        if (!claimed) {
            log.info("Job {} attempt {} already handled elsewhere, skipping", jobId, message.retryCount());
            return ExecutionOutcome.skipped(jobId);
        }
        log.info("Job {} claimed by {} for attempt {}", jobId, leaseOwner, message.retryCount());

        Timer.Sample sample = Timer.start();
        try {
            return run(job, message.retryCount(), leaseOwner);
        } catch (RuntimeException e) {
            log.error("Job {} failed unexpectedly", jobId, e);
            return recoverFromUnexpected(job, message.retryCount(), leaseOwner, e);
        } finally {
            sample.stop(metrics.jobExecutionTimer(job.getKind()));
        }
    }

    /**
     * Gives up on an attempt whose worker no longer responds. The attempt is treated as timed out.
     */
    public ExecutionOutcome abandon(JobMessage message, String leaseOwner, String reason) {
        Job job = store.get(message.jobId()).orElse(null);
        if (job == null) {
            return ExecutionOutcome.skipped(message.jobId());
        }
        log.warn("Job {} abandoned by {}: {}", job.getId(), leaseOwner, reason);
        return retryOrFail(job, message.retryCount(), leaseOwner, FailureType.TIMEOUT, reason);
    }

    private ExecutionOutcome run(Job job, int retryCount, String leaseOwner) {
        JobKindHandler handler = handlers.forKind(job.getKind());

        PreparedInvocation prepared;
        try {
            prepared = handler.prepare(job, parseOptions(job.getParams()));
        } catch (ConfigurationException e) {
            log.warn("Job {} rejected: {}", job.getId(), e.getMessage());
            return finalizeFailed(job, leaseOwner, FailureType.CONFIGURATION, e.getMessage());
        }

        Path outputDir;
        try {
            outputDir = storage.prepareJobOutput(job.getUserId(), job.getId());
        } catch (IOException e) {
            log.warn("Job {} could not prepare its output directory", job.getId(), e);
            return retryOrFail(job, retryCount, leaseOwner, FailureType.INFRASTRUCTURE,
                    "cannot prepare output directory: " + e.getMessage());
        }

        reporter.report(job.getId(), leaseOwner, "Running " + prepared.tool().name());
        InvocationResult invocation;
        try {
            invocation = invoker.invoke(prepared.tool(), prepared.inputs(), prepared.options(),
                    outputDir, properties.timeLimits());
        } catch (ConfigurationException e) {
            log.warn("Job {} rejected by tool invoker: {}", job.getId(), e.getMessage());
            return finalizeFailed(job, leaseOwner, FailureType.CONFIGURATION, e.getMessage());
        } catch (ToolUnavailableException e) {
            log.warn("Job {} could not start {}: {}", job.getId(), e.getTool(), e.getMessage());
            return retryOrFail(job, retryCount, leaseOwner, FailureType.INFRASTRUCTURE, e.getMessage());
        }

        if (invocation.timedOut()) {
            log.warn("Job {} timed out: {}", job.getId(), invocation.message());
            return retryOrFail(job, retryCount, leaseOwner, FailureType.TIMEOUT, invocation.message());
        }

        ToolOutcome outcome = handler.interpret(job, prepared, invocation);
        JobStatus status = classifier.classify(outcome);
        if (status == JobStatus.FAILED) {
            return finalizeFailed(job, leaseOwner, FailureType.TOOL_REPORTED, outcome.summary());
        }

        reporter.report(job.getId(), leaseOwner, "Saving results");
        Map<String, Object> extra = Map.of();
        try {
            extra = handler.materialize(job, outcome);
        } catch (RuntimeException e) {
            log.error("Job {} could not save derived records", job.getId(), e);
            outcome = outcome.withError("failed to save results: " + e.getMessage());
            status = JobStatus.COMPLETED_WITH_ERRORS;
        }

        Map<String, Object> result = new LinkedHashMap<>(outcome.toResult());
        result.putAll(extra);
        String message = status == JobStatus.COMPLETED
                ? "Completed"
                : "Completed with " + outcome.errors().size() + " error(s)";
        return finalizeCompleted(job, leaseOwner, status, message, result);
    }

    private ExecutionOutcome retryOrFail(Job job, int retryCount, String leaseOwner,
                                         FailureType failureType, String reason) {
        RetryDecision decision = retryPolicy.decide(retryCount, job.getMaxRetries());
        if (!decision.retry()) {
            return finalizeFailed(job, leaseOwner, failureType,
                    reason + " (gave up after " + retryCount + " retries)");
        }

        String statusMessage = String.format("Retry %d/%d in %ds: %s",
                decision.nextRetryCount(), job.getMaxRetries(), decision.delay().toSeconds(), reason);
        boolean requeued = store.transition(job.getId(), Set.of(JobStatus.PROCESSING), JobStatus.QUEUED,
                JobTransition.builder()
                        .expectLeaseOwner(leaseOwner)
                        .retryCount(decision.nextRetryCount())
                        .nextAttemptIn(decision.delay())
                        .statusMessage(statusMessage)
                        .build());
        if (!requeued) {
            log.warn("Job {} lease lost before it could be requeued", job.getId());
            return ExecutionOutcome.skipped(job.getId());
        }
        metrics.jobRetriesCounter(job.getKind(), failureType).increment();
        log.warn("Job {} {}", job.getId(), statusMessage);
        return ExecutionOutcome.retryScheduled(job.getId(), decision);
    }

    private ExecutionOutcome finalizeFailed(Job job, String leaseOwner, FailureType failureType, String error) {
        boolean applied = store.transition(job.getId(), Set.of(JobStatus.PROCESSING), JobStatus.FAILED,
                JobTransition.builder()
                        .expectLeaseOwner(leaseOwner)
                        .failure(failureType, error)
                        .statusMessage("Failed")
                        .build());
        return finished(job, applied, JobStatus.FAILED, error);
    }

    private ExecutionOutcome finalizeCompleted(Job job, String leaseOwner, JobStatus status, String message,
                                               Map<String, Object> result) {
        String json;
        try {
            json = objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize result of job " + job.getId(), e);
        }
        boolean applied = store.transition(job.getId(), Set.of(JobStatus.PROCESSING), status,
                JobTransition.builder()
                        .expectLeaseOwner(leaseOwner)
                        .result(json)
                        .statusMessage(message)
                        .build());
        return finished(job, applied, status, message);
    }

    private ExecutionOutcome finished(Job job, boolean applied, JobStatus status, String detail) {
        if (!applied) {
            log.warn("Job {} lease lost before it could be finalized as {}", job.getId(), status);
            return ExecutionOutcome.skipped(job.getId());
        }
        metrics.jobsFinishedCounter(job.getKind(), status).increment();
        if (status == JobStatus.FAILED) {
            log.warn("Job {} failed: {}", job.getId(), detail);
        } else {
            log.info("Job {} finished as {}", job.getId(), status);
        }
        return ExecutionOutcome.finalized(job.getId(), status);
    }

    private ExecutionOutcome recoverFromUnexpected(Job job, int retryCount, String leaseOwner, RuntimeException cause) {
        String reason = "unexpected error: " + cause.getMessage();
        try {
            return retryOrFail(job, retryCount, leaseOwner, FailureType.INFRASTRUCTURE, reason);
        } catch (RuntimeException e) {
            log.error("Job {} could not be rescheduled, marking it failed", job.getId(), e);
        }
        try {
            store.transition(job.getId(), Set.of(JobStatus.PROCESSING), JobStatus.FAILED,
                    JobTransition.builder()
                            .expectLeaseOwner(leaseOwner)
                            .failure(FailureType.INFRASTRUCTURE, reason)
                            .statusMessage("System error")
                            .build());
        } catch (RuntimeException e) {
            log.error("Job {} final failure write failed", job.getId(), e);
        }
        return ExecutionOutcome.finalized(job.getId(), JobStatus.FAILED);
    }

    private Map<String, String> parseOptions(String params) throws ConfigurationException {
        if (params == null || params.isBlank()) {
            return Map.of();
        }
        try {
            Map<String, String> options = objectMapper.readValue(params, OPTIONS_TYPE);
            return options == null ? Map.of() : options;
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("params", "stored options are not a JSON object of strings");
        }
    }

    private static String attemptSuffix(int retryCount, Job job) {
        return retryCount == 0 ? "" : " (retry " + retryCount + "/" + job.getMaxRetries() + ")";
    }
}
