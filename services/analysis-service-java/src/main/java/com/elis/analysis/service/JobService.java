package com.elis.analysis.service;

import com.elis.analysis.config.QueueProperties;
import com.elis.analysis.exception.ConfigurationException;
import com.elis.analysis.model.Job;
import com.elis.analysis.model.JobKind;
import com.elis.analysis.model.JobStatus;
import com.elis.analysis.model.SubjectType;
import com.elis.analysis.model.User;
import com.elis.analysis.repository.DocumentRepository;
import com.elis.analysis.repository.ImageRepository;
import com.elis.analysis.repository.JobRepository;
import com.elis.analysis.service.handler.JobKindHandlers;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.AmqpException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Entry points for request-handling code. Submission is decoupled from execution: once a job
 * is stored, any later failure shows up in its status, never as an error to the submitter.
 */
@Service
public class JobService {

    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    private final JobStateStore store;
    private final JobRepository jobRepository;
    private final DocumentRepository documentRepository;
    private final ImageRepository imageRepository;
    private final JobKindHandlers handlers;
    private final TaskQueueRuntime runtime;
    private final QueueProperties properties;
    private final ObjectMapper objectMapper;
    private final JobMetrics metrics;

    public JobService(JobStateStore store, JobRepository jobRepository, DocumentRepository documentRepository,
                      ImageRepository imageRepository, JobKindHandlers handlers, TaskQueueRuntime runtime,
                      QueueProperties properties, ObjectMapper objectMapper, JobMetrics metrics) {
        this.store = store;
        this.jobRepository = jobRepository;
        this.documentRepository = documentRepository;
        this.imageRepository = imageRepository;
        this.handlers = handlers;
        this.runtime = runtime;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
    }

    /**
     * Validates and stores a job, then hands it to the queue.
     *
     * @throws ResponseStatusException 400 for invalid options, 404 if the subject is not the user's
     */
    public Job submitJob(JobKind kind, UUID subjectId, User user, Map<String, String> options) {
        if (kind == null || subjectId == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "kind and subjectId are required");
        }
        return metrics.jobSubmissionTimer(kind).record(() -> {
            Map<String, String> normalized;
            try {
                normalized = handlers.forKind(kind).normalizeOptions(options);
            } catch (ConfigurationException e) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
            }
            requireOwnedSubject(kind.subjectType(), subjectId, user.getId());

            Job job = store.create(new Job(kind, subjectId, toJson(normalized), user, properties.maxRetries()));
            metrics.jobsSubmittedCounter(kind).increment();
            log.info("Job {} submitted: {} on {} {}", job.getId(), kind, kind.subjectType(), subjectId);
            dispatch(job);
            return job;
        });
    }

    /**
     * Current state of a job for polling. Empty if no such job exists.
     */
    public Optional<Job> getJobStatus(UUID jobId) {
        return store.get(jobId);
    }

    public Job getJob(UUID jobId, UUID userId) {
        return getJobStatus(jobId)
                .filter(job -> userId.equals(job.getUserId()))
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Job not found"));
    }

    public List<Job> listJobs(UUID userId) {
        return jobRepository.findByUser_IdOrderByCreatedAtDesc(userId);
    }

    /**
     * Requeues a FAILED job that has retries left, using up one of them.
     *
     * @throws ResponseStatusException 404 if not the user's job, 409 if it cannot be retried
     */
    public Job retryJob(UUID jobId, UUID userId) {
        Job job = getJob(jobId, userId);
        int next = job.getRetryCount() + 1;
        boolean requeued = job.getStatus() == JobStatus.FAILED && store.transition(jobId,
                Set.of(JobStatus.FAILED), JobStatus.QUEUED,
                JobTransition.builder()
                        .requireRetriesRemaining()
                        .expectRetryCount(job.getRetryCount())
                        .retryCount(next)
                        .statusMessage("Manual retry " + next + "/" + job.getMaxRetries())
                        .build());
        if (!requeued) {
            throw new ResponseStatusException(HttpStatus.CONFLICT,
                    "Job is " + job.getStatus() + " with " + job.getRetryCount() + "/" + job.getMaxRetries()
                            + " retries used and cannot be retried");
        }
        Job queued = store.get(jobId).orElseThrow();
        log.info("Job {} manually requeued as attempt {}", jobId, next);
        dispatch(queued);
        return queued;
    }

    private void dispatch(Job job) {
        try {
            runtime.enqueue(job);
        } catch (AmqpException e) {
            log.error("Job {} stored but not published; the redispatch sweep will publish it", job.getId(), e);
        }
    }

    private void requireOwnedSubject(SubjectType type, UUID subjectId, UUID userId) {
        boolean owned = switch (type) {
            case DOCUMENT -> documentRepository.findByIdAndUser_Id(subjectId, userId).isPresent();
            case IMAGE -> imageRepository.findByIdAndUser_Id(subjectId, userId).isPresent();
        };
        if (!owned) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND,
                    (type == SubjectType.DOCUMENT ? "Document" : "Image") + " not found");
        }
    }

    private String toJson(Map<String, String> options) {
        try {
            return objectMapper.writeValueAsString(options);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize job options", e);
        }
    }
}
