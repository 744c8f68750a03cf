package com.elis.analysis.dto;

import com.elis.analysis.model.FailureType;
import com.elis.analysis.model.Job;
import com.elis.analysis.model.JobKind;
import com.elis.analysis.model.JobStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Instant;
import java.util.UUID;

public record JobResponse(UUID id, JobKind kind, UUID subjectId, JsonNode options, JobStatus status,
                          String statusMessage, int retryCount, int maxRetries, String error,
                          FailureType failureType, JsonNode result, Instant startedAt,
                          Instant completedAt, Instant createdAt, Instant updatedAt) {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static JobResponse from(Job job) {
        return new JobResponse(
                job.getId(),
                job.getKind(),
                job.getSubjectId(),
                parse(job.getParams()),
                job.getStatus(),
                job.getStatusMessage(),
                job.getRetryCount(),
                job.getMaxRetries(),
                job.getError(),
                job.getFailureType(),
                parse(job.getResult()),
                job.getStartedAt(),
                job.getCompletedAt(),
                job.getCreatedAt(),
                job.getUpdatedAt()
        );
    }

    private static JsonNode parse(String json) {
        if (json == null) {
            return null;
        }
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored job JSON is malformed", e);
        }
    }
}
