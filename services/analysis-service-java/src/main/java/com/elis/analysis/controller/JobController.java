package com.elis.analysis.controller;

import com.elis.analysis.dto.JobResponse;
import com.elis.analysis.dto.SubmitJobRequest;
import com.elis.analysis.model.User;
import com.elis.analysis.service.IdempotencyService;
import com.elis.analysis.service.JobService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@RestController
@RequestMapping("/jobs")
public class JobController {

    private final JobService jobService;
    private final ObjectMapper objectMapper;
    private final IdempotencyService idempotencyService;

    public JobController(JobService jobService, ObjectMapper objectMapper,
                         IdempotencyService idempotencyService) {
        this.jobService = jobService;
        this.objectMapper = objectMapper;
        this.idempotencyService = idempotencyService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public JobResponse submitJob(@RequestBody SubmitJobRequest request,
                                 @AuthenticationPrincipal User user,
                                 HttpServletRequest httpRequest) {
        Optional<String> idempotencyKey = idempotencyService.extractKey(httpRequest);
        if (idempotencyKey.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Invalid or missing Idempotency-Key header");
        }

        String userId = user.getId().toString();
        String cached = idempotencyService.get(userId, idempotencyKey.get());
        if (cached == null) {
            if (!idempotencyService.reserve(userId, idempotencyKey.get())) {
                throw new ResponseStatusException(HttpStatus.CONFLICT, "Job is being submitted");
            }
            JobResponse response;
            try {
                var job = jobService.submitJob(request.kind(), request.subjectId(), user, request.options());
                response = JobResponse.from(job);
            } catch (RuntimeException e) {
                idempotencyService.release(userId, idempotencyKey.get());
                throw e;
            }
            try {
                idempotencyService.store(userId, idempotencyKey.get(), objectMapper.writeValueAsString(response));
            } catch (JsonProcessingException e) {
                throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to cache response");
            }
            return response;
        } else if (IdempotencyService.IN_PROGRESS.equals(cached)) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "Job is being submitted");
        } else {
            try {
                return objectMapper.readValue(cached, JobResponse.class);
            } catch (JsonProcessingException e) {
                throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to parse cached response");
            }
        }
    }

    @GetMapping("/{id}")
    public JobResponse getJob(@PathVariable UUID id,
                              @AuthenticationPrincipal User user) {
        return JobResponse.from(jobService.getJob(id, user.getId()));
    }

    @GetMapping
    public List<JobResponse> listJobs(@AuthenticationPrincipal User user) {
        return jobService.listJobs(user.getId())
                .stream()
                .map(JobResponse::from)
                .toList();
    }

    @PostMapping("/{id}/retry")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public JobResponse retryJob(@PathVariable UUID id,
                                @AuthenticationPrincipal User user) {
        return JobResponse.from(jobService.retryJob(id, user.getId()));
    }
}
