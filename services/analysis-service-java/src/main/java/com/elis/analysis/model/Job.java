package com.elis.analysis.model;

import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "jobs", indexes = {
        @Index(name = "idx_jobs_status_lease", columnList = "status, lease_expires_at"),
        @Index(name = "idx_jobs_subject", columnList = "subject_id")
})
public class Job {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", nullable = false)
    private User user;

    @Column(name = "user_id", insertable = false, updatable = false)
    private UUID userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private JobKind kind;

    @Column(name = "subject_id", nullable = false)
    private UUID subjectId;

    // JSON object of tool options as submitted
    @Column(columnDefinition = "TEXT")
    private String params;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private JobStatus status = JobStatus.QUEUED;

    @Column(name = "retry_count", nullable = false)
    private int retryCount;

    @Column(name = "max_retries", nullable = false)
    private int maxRetries;

    @Column(name = "status_message")
    private String statusMessage;

    @Column(columnDefinition = "TEXT")
    private String error;

    @Enumerated(EnumType.STRING)
    @Column(name = "failure_type")
    private FailureType failureType;

    // JSON payload built from the tool outcome
    @Column(columnDefinition = "TEXT")
    private String result;

    @Column(name = "lease_owner")
    private String leaseOwner;

    @Column(name = "lease_expires_at")
    private Instant leaseExpiresAt;

    @Column(name = "next_attempt_at")
    private Instant nextAttemptAt;

    /** Set once the current attempt's message is on the broker; cleared whenever the job is requeued. */
    @Column(name = "dispatched_at")
    private Instant dispatchedAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @CreationTimestamp
    private Instant createdAt;

    private Instant updatedAt;

    public Job() {}

    public Job(JobKind kind, UUID subjectId, String params, User user, int maxRetries) {
        this.kind = kind;
        this.subjectId = subjectId;
        this.params = params;
        this.user = user;
        this.maxRetries = maxRetries;
    }

    public UUID getId() { return id; }
    public User getUser() { return user; }
    public UUID getUserId() { return userId != null ? userId : user != null ? user.getId() : null; }
    public JobKind getKind() { return kind; }
    public UUID getSubjectId() { return subjectId; }
    public String getParams() { return params; }
    public JobStatus getStatus() { return status; }
    public int getRetryCount() { return retryCount; }
    public int getMaxRetries() { return maxRetries; }
    public String getStatusMessage() { return statusMessage; }
    public String getError() { return error; }
    public FailureType getFailureType() { return failureType; }
    public String getResult() { return result; }
    public String getLeaseOwner() { return leaseOwner; }
    public Instant getLeaseExpiresAt() { return leaseExpiresAt; }
    public Instant getNextAttemptAt() { return nextAttemptAt; }
    public Instant getDispatchedAt() { return dispatchedAt; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getCompletedAt() { return completedAt; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }

    public boolean hasRetriesRemaining() { return retryCount < maxRetries; }

    public void setId(UUID id) { this.id = id; }
    public void setUser(User user) { this.user = user; }
    public void setKind(JobKind kind) { this.kind = kind; }
    public void setSubjectId(UUID subjectId) { this.subjectId = subjectId; }
    public void setParams(String params) { this.params = params; }
    public void setStatus(JobStatus status) { this.status = status; }
    public void setRetryCount(int retryCount) { this.retryCount = retryCount; }
    public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
    public void setStatusMessage(String statusMessage) { this.statusMessage = statusMessage; }
    public void setError(String error) { this.error = error; }
    public void setFailureType(FailureType failureType) { this.failureType = failureType; }
    public void setResult(String result) { this.result = result; }
    public void setLeaseOwner(String leaseOwner) { this.leaseOwner = leaseOwner; }
    public void setLeaseExpiresAt(Instant leaseExpiresAt) { this.leaseExpiresAt = leaseExpiresAt; }
    public void setNextAttemptAt(Instant nextAttemptAt) { this.nextAttemptAt = nextAttemptAt; }
    public void setDispatchedAt(Instant dispatchedAt) { this.dispatchedAt = dispatchedAt; }
    public void setStartedAt(Instant startedAt) { this.startedAt = startedAt; }
    public void setCompletedAt(Instant completedAt) { this.completedAt = completedAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
