package com.elis.analysis.service;

import com.elis.analysis.model.FailureType;

import java.time.Duration;

/**
 * Extra preconditions and field updates for {@link JobStateStore#transition}. Timestamps are
 * never part of a transition; the store stamps them itself.
 */
public final class JobTransition {

    private static final JobTransition NONE = builder().build();

    private final Integer expectedRetryCount;
    private final boolean requireRetriesRemaining;
    private final String expectedLeaseOwner;
    private final boolean requireLeaseExpired;

    private final String statusMessage;
    private final Integer retryCount;
    private final String leaseOwner;
    private final Duration leaseDuration;
    private final Duration nextAttemptDelay;
    private final String error;
    private final FailureType failureType;
    private final String result;

    private JobTransition(Builder builder) {
        this.expectedRetryCount = builder.expectedRetryCount;
        this.requireRetriesRemaining = builder.requireRetriesRemaining;
        this.expectedLeaseOwner = builder.expectedLeaseOwner;
        this.requireLeaseExpired = builder.requireLeaseExpired;
        this.statusMessage = builder.statusMessage;
        this.retryCount = builder.retryCount;
        this.leaseOwner = builder.leaseOwner;
        this.leaseDuration = builder.leaseDuration;
        this.nextAttemptDelay = builder.nextAttemptDelay;
        this.error = builder.error;
        this.failureType = builder.failureType;
        this.result = builder.result;
    }

    public static JobTransition none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Integer expectedRetryCount() { return expectedRetryCount; }
    public boolean requireRetriesRemaining() { return requireRetriesRemaining; }
    public String expectedLeaseOwner() { return expectedLeaseOwner; }
    public boolean requireLeaseExpired() { return requireLeaseExpired; }
    public String statusMessage() { return statusMessage; }
    public Integer retryCount() { return retryCount; }
    public String leaseOwner() { return leaseOwner; }
    public Duration leaseDuration() { return leaseDuration; }
    public Duration nextAttemptDelay() { return nextAttemptDelay; }
    public String error() { return error; }
    public FailureType failureType() { return failureType; }
    public String result() { return result; }

    public static final class Builder {

        private Integer expectedRetryCount;
        private boolean requireRetriesRemaining;
        private String expectedLeaseOwner;
        private boolean requireLeaseExpired;
        private String statusMessage;
        private Integer retryCount;
        private String leaseOwner;
        private Duration leaseDuration;
        private Duration nextAttemptDelay;
        private String error;
        private FailureType failureType;
        private String result;

        private Builder() {}

        /** Only apply if the job is still on this attempt. */
        public Builder expectRetryCount(int retryCount) {
            this.expectedRetryCount = retryCount;
            return this;
        }

        /** A FAILED job only qualifies while {@code retry_count < max_retries}. */
        public Builder requireRetriesRemaining() {
            this.requireRetriesRemaining = true;
            return this;
        }

        public Builder expectLeaseOwner(String owner) {
            this.expectedLeaseOwner = owner;
            return this;
        }

        public Builder requireLeaseExpired() {
            this.requireLeaseExpired = true;
            return this;
        }

        public Builder statusMessage(String statusMessage) {
            this.statusMessage = statusMessage;
            return this;
        }

        public Builder retryCount(int retryCount) {
            this.retryCount = retryCount;
            return this;
        }

        public Builder lease(String owner, Duration duration) {
            this.leaseOwner = owner;
            this.leaseDuration = duration;
            return this;
        }

        public Builder nextAttemptIn(Duration delay) {
            this.nextAttemptDelay = delay;
            return this;
        }

        public Builder failure(FailureType failureType, String error) {
            this.failureType = failureType;
            this.error = error;
            return this;
        }

        public Builder result(String result) {
            this.result = result;
            return this;
        }

        public JobTransition build() {
            return new JobTransition(this);
        }
    }
}
