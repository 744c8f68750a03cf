package com.elis.analysis.service;

import com.elis.analysis.config.QueueProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Exponential backoff: the attempt that ran with {@code retry_count = n} is retried after
 * {@code base * 2^n}, as long as {@code n + 1} stays within the job's retry ceiling.
 */
@Component
public class RetryPolicy {

    private final Duration baseDelay;

    public RetryPolicy(QueueProperties properties) {
        this.baseDelay = properties.baseRetryDelay();
    }

    public RetryDecision decide(int retryCount, int maxRetries) {
        int next = retryCount + 1;
        if (next > maxRetries) {
            return RetryDecision.giveUp(retryCount);
        }
        return RetryDecision.retryAfter(delayFor(retryCount), next);
    }

    public Duration delayFor(int retryCount) {
        return baseDelay.multipliedBy(1L << retryCount);
    }
}
