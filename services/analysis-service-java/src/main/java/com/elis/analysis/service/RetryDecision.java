package com.elis.analysis.service;

import java.time.Duration;

/**
 * Whether a failed attempt gets another try, and when.
 *
 * @param nextRetryCount retry count the next attempt runs with; unchanged when {@code retry} is false
 */
public record RetryDecision(boolean retry, Duration delay, int nextRetryCount) {

    public static RetryDecision retryAfter(Duration delay, int nextRetryCount) {
        return new RetryDecision(true, delay, nextRetryCount);
    }

    public static RetryDecision giveUp(int retryCount) {
        return new RetryDecision(false, Duration.ZERO, retryCount);
    }
}
