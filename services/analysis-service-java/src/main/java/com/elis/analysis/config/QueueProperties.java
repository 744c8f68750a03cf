package com.elis.analysis.config;

import com.elis.analysis.tool.TimeLimits;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Task queue runtime settings.
 *
 * @param maxRetries      ceiling on re-attempts per job
 * @param baseRetryDelay  backoff for attempt {@code n} is {@code baseRetryDelay * 2^n}
 * @param softTimeLimit   tool is asked to stop
 * @param hardTimeLimit   tool is killed
 * @param teardownGrace   extra time the worker watchdog allows beyond the hard limit
 * @param leaseDuration   processing claim length; must outlast the hard limit
 * @param redispatchAfter queued jobs older than this are republished by the sweep
 * @param concurrency     consumers per process, each running one job at a time
 */
@ConfigurationProperties(prefix = "elis.queue")
public record QueueProperties(
        @DefaultValue("3") int maxRetries,
        @DefaultValue("60s") Duration baseRetryDelay,
        @DefaultValue("25m") Duration softTimeLimit,
        @DefaultValue("30m") Duration hardTimeLimit,
        @DefaultValue("2m") Duration teardownGrace,
        @DefaultValue("35m") Duration leaseDuration,
        @DefaultValue("10m") Duration redispatchAfter,
        @DefaultValue("1") int concurrency,
        @DefaultValue("true") boolean consumerEnabled
) {

    public QueueProperties {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("elis.queue.max-retries must not be negative");
        }
        if (concurrency < 1) {
            throw new IllegalArgumentException("elis.queue.concurrency must be at least 1");
        }
        if (leaseDuration.compareTo(hardTimeLimit.plus(teardownGrace)) <= 0) {
            throw new IllegalArgumentException("elis.queue.lease-duration must exceed hard-time-limit + teardown-grace");
        }
    }

    public TimeLimits timeLimits() {
        return new TimeLimits(softTimeLimit, hardTimeLimit);
    }

    public Duration watchdogLimit() {
        return hardTimeLimit.plus(teardownGrace);
    }
}
