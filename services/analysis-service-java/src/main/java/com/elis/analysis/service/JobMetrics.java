package com.elis.analysis.service;

import com.elis.analysis.model.FailureType;
import com.elis.analysis.model.JobKind;
import com.elis.analysis.model.JobStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Locale;

@Component
public class JobMetrics {

    private final MeterRegistry registry;

    public JobMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public Counter jobsSubmittedCounter(JobKind kind) {
        return Counter.builder("jobs.submitted.total")
                .tag("kind", tag(kind))
                .description("Total jobs submitted by kind")
                .register(registry);
    }

    public Timer jobSubmissionTimer(JobKind kind) {
        return Timer.builder("jobs.submitted.seconds")
                .tag("kind", tag(kind))
                .description("Job submission latency by kind")
                .publishPercentileHistogram(true)
                .register(registry);
    }

    public Counter jobsFinishedCounter(JobKind kind, JobStatus status) {
        return Counter.builder("jobs.finished.total")
                .tag("kind", tag(kind))
                .tag("status", status.name().toLowerCase(Locale.ROOT))
                .description("Jobs reaching a terminal status")
                .register(registry);
    }

    public Counter jobRetriesCounter(JobKind kind, FailureType cause) {
        return Counter.builder("jobs.retries.total")
                .tag("kind", tag(kind))
                .tag("cause", cause.name().toLowerCase(Locale.ROOT))
                .description("Attempts rescheduled after a retryable failure")
                .register(registry);
    }

    public Timer jobExecutionTimer(JobKind kind) {
        return Timer.builder("jobs.execution.seconds")
                .tag("kind", tag(kind))
                .description("Wall time of one execution attempt")
                .publishPercentileHistogram(true)
                .register(registry);
    }

    private static String tag(JobKind kind) {
        return kind.name().toLowerCase(Locale.ROOT);
    }
}
