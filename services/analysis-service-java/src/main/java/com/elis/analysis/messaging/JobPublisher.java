package com.elis.analysis.messaging;

import com.elis.analysis.model.JobKind;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.UUID;

@Service
public class JobPublisher {

    private final RabbitTemplate rabbitTemplate;
    private final MeterRegistry meterRegistry;

    public JobPublisher(RabbitTemplate rabbitTemplate, MeterRegistry meterRegistry) {
        this.rabbitTemplate = rabbitTemplate;
        this.meterRegistry = meterRegistry;
    }

    public void publishJob(UUID jobId, JobKind kind, int retryCount) {
        send(RabbitConfig.JOBS_QUEUE, new JobMessage(jobId, kind, retryCount), "immediate");
    }

    /**
     * Publishes to the delay queue of {@code delay}; the broker moves it onto the work queue later.
     */
    public void publishRetry(UUID jobId, JobKind kind, int retryCount, Duration delay) {
        send(RabbitConfig.delayQueueName(delay), new JobMessage(jobId, kind, retryCount), "delayed");
    }

    private void send(String queue, JobMessage message, String route) {
        try {
            rabbitTemplate.convertAndSend(queue, message);
            meterRegistry.counter("rabbitmq.publish.total", "outcome", "success", "route", route).increment();
        } catch (Exception e) {
            meterRegistry.counter("rabbitmq.publish.total", "outcome", "failure", "route", route).increment();
            throw e;
        }
    }
}
