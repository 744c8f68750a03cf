package com.elis.analysis.messaging;

import com.elis.analysis.config.QueueProperties;
import org.springframework.amqp.core.AcknowledgeMode;
import org.springframework.amqp.core.Declarable;
import org.springframework.amqp.core.Declarables;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.amqp.rabbit.config.SimpleRabbitListenerContainerFactory;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.amqp.support.converter.MessageConverter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Work queue plus one delay queue per backoff tier. A retry is published to the tier's delay
 * queue; when its TTL runs out the message is dead-lettered back onto the work queue.
 */
@Configuration
public class RabbitConfig {

    public static final String JOBS_QUEUE = "elis.jobs";
    public static final String DELAY_QUEUE_PREFIX = "elis.jobs.delay.";

    @Bean
    public Queue jobsQueue() {
        return new Queue(JOBS_QUEUE, true);
    }

    @Bean
    public Declarables retryDelayQueues(QueueProperties properties) {
        List<Declarable> queues = new ArrayList<>();
        for (int attempt = 0; attempt < properties.maxRetries(); attempt++) {
            Duration delay = properties.baseRetryDelay().multipliedBy(1L << attempt);
            queues.add(QueueBuilder.durable(delayQueueName(delay))
                    .ttl(Math.toIntExact(delay.toMillis()))
                    .deadLetterExchange("")
                    .deadLetterRoutingKey(JOBS_QUEUE)
                    .build());
        }
        return new Declarables(queues);
    }

    public static String delayQueueName(Duration delay) {
        return DELAY_QUEUE_PREFIX + delay.toMillis();
    }

    @Bean
    public MessageConverter jsonMessageConverter() {
        return new Jackson2JsonMessageConverter();
    }

    /**
     * Manual acks with prefetch 1: a worker holds one unacknowledged job at a time and acks
     * it only once execution returned.
     */
    @Bean
    public SimpleRabbitListenerContainerFactory jobListenerContainerFactory(
            ConnectionFactory connectionFactory, MessageConverter jsonMessageConverter, QueueProperties properties) {
        var factory = new SimpleRabbitListenerContainerFactory();
        factory.setConnectionFactory(connectionFactory);
        factory.setMessageConverter(jsonMessageConverter);
        factory.setAcknowledgeMode(AcknowledgeMode.MANUAL);
        factory.setPrefetchCount(1);
        factory.setConcurrentConsumers(properties.concurrency());
        factory.setMaxConcurrentConsumers(properties.concurrency());
        factory.setAutoStartup(properties.consumerEnabled());
        return factory;
    }
}
