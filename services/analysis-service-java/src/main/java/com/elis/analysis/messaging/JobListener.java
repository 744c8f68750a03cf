package com.elis.analysis.messaging;

import com.elis.analysis.service.TaskQueueRuntime;
import com.rabbitmq.client.Channel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.amqp.support.AmqpHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Consumes the work queue. The delivery is acked after the runtime returns, so a worker that
 * dies mid-job leaves it unacked and the broker redelivers it.
 */
@Component
public class JobListener {

    private static final Logger log = LoggerFactory.getLogger(JobListener.class);

    private final TaskQueueRuntime runtime;

    public JobListener(TaskQueueRuntime runtime) {
        this.runtime = runtime;
    }

    @RabbitListener(queues = RabbitConfig.JOBS_QUEUE, containerFactory = "jobListenerContainerFactory")
    public void onMessage(JobMessage message, Channel channel,
                          @Header(AmqpHeaders.DELIVERY_TAG) long deliveryTag) throws IOException {
        try {
            runtime.execute(message);
            channel.basicAck(deliveryTag, false);
        } catch (RuntimeException e) {
            log.error("Job {} delivery failed, requeueing", message.jobId(), e);
            channel.basicNack(deliveryTag, false, true);
        }
    }
}
