package com.sentient.messaging;

import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Publishes canvas jobs to the artifact job queue.
 *
 * Dispatch is best effort: a stored plan stays valid without its canvas, so
 * failures are reported through the return value rather than thrown.
 *
 * Message Format:
 * - Payload: {@link ArtifactJobMessage} as JSON
 * - Exchange: sentient.exchange (direct)
 * - Routing Key: artifact.generate
 *
 * @see com.sentient.config.RabbitMQConfig
 * @see com.sentient.worker.ArtifactWorker
 */
@Component
@Slf4j
public class ArtifactJobDispatcher {

    private final RabbitTemplate rabbitTemplate;
    private final String exchange;
    private final String routingKey;

    public ArtifactJobDispatcher(
            RabbitTemplate rabbitTemplate,
            @Value("${app.rabbitmq.exchange:sentient.exchange}") String exchange,
            @Value("${app.rabbitmq.routing-key.artifact:artifact.generate}") String routingKey
    ) {
        this.rabbitTemplate = rabbitTemplate;
        this.exchange = exchange;
        this.routingKey = routingKey;
    }

    /**
     * Enqueue a canvas job.
     *
     * @param job the job to publish
     * @return true if the broker accepted the publish, false on any failure or missing configuration
     */
    public boolean enqueue(ArtifactJobMessage job) {
        if (exchange == null || exchange.isBlank() || routingKey == null || routingKey.isBlank()) {
            log.warn("Artifact job queue not configured, skipping canvas job: recordId={}", job.recordId());
            return false;
        }

        try {
            rabbitTemplate.convertAndSend(exchange, routingKey, job);
            log.info("Canvas job queued: recordId={}, emotion={}", job.recordId(), job.emotion());
            return true;
        } catch (AmqpException e) {
            log.error("Failed to queue canvas job: recordId={}, error={}", job.recordId(), e.getMessage());
            return false;
        }
    }
}
