package com.sentient.messaging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sentient.exception.ProcessingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageBuilder;
import org.springframework.amqp.core.MessageDeliveryMode;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Publishes reflections onto the stream queue in the stream record wire format.
 *
 * The body is base64 text so records published here and records arriving
 * from other producers decode the same way in {@link StreamRecordDecoder}.
 *
 * @see ReflectionStreamConsumer
 */
@Component
@Slf4j
public class ReflectionStreamProducer {

    private final RabbitTemplate rabbitTemplate;
    private final ObjectMapper objectMapper;
    private final String exchange;
    private final String routingKey;

    public ReflectionStreamProducer(
            RabbitTemplate rabbitTemplate,
            ObjectMapper objectMapper,
            @Value("${app.rabbitmq.exchange:sentient.exchange}") String exchange,
            @Value("${app.rabbitmq.routing-key.stream:reflection.ingest}") String routingKey
    ) {
        this.rabbitTemplate = rabbitTemplate;
        this.objectMapper = objectMapper;
        this.exchange = exchange;
        this.routingKey = routingKey;
    }

    /**
     * Publish one reflection.
     *
     * @param text reflection text
     * @param userId submitting user
     * @return request id assigned to the published record
     * @throws ProcessingException if the broker is unavailable
     */
    public String publish(String text, String userId) {
        String requestId = UUID.randomUUID().toString();

        Map<String, String> payload = new LinkedHashMap<>();
        payload.put("text", text);
        payload.put("userId", userId);

        byte[] body;
        try {
            String json = objectMapper.writeValueAsString(payload);
            body = Base64.getEncoder().encode(json.getBytes(StandardCharsets.UTF_8));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Reflection cannot be serialized", e);
        }

        Message message = MessageBuilder.withBody(body)
                .setContentType(MessageProperties.CONTENT_TYPE_TEXT_PLAIN)
                .setContentEncoding(StandardCharsets.US_ASCII.name())
                .setMessageId(requestId)
                .setDeliveryMode(MessageDeliveryMode.PERSISTENT)
                .build();

        log.debug("Publishing reflection: requestId={}, exchange={}, routingKey={}", requestId, exchange, routingKey);

        try {
            rabbitTemplate.send(exchange, routingKey, message);
        } catch (AmqpException e) {
            log.error("Failed to publish reflection: requestId={}, userId={}, error={}",
                    requestId, userId, e.getMessage(), e);
            throw ProcessingException.queueUnavailable(e);
        }

        log.info("Reflection queued: requestId={}, userId={}", requestId, userId);
        return requestId;
    }
}
