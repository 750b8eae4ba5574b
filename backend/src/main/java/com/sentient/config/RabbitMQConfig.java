package com.sentient.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.*;
import org.springframework.amqp.rabbit.config.SimpleRabbitListenerContainerFactory;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitAdmin;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.amqp.support.converter.MessageConverter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * RabbitMQ configuration for the two pipeline stages.
 *
 * Architecture:
 * - Exchange: sentient.exchange (direct)
 * - Stream Queue: reflection.stream.queue, routing key reflection.ingest.
 *   Consumed in batches by ReflectionStreamConsumer.
 * - Job Queue: artifact.jobs.queue, routing key artifact.generate.
 *   Polled by ArtifactWorker.
 * - Retry Queue: artifact.jobs.retry, routing key artifact.retry.
 *
 * Redelivery:
 * A canvas job rejected by the worker dead-letters into the retry queue. The
 * retry queue has no consumers; once the message TTL expires it dead-letters
 * back into the job queue, so a failed job becomes visible again after the
 * configured delay.
 *
 * @see com.sentient.messaging.ReflectionStreamConsumer
 * @see com.sentient.worker.RabbitJobQueue
 */
@Configuration
@Slf4j
public class RabbitMQConfig {

    @Value("${app.rabbitmq.exchange:sentient.exchange}")
    private String exchange;

    @Value("${app.rabbitmq.queue.stream:reflection.stream.queue}")
    private String streamQueue;

    @Value("${app.rabbitmq.queue.artifact:artifact.jobs.queue}")
    private String artifactQueue;

    @Value("${app.rabbitmq.queue.artifact-retry:artifact.jobs.retry}")
    private String artifactRetryQueue;

    @Value("${app.rabbitmq.routing-key.stream:reflection.ingest}")
    private String streamRoutingKey;

    @Value("${app.rabbitmq.routing-key.artifact:artifact.generate}")
    private String artifactRoutingKey;

    @Value("${app.rabbitmq.routing-key.artifact-retry:artifact.retry}")
    private String artifactRetryRoutingKey;

    @Value("${app.rabbitmq.artifact-retry-delay-ms:30000}")
    private long artifactRetryDelayMs;

    @Value("${app.rabbitmq.queue.max-length:10000}")
    private int queueMaxLength;

    @Value("${app.stream.batch-size:10}")
    private int streamBatchSize;

    @Value("${app.stream.receive-timeout-ms:1000}")
    private long streamReceiveTimeoutMs;

    /**
     * JSON message converter backed by the application ObjectMapper.
     *
     * @param objectMapper Spring-managed mapper
     * @return converter for canvas job messages
     */
    @Bean
    public MessageConverter jsonMessageConverter(ObjectMapper objectMapper) {
        log.debug("Configuring Jackson2JsonMessageConverter for RabbitMQ");
        return new Jackson2JsonMessageConverter(objectMapper);
    }

    /**
     * Configure RabbitTemplate with JSON message converter, publisher confirms and returns.
     *
     * @param connectionFactory the RabbitMQ connection factory
     * @param jsonMessageConverter the JSON converter
     * @return configured RabbitTemplate
     */
    @Bean
    public RabbitTemplate rabbitTemplate(ConnectionFactory connectionFactory, MessageConverter jsonMessageConverter) {
        RabbitTemplate rabbitTemplate = new RabbitTemplate(connectionFactory);
        rabbitTemplate.setMessageConverter(jsonMessageConverter);
        rabbitTemplate.setMandatory(true);

        rabbitTemplate.setConfirmCallback((correlationData, ack, cause) -> {
            if (ack) {
                log.debug("Message published successfully to RabbitMQ");
            } else {
                log.error("Failed to publish message to RabbitMQ: {}", cause);
            }
        });

        rabbitTemplate.setReturnsCallback(returned ->
                log.error("Message returned from RabbitMQ - Exchange: {}, RoutingKey: {}, ReplyText: {}",
                        returned.getExchange(),
                        returned.getRoutingKey(),
                        returned.getReplyText()));

        log.info("RabbitTemplate configured with JSON message converter and publisher confirms");
        return rabbitTemplate;
    }

    /**
     * Batch listener container for the stream stage.
     *
     * Single consumer, records delivered as a {@code List<Message>} of up to
     * {@code app.stream.batch-size}. A partial batch is released after
     * {@code app.stream.receive-timeout-ms} without new records.
     *
     * @param connectionFactory the RabbitMQ connection factory
     * @return container factory referenced by ReflectionStreamConsumer
     */
    @Bean
    public SimpleRabbitListenerContainerFactory streamBatchContainerFactory(ConnectionFactory connectionFactory) {
        log.info("Configuring stream batch listener: batchSize={}, receiveTimeoutMs={}",
                streamBatchSize, streamReceiveTimeoutMs);

        SimpleRabbitListenerContainerFactory factory = new SimpleRabbitListenerContainerFactory();
        factory.setConnectionFactory(connectionFactory);
        factory.setBatchListener(true);
        factory.setConsumerBatchEnabled(true);
        factory.setBatchSize(streamBatchSize);
        factory.setPrefetchCount(streamBatchSize);
        factory.setReceiveTimeout(streamReceiveTimeoutMs);
        factory.setConcurrentConsumers(1);
        factory.setMaxConcurrentConsumers(1);
        return factory;
    }

    @Bean
    public DirectExchange sentientExchange() {
        log.info("Configuring direct exchange: {} (durable=true)", exchange);
        return new DirectExchange(exchange, true, false);
    }

    @Bean
    public Queue reflectionStreamQueue() {
        log.info("Configuring queue: {} (durable=true, maxLength={})", streamQueue, queueMaxLength);
        return QueueBuilder.durable(streamQueue)
                .withArgument("x-max-length", queueMaxLength)
                .build();
    }

    /**
     * Job queue; rejected jobs dead-letter into the retry queue.
     */
    @Bean
    public Queue artifactJobQueue() {
        log.info("Configuring queue: {} (durable=true, maxLength={}, retryQueue={})",
                artifactQueue, queueMaxLength, artifactRetryQueue);
        return QueueBuilder.durable(artifactQueue)
                .withArgument("x-max-length", queueMaxLength)
                .withArgument("x-dead-letter-exchange", exchange)
                .withArgument("x-dead-letter-routing-key", artifactRetryRoutingKey)
                .build();
    }

    /**
     * Delay queue; expired messages dead-letter back into the job queue.
     */
    @Bean
    public Queue artifactRetryQueue() {
        log.info("Configuring retry queue: {} (durable=true, delayMs={})", artifactRetryQueue, artifactRetryDelayMs);
        return QueueBuilder.durable(artifactRetryQueue)
                .withArgument("x-message-ttl", artifactRetryDelayMs)
                .withArgument("x-dead-letter-exchange", exchange)
                .withArgument("x-dead-letter-routing-key", artifactRoutingKey)
                .build();
    }

    @Bean
    public Binding reflectionStreamBinding() {
        log.debug("Binding queue {} to exchange {} with routing key {}", streamQueue, exchange, streamRoutingKey);
        return BindingBuilder.bind(reflectionStreamQueue()).to(sentientExchange()).with(streamRoutingKey);
    }

    @Bean
    public Binding artifactJobBinding() {
        log.debug("Binding queue {} to exchange {} with routing key {}", artifactQueue, exchange, artifactRoutingKey);
        return BindingBuilder.bind(artifactJobQueue()).to(sentientExchange()).with(artifactRoutingKey);
    }

    @Bean
    public Binding artifactRetryBinding() {
        log.debug("Binding queue {} to exchange {} with routing key {}",
                artifactRetryQueue, exchange, artifactRetryRoutingKey);
        return BindingBuilder.bind(artifactRetryQueue()).to(sentientExchange()).with(artifactRetryRoutingKey);
    }

    /**
     * Declares exchanges, queues, and bindings on startup.
     *
     * @param connectionFactory the RabbitMQ connection factory
     * @return RabbitAdmin for automatic declaration
     */
    @Bean
    public AmqpAdmin amqpAdmin(ConnectionFactory connectionFactory) {
        log.info("Configuring AmqpAdmin for automatic queue/exchange declaration");
        return new RabbitAdmin(connectionFactory);
    }
}
