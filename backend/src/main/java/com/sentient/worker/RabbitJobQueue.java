package com.sentient.worker;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.GetResponse;
import com.rabbitmq.client.ShutdownSignalException;
import com.sentient.exception.ProcessingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.rabbit.connection.Connection;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * {@link JobQueue} over a RabbitMQ queue using basic.get on a dedicated channel.
 *
 * Settlement:
 * <ul>
 *   <li>acknowledge: basic.ack</li>
 *   <li>retryLater: basic.reject without requeue, dead-lettered to the retry queue</li>
 *   <li>release: basic.nack with requeue, visible again immediately</li>
 * </ul>
 *
 * Delivery tags belong to the channel that received them, so all calls must
 * come from the worker thread. If the channel is lost, unsettled jobs are
 * redelivered by the broker and a new channel is opened on the next poll.
 */
@Component
@Slf4j
public class RabbitJobQueue implements JobQueue, DisposableBean {

    private final ConnectionFactory connectionFactory;
    private final String queueName;
    private final Duration pollInterval;

    private Connection connection;
    private Channel channel;

    public RabbitJobQueue(
            ConnectionFactory connectionFactory,
            @Value("${app.rabbitmq.queue.artifact:artifact.jobs.queue}") String queueName,
            @Value("${app.worker.poll-interval-ms:200}") long pollIntervalMs
    ) {
        this.connectionFactory = connectionFactory;
        this.queueName = queueName;
        this.pollInterval = Duration.ofMillis(pollIntervalMs);
    }

    @Override
    public synchronized List<QueuedJob> receive(int maxJobs, Duration waitTime) {
        long deadline = System.nanoTime() + waitTime.toNanos();
        List<QueuedJob> jobs = new ArrayList<>();

        try {
            Channel current = channel();
            while (jobs.size() < maxJobs) {
                GetResponse response = current.basicGet(queueName, false);
                if (response != null) {
                    jobs.add(new QueuedJob(
                            response.getEnvelope().getDeliveryTag(),
                            response.getBody(),
                            response.getEnvelope().isRedeliver()));
                    continue;
                }
                if (!jobs.isEmpty() || System.nanoTime() >= deadline) {
                    break;
                }
                Thread.sleep(pollInterval.toMillis());
            }
        } catch (IOException | AmqpException | ShutdownSignalException e) {
            closeChannel();
            throw ProcessingException.queueUnavailable(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        return jobs;
    }

    @Override
    public synchronized void acknowledge(QueuedJob job) {
        try {
            channel().basicAck(job.deliveryTag(), false);
        } catch (IOException | AmqpException | ShutdownSignalException e) {
            closeChannel();
            throw ProcessingException.queueUnavailable(e);
        }
    }

    @Override
    public synchronized void retryLater(QueuedJob job) {
        try {
            channel().basicReject(job.deliveryTag(), false);
        } catch (IOException | AmqpException | ShutdownSignalException e) {
            closeChannel();
            throw ProcessingException.queueUnavailable(e);
        }
    }

    @Override
    public synchronized void release(QueuedJob job) {
        try {
            channel().basicNack(job.deliveryTag(), false, true);
        } catch (IOException | AmqpException | ShutdownSignalException e) {
            closeChannel();
            throw ProcessingException.queueUnavailable(e);
        }
    }

    @Override
    public synchronized void destroy() {
        closeChannel();
    }

    private Channel channel() {
        if (channel == null || !channel.isOpen()) {
            if (connection == null || !connection.isOpen()) {
                connection = connectionFactory.createConnection();
            }
            channel = connection.createChannel(false);
            log.info("Opened channel for artifact job queue: {}", queueName);
        }
        return channel;
    }

    private void closeChannel() {
        if (channel != null && channel.isOpen()) {
            try {
                channel.close();
            } catch (IOException | TimeoutException | RuntimeException e) {
                log.debug("Ignoring error while closing job channel: {}", e.getMessage());
            }
        }
        channel = null;
    }
}
