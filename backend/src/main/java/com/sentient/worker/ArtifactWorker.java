package com.sentient.worker;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Long-running canvas worker.
 *
 * Runs on its own thread, started and stopped with the application context:
 * <pre>
 * POLLING -> PROCESSING -> (ACK | RETRY) -> POLLING
 * </pre>
 * <ul>
 *   <li>POLLING: long-poll up to {@code max-jobs}; pause briefly when nothing
 *   arrives, back off longer when the queue cannot be reached.</li>
 *   <li>PROCESSING: jobs run one at a time. A job is acknowledged only after
 *   its canvas is stored and its record back-filled; on failure it is sent
 *   to the retry queue. If a job cannot be settled the rest of the batch is
 *   abandoned to broker redelivery.</li>
 *   <li>Shutdown: checked before each poll and between jobs. Jobs of the
 *   current batch that were not started are released back to the queue.</li>
 * </ul>
 *
 * @see ArtifactJobProcessor
 * @see JobQueue
 */
@Component
@Slf4j
public class ArtifactWorker implements SmartLifecycle {

    private final JobQueue jobQueue;
    private final ArtifactJobProcessor processor;
    private final WorkerStats stats;
    private final Clock clock;
    private final boolean enabled;
    private final String queueName;
    private final int maxJobs;
    private final Duration waitTime;
    private final Duration idlePause;
    private final Duration errorBackoff;
    private final Duration shutdownTimeout;

    private final ShutdownSignal shutdownSignal = new ShutdownSignal();
    private volatile Thread workerThread;
    private volatile boolean running;

    public ArtifactWorker(
            JobQueue jobQueue,
            ArtifactJobProcessor processor,
            WorkerStats stats,
            Clock clock,
            @Value("${app.worker.enabled:true}") boolean enabled,
            @Value("${app.rabbitmq.queue.artifact:artifact.jobs.queue}") String queueName,
            @Value("${app.worker.max-jobs:10}") int maxJobs,
            @Value("${app.worker.wait-time-ms:10000}") long waitTimeMs,
            @Value("${app.worker.idle-pause-ms:1000}") long idlePauseMs,
            @Value("${app.worker.error-backoff-ms:5000}") long errorBackoffMs,
            @Value("${app.worker.shutdown-timeout-ms:30000}") long shutdownTimeoutMs
    ) {
        this.jobQueue = jobQueue;
        this.processor = processor;
        this.stats = stats;
        this.clock = clock;
        this.enabled = enabled;
        this.queueName = queueName;
        this.maxJobs = Math.max(1, maxJobs);
        this.waitTime = Duration.ofMillis(waitTimeMs);
        this.idlePause = Duration.ofMillis(idlePauseMs);
        this.errorBackoff = Duration.ofMillis(errorBackoffMs);
        this.shutdownTimeout = Duration.ofMillis(shutdownTimeoutMs);
    }

    @Override
    public void start() {
        if (!enabled) {
            log.info("Artifact worker disabled (app.worker.enabled=false)");
            return;
        }
        if (queueName == null || queueName.isBlank()) {
            throw new IllegalStateException("Artifact worker requires app.rabbitmq.queue.artifact to be set");
        }

        Thread thread = new Thread(this::run, "artifact-worker");
        thread.setDaemon(false);
        workerThread = thread;
        running = true;
        thread.start();
    }

    @Override
    public void stop() {
        requestShutdown();
        Thread thread = workerThread;
        if (thread != null) {
            try {
                thread.join(shutdownTimeout.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (thread.isAlive()) {
                log.warn("Artifact worker did not stop within {} ms", shutdownTimeout.toMillis());
            }
        }
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Ask the loop to stop at its next checkpoint. Never interrupts a job in flight.
     */
    public void requestShutdown() {
        if (!shutdownSignal.isTriggered()) {
            log.info("Shutdown requested, artifact worker will stop after the current job");
        }
        shutdownSignal.trigger();
    }

    void run() {
        log.info("Artifact worker started: queue={}, maxJobs={}, waitTime={}", queueName, maxJobs, waitTime);
        try {
            while (!shutdownSignal.isTriggered()) {
                pollOnce();
            }
        } finally {
            running = false;
            log.info("Artifact worker stopped: processed={}, errors={}", stats.getProcessed(), stats.getErrors());
        }
    }

    /**
     * One POLLING cycle followed by PROCESSING of whatever arrived.
     */
    void pollOnce() {
        List<QueuedJob> jobs;
        try {
            jobs = jobQueue.receive(maxJobs, waitTime);
            stats.recordPoll(clock.instant());
        } catch (Exception e) {
            log.error("Failed to poll artifact jobs: {}", e.getMessage());
            stats.recordPollError();
            pause(errorBackoff);
            return;
        }

        if (jobs.isEmpty()) {
            pause(idlePause);
            return;
        }

        log.info("Received {} artifact jobs", jobs.size());
        processJobs(jobs);
    }

    void processJobs(List<QueuedJob> jobs) {
        for (int i = 0; i < jobs.size(); i++) {
            if (shutdownSignal.isTriggered()) {
                List<QueuedJob> remaining = jobs.subList(i, jobs.size());
                log.info("Shutdown during batch, releasing {} unprocessed jobs", remaining.size());
                remaining.forEach(this::releaseQuietly);
                return;
            }
            if (!handle(jobs.get(i))) {
                // Delivery tags died with the channel; the broker redelivers everything unsettled
                log.warn("Job queue connection lost, abandoning {} remaining jobs of the batch",
                        jobs.size() - i - 1);
                return;
            }
        }
    }

    /**
     * @return false if the job could not be settled and the rest of the batch must be abandoned
     */
    private boolean handle(QueuedJob job) {
        ArtifactJobProcessor.Outcome outcome;
        try {
            outcome = processor.process(job.body());
        } catch (Exception e) {
            log.error("Artifact job failed, scheduling retry: deliveryTag={}, redelivered={}, error={}",
                    job.deliveryTag(), job.redelivered(), e.getMessage(), e);
            stats.recordError();
            try {
                jobQueue.retryLater(job);
                return true;
            } catch (Exception retryError) {
                log.error("Could not schedule retry, broker will redeliver on reconnect: deliveryTag={}, error={}",
                        job.deliveryTag(), retryError.getMessage());
                return false;
            }
        }

        try {
            jobQueue.acknowledge(job);
        } catch (Exception e) {
            log.error("Could not acknowledge job, broker will redeliver on reconnect: deliveryTag={}, error={}",
                    job.deliveryTag(), e.getMessage());
            return false;
        }

        if (outcome == ArtifactJobProcessor.Outcome.MALFORMED) {
            stats.recordError();
        } else {
            stats.recordProcessed();
        }
        return true;
    }

    private void releaseQuietly(QueuedJob job) {
        try {
            jobQueue.release(job);
        } catch (Exception e) {
            log.warn("Could not release job, broker will redeliver on reconnect: deliveryTag={}, error={}",
                    job.deliveryTag(), e.getMessage());
        }
    }

    private void pause(Duration duration) {
        if (duration.isZero() || duration.isNegative()) {
            return;
        }
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            requestShutdown();
        }
    }
}
