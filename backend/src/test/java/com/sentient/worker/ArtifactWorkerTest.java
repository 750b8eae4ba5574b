package com.sentient.worker;

import com.sentient.exception.ProcessingException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ArtifactWorker.
 *
 * Uses an in-memory JobQueue that records how each job was settled and zero
 * pauses so the loop never sleeps.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("ArtifactWorker Unit Tests")
class ArtifactWorkerTest {

    private static final Instant NOW = Instant.parse("2025-03-14T10:00:00Z");

    @Mock
    private ArtifactJobProcessor processor;

    private RecordingJobQueue jobQueue;
    private WorkerStats stats;
    private ArtifactWorker worker;

    @BeforeEach
    void setUp() {
        jobQueue = new RecordingJobQueue();
        stats = new WorkerStats();
        worker = new ArtifactWorker(jobQueue, processor, stats, Clock.fixed(NOW, ZoneOffset.UTC),
                true, "artifact.jobs.queue", 10, 0, 0, 0, 1000);
    }

    private static List<QueuedJob> jobs(int count) {
        List<QueuedJob> jobs = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            jobs.add(new QueuedJob(i, ("{\"record_id\":\"r" + i + "\"}").getBytes(StandardCharsets.UTF_8), false));
        }
        return jobs;
    }

    @Test
    @DisplayName("Successful jobs should be acknowledged and counted")
    void testSuccessfulJobsAcknowledged() {
        // Arrange
        when(processor.process(any())).thenReturn(ArtifactJobProcessor.Outcome.COMPLETED);

        // Act
        worker.processJobs(jobs(3));

        // Assert
        assertEquals(List.of(1L, 2L, 3L), jobQueue.acknowledged);
        assertTrue(jobQueue.retried.isEmpty());
        assertEquals(3, stats.getProcessed());
        assertEquals(0, stats.getErrors());
    }

    @Test
    @DisplayName("Failed upload should schedule a retry and never acknowledge")
    void testUploadFailureRetries() {
        // Arrange
        when(processor.process(any()))
                .thenReturn(ArtifactJobProcessor.Outcome.COMPLETED)
                .thenThrow(ProcessingException.uploadFailed("artifacts/u/r2.txt", new IOException("disk full")));

        // Act
        worker.processJobs(jobs(2));

        // Assert
        assertEquals(List.of(1L), jobQueue.acknowledged);
        assertEquals(List.of(2L), jobQueue.retried);
        assertEquals(1, stats.getProcessed());
        assertEquals(1, stats.getErrors());
    }

    @Test
    @DisplayName("Malformed job should be acknowledged and counted as an error")
    void testMalformedJobDropped() {
        // Arrange
        when(processor.process(any())).thenReturn(ArtifactJobProcessor.Outcome.MALFORMED);

        // Act
        worker.processJobs(jobs(1));

        // Assert
        assertEquals(List.of(1L), jobQueue.acknowledged);
        assertEquals(0, stats.getProcessed());
        assertEquals(1, stats.getErrors());
    }

    @Test
    @DisplayName("Missing record should be acknowledged as processed")
    void testRecordMissingAcknowledged() {
        // Arrange
        when(processor.process(any())).thenReturn(ArtifactJobProcessor.Outcome.RECORD_MISSING);

        // Act
        worker.processJobs(jobs(1));

        // Assert
        assertEquals(List.of(1L), jobQueue.acknowledged);
        assertEquals(1, stats.getProcessed());
    }

    @Test
    @DisplayName("Shutdown mid-batch should finish the current job and release the rest")
    void testShutdownReleasesUnstartedJobs() {
        // Arrange
        AtomicInteger calls = new AtomicInteger();
        when(processor.process(any())).thenAnswer(inv -> {
            if (calls.incrementAndGet() == 7) {
                worker.requestShutdown();
            }
            return ArtifactJobProcessor.Outcome.COMPLETED;
        });

        // Act
        worker.processJobs(jobs(10));

        // Assert
        assertEquals(7, jobQueue.acknowledged.size());
        assertEquals(List.of(8L, 9L, 10L), jobQueue.released);
        assertEquals(7, stats.getProcessed());
        assertEquals(0, stats.getErrors());
        verify(processor, times(7)).process(any());
    }

    @Test
    @DisplayName("Lost connection on acknowledge should abandon the rest of the batch")
    void testAcknowledgeFailureAbandonsBatch() {
        // Arrange
        when(processor.process(any())).thenReturn(ArtifactJobProcessor.Outcome.COMPLETED);
        jobQueue.failAcknowledge = true;

        // Act
        worker.processJobs(jobs(3));

        // Assert
        verify(processor, times(1)).process(any());
        assertTrue(jobQueue.acknowledged.isEmpty());
        assertTrue(jobQueue.retried.isEmpty());
        assertTrue(jobQueue.released.isEmpty());
        assertEquals(0, stats.getProcessed());
        assertEquals(0, stats.getErrors());
    }

    @Test
    @DisplayName("Lost connection on retry should abandon the rest of the batch")
    void testRetryFailureAbandonsBatch() {
        // Arrange
        when(processor.process(any()))
                .thenThrow(ProcessingException.uploadFailed("artifacts/u/r1.txt", new IOException("disk full")));
        jobQueue.failRetry = true;

        // Act
        worker.processJobs(jobs(3));

        // Assert
        verify(processor, times(1)).process(any());
        assertTrue(jobQueue.acknowledged.isEmpty());
        assertEquals(1, stats.getErrors());
    }

    @Test
    @DisplayName("Receive failure should count a poll error and keep the loop alive")
    void testReceiveFailureBacksOff() {
        // Arrange
        jobQueue.failNextReceive = true;

        // Act
        worker.pollOnce();

        // Assert
        assertEquals(1, stats.getPollErrors());
        assertNull(stats.getLastPollAt());
        verifyNoInteractions(processor);
    }

    @Test
    @DisplayName("Run loop should drain queued batches until shutdown")
    void testRunLoopStopsOnShutdown() {
        // Arrange
        jobQueue.batches.add(jobs(2));
        when(processor.process(any())).thenAnswer(inv -> {
            if (jobQueue.acknowledged.size() == 1) {
                worker.requestShutdown();
            }
            return ArtifactJobProcessor.Outcome.COMPLETED;
        });

        // Act
        worker.run();

        // Assert
        assertEquals(List.of(1L, 2L), jobQueue.acknowledged);
        assertEquals(NOW, stats.getLastPollAt());
        assertFalse(worker.isRunning());
    }

    @Test
    @DisplayName("Disabled worker should not start")
    void testDisabledWorkerDoesNotStart() {
        // Arrange
        ArtifactWorker disabled = new ArtifactWorker(jobQueue, processor, stats, Clock.systemUTC(),
                false, "artifact.jobs.queue", 10, 0, 0, 0, 1000);

        // Act
        disabled.start();

        // Assert
        assertFalse(disabled.isRunning());
    }

    @Test
    @DisplayName("Start without a queue name should fail")
    void testStartWithoutQueueFails() {
        // Arrange
        ArtifactWorker misconfigured = new ArtifactWorker(jobQueue, processor, stats, Clock.systemUTC(),
                true, " ", 10, 0, 0, 0, 1000);

        // Act & Assert
        assertThrows(IllegalStateException.class, misconfigured::start);
    }

    /**
     * In-memory queue. Returns queued batches in order, then empty batches.
     */
    private static class RecordingJobQueue implements JobQueue {

        final Deque<List<QueuedJob>> batches = new ArrayDeque<>();
        final List<Long> acknowledged = new ArrayList<>();
        final List<Long> retried = new ArrayList<>();
        final List<Long> released = new ArrayList<>();
        boolean failNextReceive;
        boolean failAcknowledge;
        boolean failRetry;

        @Override
        public List<QueuedJob> receive(int maxJobs, Duration waitTime) {
            if (failNextReceive) {
                failNextReceive = false;
                throw ProcessingException.queueUnavailable(new IOException("connection refused"));
            }
            List<QueuedJob> next = batches.poll();
            return next != null ? next : List.of();
        }

        @Override
        public void acknowledge(QueuedJob job) {
            if (failAcknowledge) {
                throw ProcessingException.queueUnavailable(new IOException("channel closed"));
            }
            acknowledged.add(job.deliveryTag());
        }

        @Override
        public void retryLater(QueuedJob job) {
            if (failRetry) {
                throw ProcessingException.queueUnavailable(new IOException("channel closed"));
            }
            retried.add(job.deliveryTag());
        }

        @Override
        public void release(QueuedJob job) {
            released.add(job.deliveryTag());
        }
    }
}
