package com.sentient.worker;

import java.time.Duration;
import java.util.List;

/**
 * Pull-based job queue used by {@link ArtifactWorker}.
 *
 * Every received job must be settled exactly once with one of
 * {@link #acknowledge}, {@link #retryLater} or {@link #release}.
 */
public interface JobQueue {

    /**
     * Long-poll for jobs.
     *
     * @param maxJobs upper bound on returned jobs
     * @param waitTime how long to wait when the queue is empty
     * @return received jobs, empty if none arrived within the wait
     * @throws com.sentient.exception.ProcessingException on transport failure
     */
    List<QueuedJob> receive(int maxJobs, Duration waitTime);

    /** Remove a successfully handled job. */
    void acknowledge(QueuedJob job);

    /** Make a failed job visible again after the retry delay. */
    void retryLater(QueuedJob job);

    /** Return an untouched job to the queue immediately. */
    void release(QueuedJob job);
}
