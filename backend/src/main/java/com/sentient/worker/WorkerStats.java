package com.sentient.worker;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Running counters of the artifact worker, exposed through actuator health.
 */
@Component
public class WorkerStats {

    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();
    private final AtomicLong pollErrors = new AtomicLong();
    private final AtomicReference<Instant> lastPollAt = new AtomicReference<>();

    public void recordProcessed() {
        processed.incrementAndGet();
    }

    public void recordError() {
        errors.incrementAndGet();
    }

    public void recordPollError() {
        pollErrors.incrementAndGet();
    }

    public void recordPoll(Instant at) {
        lastPollAt.set(at);
    }

    public long getProcessed() {
        return processed.get();
    }

    public long getErrors() {
        return errors.get();
    }

    public long getPollErrors() {
        return pollErrors.get();
    }

    public Instant getLastPollAt() {
        return lastPollAt.get();
    }
}
