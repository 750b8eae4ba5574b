package com.sentient.worker;

/**
 * A job received from the queue but not yet settled.
 *
 * @param deliveryTag broker handle used to acknowledge, retry or release
 * @param body raw job payload
 * @param redelivered whether the broker has delivered this job before
 */
public record QueuedJob(long deliveryTag, byte[] body, boolean redelivered) {
}
