package com.sentient.messaging;

/**
 * Decoded stream record.
 *
 * @param text reflection text, possibly blank
 * @param userId submitting user, {@code anonymous} when the record carried none
 */
public record ReflectionInput(String text, String userId) {

    public static final String ANONYMOUS_USER = "anonymous";
}
