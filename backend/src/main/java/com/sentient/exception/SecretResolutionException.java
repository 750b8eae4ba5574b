package com.sentient.exception;

/**
 * Thrown when the secret bundle cannot be fetched or parsed.
 *
 * This is an irrecoverable configuration failure: the stream consumer lets it
 * abort the whole batch so the broker redelivers it, and the HTTP layer maps
 * it to 503 Service Unavailable.
 */
public class SecretResolutionException extends RuntimeException {

    public SecretResolutionException(String message) {
        super(message);
    }

    public SecretResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
