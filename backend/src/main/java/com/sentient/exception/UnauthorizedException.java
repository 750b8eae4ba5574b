package com.sentient.exception;

/**
 * Exception thrown when an authenticated caller acts on another user's data.
 *
 * Raised by the ingest and plan endpoints when the {@code userId} in the
 * request does not match the subject of the bearer token.
 * GlobalExceptionHandler maps this to HTTP 403 Forbidden.
 */
public class UnauthorizedException extends RuntimeException {

    public UnauthorizedException(String message) {
        super(message);
    }

    /**
     * Constructs an UnauthorizedException for cross-user access attempts.
     *
     * @param callerId the authenticated user
     * @param requestedUserId the user whose data was requested
     * @return an UnauthorizedException with a formatted message
     */
    public static UnauthorizedException crossUserAccess(String callerId, String requestedUserId) {
        return new UnauthorizedException(
                String.format("User '%s' is not allowed to access data of user '%s'.", callerId, requestedUserId)
        );
    }
}
