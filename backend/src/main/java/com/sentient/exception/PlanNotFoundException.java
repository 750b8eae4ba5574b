package com.sentient.exception;

/**
 * Thrown by the plan reader when a user has no stored plans.
 * Mapped to HTTP 404 Not Found.
 */
public class PlanNotFoundException extends RuntimeException {

    private final String userId;

    public PlanNotFoundException(String userId) {
        super("No plans found for user: " + userId);
        this.userId = userId;
    }

    public String getUserId() {
        return userId;
    }
}
