package com.ai.trialmatch.exception;

/**
 * No session exists for the user, i.e. the intake form was never submitted.
 */
public class SessionNotFoundException extends RuntimeException {

    private final String userId;

    public SessionNotFoundException(String userId) {
        super("No session for user " + userId);
        this.userId = userId;
    }

    public String getUserId() {
        return userId;
    }
}
