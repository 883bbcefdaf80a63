package com.ai.trialmatch.conversation;

/**
 * What an intent resolver may know about the session when classifying a message.
 */
public final class IntentContext {

    private final String userId;
    private final boolean intakeComplete;

    public IntentContext(String userId, boolean intakeComplete) {
        this.userId = userId;
        this.intakeComplete = intakeComplete;
    }

    public String getUserId() {
        return userId;
    }

    public boolean isIntakeComplete() {
        return intakeComplete;
    }

    public static IntentContext intakeComplete(String userId) {
        return new IntentContext(userId, true);
    }

    public static IntentContext withoutIntake(String userId) {
        return new IntentContext(userId, false);
    }
}
