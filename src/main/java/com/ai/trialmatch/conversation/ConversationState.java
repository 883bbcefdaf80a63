package com.ai.trialmatch.conversation;

/**
 * State machine for a patient conversation.
 * NEW until the intake form is accepted, ENDED after the patient says goodbye.
 */
public enum ConversationState {
    NEW,
    INTAKE_COMPLETE,
    ENDED
}
