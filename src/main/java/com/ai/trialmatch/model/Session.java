package com.ai.trialmatch.model;

import com.ai.trialmatch.conversation.ConversationState;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.time.Instant;
import java.util.List;

/**
 * Immutable snapshot of one user's conversation. The session store swaps whole
 * snapshots atomically, so a reference held elsewhere never changes underneath.
 */
@Getter
@Builder(toBuilder = true)
public final class Session {

    private final String userId;
    private final PatientIntake intake;
    @Singular
    private final List<Turn> turns;
    @Builder.Default
    private final ConversationState state = ConversationState.NEW;
    private final Instant createdAt;
    private final Instant updatedAt;

    public boolean isIntakeComplete() {
        return intake != null && state != ConversationState.NEW;
    }

    public boolean isEnded() {
        return state == ConversationState.ENDED;
    }

    @Override
    public String toString() {
        return "Session{userId=" + userId + ", state=" + state + ", turns=" + turns.size() + "}";
    }
}
