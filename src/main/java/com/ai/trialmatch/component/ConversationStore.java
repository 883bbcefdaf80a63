package com.ai.trialmatch.component;

import com.ai.trialmatch.conversation.ConversationState;
import com.ai.trialmatch.exception.SessionNotFoundException;
import com.ai.trialmatch.model.PatientIntake;
import com.ai.trialmatch.model.Session;
import com.ai.trialmatch.model.Turn;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory owner of every conversation session, keyed by user id.
 * Sessions are immutable snapshots replaced through {@link ConcurrentHashMap#compute},
 * so each operation is atomic for its key and callers never see a half-applied change.
 */
@Component
public class ConversationStore {

    private static final Logger log = LoggerFactory.getLogger(ConversationStore.class);
    private static final int LOG_TEXT_LIMIT = 200;

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();

    /**
     * Creates the session if needed and replaces its intake wholesale. Existing turns are kept.
     */
    public Session upsertIntake(String userId, PatientIntake intake) {
        Session updated = sessions.compute(userId, (key, current) -> {
            Instant now = Instant.now();
            Session.SessionBuilder builder = current != null
                    ? current.toBuilder()
                    : Session.builder().userId(key).createdAt(now);
            return builder
                    .intake(intake)
                    .state(ConversationState.INTAKE_COMPLETE)
                    .updatedAt(now)
                    .build();
        });
        log.info("[{}] Intake stored ({})", userId, intake.getCancerType());
        return updated;
    }

    public Session get(String userId) {
        return find(userId).orElseThrow(() -> new SessionNotFoundException(userId));
    }

    public Optional<Session> find(String userId) {
        if (userId == null) return Optional.empty();
        return Optional.ofNullable(sessions.get(userId));
    }

    public Session appendTurn(String userId, Turn turn) {
        Session updated = sessions.computeIfPresent(userId, (key, current) -> current.toBuilder()
                .turn(turn)
                .updatedAt(Instant.now())
                .build());
        if (updated == null) {
            throw new SessionNotFoundException(userId);
        }
        log.info("[{}] {}: {}", userId, turn.getRole().getValue(), StringUtils.abbreviate(turn.getText(), LOG_TEXT_LIMIT));
        return updated;
    }

    public Session transition(String userId, ConversationState state) {
        Session updated = sessions.computeIfPresent(userId, (key, current) -> current.toBuilder()
                .state(state)
                .updatedAt(Instant.now())
                .build());
        if (updated == null) {
            throw new SessionNotFoundException(userId);
        }
        log.debug("[{}] state -> {}", userId, state);
        return updated;
    }

    /**
     * Removes the session. Clearing an unknown user is a no-op.
     */
    public void clear(String userId) {
        if (userId == null) return;
        if (sessions.remove(userId) != null) {
            log.info("[{}] Session cleared", userId);
        }
    }

    public int size() {
        return sessions.size();
    }
}
