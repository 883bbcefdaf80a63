package com.ai.trialmatch.model;

import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.List;

/**
 * One utterance in a session. Only bot turns answering a trial search carry trials.
 */
@Getter
@ToString
public final class Turn {

    private final TurnRole role;
    private final String text;
    private final Instant timestamp;
    private final List<Trial> trials;

    private Turn(TurnRole role, String text, Instant timestamp, List<Trial> trials) {
        this.role = role;
        this.text = text != null ? text : "";
        this.timestamp = timestamp != null ? timestamp : Instant.now();
        this.trials = trials != null ? List.copyOf(trials) : null;
    }

    public static Turn user(String text) {
        return new Turn(TurnRole.USER, text, Instant.now(), null);
    }

    public static Turn bot(String text) {
        return new Turn(TurnRole.BOT, text, Instant.now(), null);
    }

    public static Turn botWithTrials(String text, List<Trial> trials) {
        return new Turn(TurnRole.BOT, text, Instant.now(), trials != null ? trials : List.of());
    }

    public boolean hasTrials() {
        return trials != null;
    }
}
