package com.ai.trialmatch.conversation;

import java.util.Locale;

/**
 * Coarse purpose of a single patient message.
 */
public enum ConversationIntent {
    GREETING("greeting"),
    FIND_TRIALS("find_trials"),
    GOODBYE("goodbye"),
    UNKNOWN("unknown");

    private final String label;

    ConversationIntent(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Maps a classifier label onto an intent. Anything unrecognised is {@link #UNKNOWN}.
     */
    public static ConversationIntent fromLabel(String label) {
        if (label == null) return UNKNOWN;
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        for (ConversationIntent intent : values()) {
            if (intent.label.equals(normalized)) return intent;
        }
        return UNKNOWN;
    }
}
