package com.ai.trialmatch.service;

import com.ai.trialmatch.conversation.ConversationIntent;
import com.ai.trialmatch.conversation.IntentContext;

/**
 * Classifies a free-text message into a conversational intent.
 * The active implementation is chosen once at startup, see {@code NlpConfig}.
 */
public interface IntentResolver {

    ConversationIntent classify(String text, IntentContext context);

    /** Short name for logs. */
    String name();
}
