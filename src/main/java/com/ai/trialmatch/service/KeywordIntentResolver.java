package com.ai.trialmatch.service;

import com.ai.trialmatch.conversation.ConversationIntent;
import com.ai.trialmatch.conversation.IntentContext;
import org.apache.commons.lang3.StringUtils;

import java.util.regex.Pattern;

/**
 * Keyword classifier used when no intent model is available.
 * Fixed priority when keywords overlap: greeting, then goodbye, then find_trials, then unknown.
 * "Hi, bye" and "Bye, hi" are therefore greetings. An upper-case ", HI" closing the message
 * ("Honolulu, HI") is the Hawaii state code, not a greeting.
 */
public class KeywordIntentResolver implements IntentResolver {

    private static final Pattern GREETING = Pattern.compile(
            "\\b(hello|hey|hiya|howdy|good (morning|afternoon|evening))\\b|\\bhi\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern HAWAII_SUFFIX = Pattern.compile(",\\s*HI\\s*[.!?]?$");

    private static final Pattern GOODBYE = Pattern.compile(
            "\\b(bye|goodbye|good-bye|bye-bye|see you|see ya|farewell)\\b",
            Pattern.CASE_INSENSITIVE
    );

    @Override
    public ConversationIntent classify(String text, IntentContext context) {
        if (StringUtils.isBlank(text)) return ConversationIntent.UNKNOWN;
        String t = HAWAII_SUFFIX.matcher(text.trim()).replaceFirst("");
        if (GREETING.matcher(t).find()) {
            return ConversationIntent.GREETING;
        }
        if (GOODBYE.matcher(t).find()) {
            return ConversationIntent.GOODBYE;
        }
        if (context != null && context.isIntakeComplete()) {
            return ConversationIntent.FIND_TRIALS;
        }
        return ConversationIntent.UNKNOWN;
    }

    @Override
    public String name() {
        return "keyword";
    }
}
