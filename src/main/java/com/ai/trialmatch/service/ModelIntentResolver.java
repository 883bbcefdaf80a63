package com.ai.trialmatch.service;

import com.ai.trialmatch.conversation.ConversationIntent;
import com.ai.trialmatch.conversation.IntentContext;
import com.ai.trialmatch.exception.NlpModelException;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delegates to the external intent model. The label maps straight onto {@link ConversationIntent};
 * confidence is only logged. When the model call fails the keyword resolver answers for that message.
 */
public class ModelIntentResolver implements IntentResolver {

    private static final Logger log = LoggerFactory.getLogger(ModelIntentResolver.class);

    private final NlpModelClient modelClient;
    private final IntentResolver fallback;

    public ModelIntentResolver(NlpModelClient modelClient, IntentResolver fallback) {
        this.modelClient = modelClient;
        this.fallback = fallback;
    }

    @Override
    public ConversationIntent classify(String text, IntentContext context) {
        if (StringUtils.isBlank(text)) return ConversationIntent.UNKNOWN;
        String userId = context != null ? context.getUserId() : null;
        try {
            NlpModelClient.IntentPrediction prediction = modelClient.predictIntent(text);
            ConversationIntent intent = ConversationIntent.fromLabel(prediction.getLabel());
            log.debug("[{}] intent model label={} confidence={} -> {}",
                    userId, prediction.getLabel(), prediction.getConfidence(), intent);
            return intent;
        } catch (NlpModelException e) {
            log.warn("[{}] Intent model failed, using {} resolver: {}", userId, fallback.name(), e.getMessage());
            return fallback.classify(text, context);
        }
    }

    @Override
    public String name() {
        return "model";
    }
}
