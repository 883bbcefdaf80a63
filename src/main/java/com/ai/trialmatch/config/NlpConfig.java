package com.ai.trialmatch.config;

import com.ai.trialmatch.service.BioEntityDecoder;
import com.ai.trialmatch.service.EntityExtractor;
import com.ai.trialmatch.service.IntentResolver;
import com.ai.trialmatch.service.KeywordIntentResolver;
import com.ai.trialmatch.service.ModelEntityExtractor;
import com.ai.trialmatch.service.ModelIntentResolver;
import com.ai.trialmatch.service.NlpModelClient;
import com.ai.trialmatch.service.NoOpEntityExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Picks the intent resolver and entity extractor once at startup.
 * {@code nlp.mode=model} uses the external model service; anything else, or a model mode
 * without {@code nlp.model.base-url}, uses the keyword resolver and no entity extraction.
 */
@Configuration
public class NlpConfig {

    private static final Logger log = LoggerFactory.getLogger(NlpConfig.class);

    private final String mode;

    public NlpConfig(@Value("${nlp.mode:heuristic}") String mode) {
        this.mode = mode;
    }

    @Bean
    public IntentResolver intentResolver(NlpModelClient modelClient) {
        KeywordIntentResolver keyword = new KeywordIntentResolver();
        IntentResolver resolver = useModel(modelClient)
                ? new ModelIntentResolver(modelClient, keyword)
                : keyword;
        log.info("Intent resolver: {}", resolver.name());
        return resolver;
    }

    @Bean
    public EntityExtractor entityExtractor(NlpModelClient modelClient) {
        EntityExtractor extractor = useModel(modelClient)
                ? new ModelEntityExtractor(modelClient, new BioEntityDecoder())
                : new NoOpEntityExtractor();
        log.info("Entity extractor: {}", extractor.name());
        return extractor;
    }

    private boolean useModel(NlpModelClient modelClient) {
        if (!"model".equalsIgnoreCase(mode)) {
            return false;
        }
        if (!modelClient.isConfigured()) {
            log.warn("nlp.mode=model but nlp.model.base-url is not set, falling back to heuristics");
            return false;
        }
        return true;
    }
}
