package com.ai.trialmatch.service;

import com.ai.trialmatch.exception.NlpModelException;
import com.ai.trialmatch.model.ExtractedEntities;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;

/**
 * Word-level NER through the external model. The model labels each whitespace-separated word
 * in BIO form and {@link BioEntityDecoder} turns the labels back into fields.
 */
public class ModelEntityExtractor implements EntityExtractor {

    private static final Logger log = LoggerFactory.getLogger(ModelEntityExtractor.class);

    private final NlpModelClient modelClient;
    private final BioEntityDecoder decoder;

    public ModelEntityExtractor(NlpModelClient modelClient, BioEntityDecoder decoder) {
        this.modelClient = modelClient;
        this.decoder = decoder;
    }

    @Override
    public ExtractedEntities extract(String text) {
        if (StringUtils.isBlank(text)) return ExtractedEntities.none();
        List<String> words = Arrays.asList(StringUtils.split(text.trim()));
        try {
            List<String> labels = modelClient.predictTokenLabels(words);
            if (labels.size() != words.size()) {
                log.warn("NER model returned {} labels for {} words, ignoring", labels.size(), words.size());
                return ExtractedEntities.none();
            }
            ExtractedEntities entities = decoder.decode(words, labels);
            log.debug("Extracted entities: {}", entities);
            return entities;
        } catch (NlpModelException e) {
            log.warn("NER model failed, no entities extracted: {}", e.getMessage());
            return ExtractedEntities.none();
        }
    }

    @Override
    public String name() {
        return "model";
    }
}
