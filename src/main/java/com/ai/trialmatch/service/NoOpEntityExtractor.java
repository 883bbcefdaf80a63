package com.ai.trialmatch.service;

import com.ai.trialmatch.model.ExtractedEntities;

/**
 * Used without an NER model: finds nothing, so every search falls back to the intake profile.
 */
public class NoOpEntityExtractor implements EntityExtractor {

    @Override
    public ExtractedEntities extract(String text) {
        return ExtractedEntities.none();
    }

    @Override
    public String name() {
        return "none";
    }
}
