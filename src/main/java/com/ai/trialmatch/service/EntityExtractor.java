package com.ai.trialmatch.service;

import com.ai.trialmatch.model.ExtractedEntities;

/**
 * Pulls cancer type, location, age and sex out of free text. Missing fields stay absent.
 */
public interface EntityExtractor {

    ExtractedEntities extract(String text);

    String name();
}
