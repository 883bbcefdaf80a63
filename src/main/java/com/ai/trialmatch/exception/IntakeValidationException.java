package com.ai.trialmatch.exception;

import java.util.List;

/**
 * Intake form rejected. Carries every offending field so the form can highlight them at once.
 */
public class IntakeValidationException extends RuntimeException {

    private final List<String> fields;

    public IntakeValidationException(List<String> fields, String message) {
        super(message);
        this.fields = fields != null ? List.copyOf(fields) : List.of();
    }

    public List<String> getFields() {
        return fields;
    }
}
