package com.ai.trialmatch.exception;

/**
 * A required request field was absent or blank.
 */
public class MissingFieldException extends RuntimeException {

    private final String field;

    public MissingFieldException(String field) {
        super(field + " is required");
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
