package com.ai.trialmatch.exception;

/**
 * The external intent/NER model service failed or answered with something unusable.
 */
public class NlpModelException extends RuntimeException {

    public NlpModelException(String message) {
        super(message);
    }

    public NlpModelException(String message, Throwable cause) {
        super(message, cause);
    }
}
