package com.ai.trialmatch.exception;

/**
 * Base for failures talking to the clinical trial registry.
 */
public abstract class TrialRegistryException extends RuntimeException {

    protected TrialRegistryException(String message) {
        super(message);
    }

    protected TrialRegistryException(String message, Throwable cause) {
        super(message, cause);
    }
}
