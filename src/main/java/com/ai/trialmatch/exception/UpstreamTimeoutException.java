package com.ai.trialmatch.exception;

public class UpstreamTimeoutException extends TrialRegistryException {

    public UpstreamTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
