package com.ai.trialmatch.exception;

/**
 * Registry refused the request, answered with an error status, or sent a body that is not JSON.
 */
public class UpstreamUnavailableException extends TrialRegistryException {

    public UpstreamUnavailableException(String message) {
        super(message);
    }

    public UpstreamUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
