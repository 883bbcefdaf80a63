package com.ai.trialmatch.exception;

/**
 * A single study record could not be mapped. The record is skipped, the search continues.
 */
public class UpstreamParseException extends TrialRegistryException {

    public UpstreamParseException(String message) {
        super(message);
    }
}
