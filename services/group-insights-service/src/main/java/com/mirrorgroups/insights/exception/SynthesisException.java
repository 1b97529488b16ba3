package com.mirrorgroups.insights.exception;

/**
 * Thrown when narrative synthesis cannot produce a valid result: retries on the
 * remote model exhausted, a non-retryable remote error, or a response that does not
 * match the expected schema.
 */
public class SynthesisException extends GroupInsightsException {

    public SynthesisException(String message) {
        super(message);
    }

    public SynthesisException(String message, Throwable cause) {
        super(message, cause);
    }
}
