package com.mirrorgroups.insights.exception;

/**
 * Base exception for group insight errors
 */
public class GroupInsightsException extends RuntimeException {

    public GroupInsightsException(String message) {
        super(message);
    }

    public GroupInsightsException(String message, Throwable cause) {
        super(message, cause);
    }
}
