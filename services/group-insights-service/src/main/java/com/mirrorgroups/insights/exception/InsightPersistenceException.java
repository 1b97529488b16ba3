package com.mirrorgroups.insights.exception;

public class InsightPersistenceException extends GroupInsightsException {

    public InsightPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
