package com.mirrorgroups.insights.exception;

/**
 * Raised when member data cannot be decrypted or fails its integrity check.
 * Callers must treat the affected data as absent.
 */
public class DecryptionException extends GroupInsightsException {

    public DecryptionException(String message) {
        super(message);
    }

    public DecryptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
