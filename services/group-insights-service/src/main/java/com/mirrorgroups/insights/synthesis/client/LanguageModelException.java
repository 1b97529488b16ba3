package com.mirrorgroups.insights.synthesis.client;

import com.mirrorgroups.insights.exception.GroupInsightsException;
import lombok.Getter;

/**
 * Failure of a single call to the remote language model.
 *
 * <p>{@link #isRetryable()} is true for timeouts, connection errors, 5xx responses and
 * 429; every other status is final.
 */
@Getter
public class LanguageModelException extends GroupInsightsException {

    private final boolean retryable;

    /**
     * HTTP status of the response, or null when no response was received
     */
    private final Integer statusCode;

    public LanguageModelException(String message, boolean retryable, Integer statusCode, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
        this.statusCode = statusCode;
    }

    public static LanguageModelException timeout(Throwable cause) {
        return new LanguageModelException("Language model call timed out", true, null, cause);
    }

    public static LanguageModelException network(Throwable cause) {
        return new LanguageModelException("Language model unreachable: " + cause.getMessage(), true, null, cause);
    }

    public static LanguageModelException http(int status, Throwable cause) {
        boolean retryable = status >= 500 || status == 429;
        return new LanguageModelException("Language model returned HTTP " + status, retryable, status, cause);
    }

    /**
     * A response that could not be decoded, or any other failure outside HTTP and transport
     */
    public static LanguageModelException unreadableResponse(Throwable cause) {
        return new LanguageModelException("Language model response could not be read: " + cause.getMessage(),
            false, null, cause);
    }

    public static LanguageModelException emptyResponse() {
        return new LanguageModelException("Language model returned no completion text", false, null, null);
    }
}
