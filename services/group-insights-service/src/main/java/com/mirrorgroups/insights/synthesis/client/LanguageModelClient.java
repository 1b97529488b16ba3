package com.mirrorgroups.insights.synthesis.client;

/**
 * A single request/response exchange with the remote language model.
 */
public interface LanguageModelClient {

    /**
     * @return the completion text
     * @throws LanguageModelException on timeout, transport failure, an error status or
     *         a response without completion text
     */
    String complete(CompletionRequest request);
}
