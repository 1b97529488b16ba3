package com.mirrorgroups.insights.synthesis.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.mirrorgroups.insights.config.GroupInsightsProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

import java.util.concurrent.TimeoutException;

/**
 * Language model client over WebClient.
 *
 * <p>Accepts both a plain {@code {"text": ...}} body and an OpenAI-style
 * {@code choices} array, either {@code choices[0].text} or
 * {@code choices[0].message.content}. Each call carries the configured hard timeout;
 * retries and circuit breaking are applied by the caller.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebClientLanguageModelClient implements LanguageModelClient {

    private final WebClient languageModelWebClient;
    private final GroupInsightsProperties properties;

    @Override
    public String complete(CompletionRequest request) {
        log.debug("Requesting completion: maxTokens={}, temperature={}", request.getMaxTokens(), request.getTemperature());

        JsonNode response;
        try {
            response = languageModelWebClient.post()
                .bodyValue(request)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(properties.getSynthesis().getTimeout())
                .block();
        } catch (WebClientResponseException e) {
            throw LanguageModelException.http(e.getStatusCode().value(), e);
        } catch (WebClientRequestException e) {
            throw LanguageModelException.network(e);
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof TimeoutException) {
                throw LanguageModelException.timeout(cause);
            }
            throw LanguageModelException.unreadableResponse(cause);
        }

        String text = extractText(response);
        if (text == null || text.isBlank()) {
            throw LanguageModelException.emptyResponse();
        }
        return text;
    }

    static String extractText(JsonNode response) {
        if (response == null) {
            return null;
        }
        if (response.path("text").isTextual()) {
            return response.get("text").asText();
        }
        JsonNode choice = response.path("choices").path(0);
        if (choice.path("text").isTextual()) {
            return choice.get("text").asText();
        }
        JsonNode content = choice.path("message").path("content");
        return content.isTextual() ? content.asText() : null;
    }
}
