package com.mirrorgroups.insights.synthesis;

import com.mirrorgroups.insights.config.GroupInsightsProperties;
import com.mirrorgroups.insights.exception.SynthesisException;
import com.mirrorgroups.insights.model.insight.GroupAnalysisResult;
import com.mirrorgroups.insights.model.insight.NarrativeSynthesis;
import com.mirrorgroups.insights.synthesis.client.CompletionRequest;
import com.mirrorgroups.insights.synthesis.client.LanguageModelClient;
import com.mirrorgroups.insights.synthesis.client.LanguageModelException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Synthesis by the remote language model.
 *
 * <p>Each attempt passes through the circuit breaker and the retry wraps the breaker, so
 * a call that is retried three times is recorded as three outcomes. Parsing happens
 * after the breaker: a well-formed HTTP exchange with an unusable body fails the
 * synthesis without counting against the remote service.
 *
 * <p>While the circuit is open {@link CallNotPermittedException} escapes unchanged.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RemoteNarrativeStrategy implements NarrativeStrategy {

    private final LanguageModelClient languageModelClient;
    private final CircuitBreaker languageModelCircuitBreaker;
    private final Retry languageModelRetry;
    private final SynthesisPromptBuilder promptBuilder;
    private final SynthesisResponseParser responseParser;
    private final GroupInsightsProperties properties;

    @Override
    public NarrativeSynthesis synthesize(GroupAnalysisResult result) {
        GroupInsightsProperties.Synthesis synthesis = properties.getSynthesis();
        CompletionRequest request = CompletionRequest.builder()
            .prompt(promptBuilder.build(result))
            .maxTokens(synthesis.getMaxTokens())
            .temperature(synthesis.getTemperature())
            .build();

        Supplier<String> call = Retry.decorateSupplier(languageModelRetry,
            CircuitBreaker.decorateSupplier(languageModelCircuitBreaker,
                () -> languageModelClient.complete(request)));

        String completion;
        try {
            completion = call.get();
        } catch (LanguageModelException e) {
            log.error("Remote synthesis failed for group {} (retryable={}, status={})",
                result.getGroupId(), e.isRetryable(), e.getStatusCode());
            throw new SynthesisException("Remote synthesis failed: " + e.getMessage(), e);
        }

        NarrativeSynthesis parsed = responseParser.parse(completion);
        log.info("Remote synthesis completed for group {}", result.getGroupId());
        return parsed;
    }
}
