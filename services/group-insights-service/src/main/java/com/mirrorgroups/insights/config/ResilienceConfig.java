package com.mirrorgroups.insights.config;

import com.mirrorgroups.insights.synthesis.client.LanguageModelException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Resilience4j Configuration
 *
 * Guards the remote language-model call used for narrative synthesis.
 *
 * Circuit Breaker Strategy:
 * - Opens after {@code failureThreshold} consecutive failed calls
 * - Stays open for {@code resetTimeout}, then admits exactly one trial call
 * - The trial call outcome closes or re-opens the circuit
 *
 * Retry Strategy:
 * - Exponential backoff starting at {@code initialBackoff}, doubling per attempt
 * - Only transient errors (network, timeout, 5xx, 429) are retried
 * - Rejections from an open circuit are never retried
 *
 * Retry wraps the circuit breaker, so every attempt is recorded by the breaker.
 *
 * @author MirrorGroups Insights Team
 * @version 1.0.0
 * @since 2026-10-01
 */
@Configuration
@Slf4j
public class ResilienceConfig {

    public static final String LANGUAGE_MODEL = "languageModel";

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(GroupInsightsProperties properties) {
        log.info("Initializing Circuit Breaker Registry");

        CircuitBreakerRegistry registry = CircuitBreakerRegistry.ofDefaults();
        registry.circuitBreaker(LANGUAGE_MODEL, languageModelCircuitBreakerConfig(properties.getSynthesis()));

        log.info("Circuit Breaker Registry initialized with {} configurations",
            registry.getAllCircuitBreakers().size());
        return registry;
    }

    @Bean
    public RetryRegistry retryRegistry(GroupInsightsProperties properties) {
        log.info("Initializing Retry Registry");

        RetryRegistry registry = RetryRegistry.ofDefaults();
        registry.retry(LANGUAGE_MODEL, languageModelRetryConfig(properties.getSynthesis()));
        return registry;
    }

    /**
     * The single breaker instance owned by the remote synthesis path
     */
    @Bean
    public CircuitBreaker languageModelCircuitBreaker(CircuitBreakerRegistry registry) {
        CircuitBreaker circuitBreaker = registry.circuitBreaker(LANGUAGE_MODEL);
        circuitBreaker.getEventPublisher()
            .onStateTransition(event -> log.warn("Language model circuit breaker: {}",
                event.getStateTransition()));
        return circuitBreaker;
    }

    @Bean
    public Retry languageModelRetry(RetryRegistry registry) {
        Retry retry = registry.retry(LANGUAGE_MODEL);
        retry.getEventPublisher()
            .onRetry(event -> log.warn("Retrying language model call (attempt {}): {}",
                event.getNumberOfRetryAttempts(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
        return retry;
    }

    public static CircuitBreakerConfig languageModelCircuitBreakerConfig(GroupInsightsProperties.Synthesis synthesis) {
        return CircuitBreakerConfig.custom()
            .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
            .slidingWindowSize(synthesis.getFailureThreshold())
            .minimumNumberOfCalls(synthesis.getFailureThreshold())
            .failureRateThreshold(100) // Open only when every call in the window failed
            .waitDurationInOpenState(synthesis.getResetTimeout())
            .permittedNumberOfCallsInHalfOpenState(1)
            .automaticTransitionFromOpenToHalfOpenEnabled(false)
            .build();
    }

    public static RetryConfig languageModelRetryConfig(GroupInsightsProperties.Synthesis synthesis) {
        return RetryConfig.custom()
            .maxAttempts(synthesis.getMaxAttempts())
            .intervalFunction(IntervalFunction.ofExponentialBackoff(synthesis.getInitialBackoff(), 2.0))
            .retryOnException(ResilienceConfig::isRetryable)
            .failAfterMaxAttempts(false)
            .build();
    }

    static boolean isRetryable(Throwable throwable) {
        return throwable instanceof LanguageModelException
            && ((LanguageModelException) throwable).isRetryable();
    }
}
