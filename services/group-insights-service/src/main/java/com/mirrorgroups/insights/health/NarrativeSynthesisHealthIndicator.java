package com.mirrorgroups.insights.health;

import com.mirrorgroups.insights.synthesis.NarrativeSynthesizer;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports the language model circuit. An open or probing circuit is DEGRADED rather
 * than DOWN: synthesis keeps working from templates.
 */
@Component
@RequiredArgsConstructor
public class NarrativeSynthesisHealthIndicator implements HealthIndicator {

    private final NarrativeSynthesizer narrativeSynthesizer;

    @Override
    public Health health() {
        CircuitBreaker.State state = narrativeSynthesizer.circuitState();

        Health.Builder builder = state == CircuitBreaker.State.CLOSED
            ? Health.up()
            : Health.status(InsightsHealthStatus.DEGRADED);

        return builder
            .withDetail("circuitState", state.name())
            .withDetail("failureCount", narrativeSynthesizer.failureCount())
            .withDetail("mode", narrativeSynthesizer.mode())
            .build();
    }
}
