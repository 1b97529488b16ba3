package com.mirrorgroups.insights.synthesis;

import com.mirrorgroups.insights.config.GroupInsightsProperties;
import com.mirrorgroups.insights.model.insight.GroupAnalysisResult;
import com.mirrorgroups.insights.model.insight.NarrativeSynthesis;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Narrative Synthesizer
 *
 * Chooses between the remote language model and the deterministic templates:
 * - remote disabled: templates
 * - circuit open: templates, without touching the network
 * - otherwise: remote; its failures propagate as {@code SynthesisException}
 *
 * @author MirrorGroups Insights Team
 * @version 1.0.0
 * @since 2026-10-01
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NarrativeSynthesizer {

    private final RemoteNarrativeStrategy remoteStrategy;
    private final TemplateNarrativeStrategy templateStrategy;
    private final CircuitBreaker languageModelCircuitBreaker;
    private final GroupInsightsProperties properties;
    private final MeterRegistry meterRegistry;

    public NarrativeSynthesis synthesize(GroupAnalysisResult result) {
        if (!properties.getSynthesis().isRemoteEnabled()) {
            return templateStrategy.synthesize(result);
        }

        try {
            return remoteStrategy.synthesize(result);
        } catch (CallNotPermittedException e) {
            log.warn("Language model circuit is {}, using template synthesis for group {}",
                languageModelCircuitBreaker.getState(), result.getGroupId());
            meterRegistry.counter("insights.synthesis.fallback", "reason", "circuit_open").increment();
            return templateStrategy.synthesize(result);
        }
    }

    public CircuitBreaker.State circuitState() {
        return languageModelCircuitBreaker.getState();
    }

    public int failureCount() {
        return languageModelCircuitBreaker.getMetrics().getNumberOfFailedCalls();
    }

    /**
     * "remote" when the language model is enabled, otherwise "template"
     */
    public String mode() {
        return properties.getSynthesis().isRemoteEnabled() ? "remote" : "template";
    }
}
