package com.mirrorgroups.insights.model.insight;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
public class NarrativeSynthesis {

    String overview;

    List<String> keyInsights;

    List<String> recommendations;

    Narratives narratives;

    SynthesisStrategy strategy;

    @Builder
    @Jacksonized
    private NarrativeSynthesis(String overview, List<String> keyInsights, List<String> recommendations,
                               Narratives narratives, SynthesisStrategy strategy) {
        this.overview = overview;
        this.keyInsights = keyInsights == null ? List.of() : List.copyOf(keyInsights);
        this.recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
        this.narratives = narratives;
        this.strategy = strategy;
    }
}
