package com.mirrorgroups.insights.model.insight;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class AnalysisOptions {

    @Builder.Default
    boolean includeCompatibility = true;

    @Builder.Default
    boolean includeStrengths = true;

    @Builder.Default
    boolean includeRisks = true;

    @Builder.Default
    boolean includeGoalAlignment = true;

    @Builder.Default
    boolean includeSynthesis = true;

    boolean forceRefresh;

    @Builder.Default
    double confidenceThreshold = 0.7;

    public static AnalysisOptions defaults() {
        return AnalysisOptions.builder().build();
    }
}
