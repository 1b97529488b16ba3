package com.mirrorgroups.insights.model.insight;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
public class AnalysisMetadata {

    long processingTimeMs;

    String dataVersion;

    List<String> algorithmsUsed;

    double overallConfidence;

    @Builder
    @Jacksonized
    private AnalysisMetadata(long processingTimeMs, String dataVersion, List<String> algorithmsUsed,
                             double overallConfidence) {
        this.processingTimeMs = processingTimeMs;
        this.dataVersion = dataVersion;
        this.algorithmsUsed = algorithmsUsed == null ? List.of() : List.copyOf(algorithmsUsed);
        this.overallConfidence = overallConfidence;
    }
}
