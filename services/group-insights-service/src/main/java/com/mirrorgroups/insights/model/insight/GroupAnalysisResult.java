package com.mirrorgroups.insights.model.insight;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Complete output of one analysis run: the unit that is cached, persisted and
 * handed to narrative synthesis.
 *
 * <p>An insight block is null when it was disabled or its engine failed. The strength
 * and risk lists are copied on construction.
 */
@Value
@JsonIgnoreProperties(ignoreUnknown = true)
public class GroupAnalysisResult {

    String groupId;

    String analysisId;

    Instant timestamp;

    int memberCount;

    double dataCompleteness;

    CompatibilityMatrix compatibility;

    List<CollectiveStrength> strengths;

    List<ConflictRisk> risks;

    GoalAlignment goalAlignment;

    NarrativeSynthesis synthesis;

    AnalysisMetadata metadata;

    @Builder(toBuilder = true)
    @Jacksonized
    private GroupAnalysisResult(String groupId, String analysisId, Instant timestamp, int memberCount,
                                double dataCompleteness, CompatibilityMatrix compatibility,
                                List<CollectiveStrength> strengths, List<ConflictRisk> risks,
                                GoalAlignment goalAlignment, NarrativeSynthesis synthesis,
                                AnalysisMetadata metadata) {
        this.groupId = groupId;
        this.analysisId = analysisId;
        this.timestamp = timestamp;
        this.memberCount = memberCount;
        this.dataCompleteness = dataCompleteness;
        this.compatibility = compatibility;
        this.strengths = strengths == null ? null : List.copyOf(strengths);
        this.risks = risks == null ? null : List.copyOf(risks);
        this.goalAlignment = goalAlignment;
        this.synthesis = synthesis;
        this.metadata = metadata;
    }

    public boolean hasAnyInsight() {
        return compatibility != null || strengths != null || risks != null || goalAlignment != null;
    }
}
