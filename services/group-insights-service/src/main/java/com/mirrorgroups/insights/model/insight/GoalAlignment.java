package com.mirrorgroups.insights.model.insight;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
public class GoalAlignment {

    double overallAlignment;

    List<String> sharedGoals;

    List<String> divergentGoals;

    List<AlignmentCluster> clusters;

    @Builder
    @Jacksonized
    private GoalAlignment(double overallAlignment, List<String> sharedGoals, List<String> divergentGoals,
                          List<AlignmentCluster> clusters) {
        this.overallAlignment = overallAlignment;
        this.sharedGoals = sharedGoals == null ? List.of() : List.copyOf(sharedGoals);
        this.divergentGoals = divergentGoals == null ? List.of() : List.copyOf(divergentGoals);
        this.clusters = clusters == null ? List.of() : List.copyOf(clusters);
    }
}
