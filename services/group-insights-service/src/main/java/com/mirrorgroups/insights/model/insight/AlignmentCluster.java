package com.mirrorgroups.insights.model.insight;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
public class AlignmentCluster {

    String goal;

    List<String> memberIds;

    /**
     * Fraction of the group holding the goal
     */
    double strength;

    @Builder
    @Jacksonized
    private AlignmentCluster(String goal, List<String> memberIds, double strength) {
        this.goal = goal;
        this.memberIds = memberIds == null ? List.of() : List.copyOf(memberIds);
        this.strength = strength;
    }
}
