package com.mirrorgroups.insights.model.insight;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * A pattern shared by enough of the group to count as a collective trait.
 */
@Value
public class CollectiveStrength {

    String id;

    /**
     * Normalized snake_case pattern name
     */
    String name;

    StrengthCategory category;

    double prevalence;

    double strength;

    int memberCount;

    double confidence;

    List<String> applications;

    String description;

    @Builder(toBuilder = true)
    @Jacksonized
    private CollectiveStrength(String id, String name, StrengthCategory category, double prevalence,
                               double strength, int memberCount, double confidence,
                               List<String> applications, String description) {
        this.id = id;
        this.name = name;
        this.category = category;
        this.prevalence = prevalence;
        this.strength = strength;
        this.memberCount = memberCount;
        this.confidence = confidence;
        this.applications = applications == null ? List.of() : List.copyOf(applications);
        this.description = description;
    }

    public double rankingWeight() {
        return prevalence * strength * confidence;
    }
}
