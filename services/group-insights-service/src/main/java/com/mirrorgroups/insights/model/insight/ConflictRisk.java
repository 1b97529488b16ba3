package com.mirrorgroups.insights.model.insight;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * A predicted friction area.
 *
 * <p>{@code riskScore} and {@code severity} are computed from probability and impact
 * at construction and cannot be supplied by callers.
 */
@Value
@JsonIgnoreProperties(ignoreUnknown = true)
public class ConflictRisk {

    String id;

    String type;

    List<String> affectedMembers;

    String description;

    List<String> triggers;

    List<String> mitigationStrategies;

    double probability;

    double impact;

    double riskScore;

    RiskSeverity severity;

    @Builder(toBuilder = true)
    @Jacksonized
    private ConflictRisk(String id, String type, List<String> affectedMembers, String description,
                         List<String> triggers, List<String> mitigationStrategies,
                         double probability, double impact) {
        this.id = id;
        this.type = type;
        this.affectedMembers = affectedMembers == null ? List.of() : List.copyOf(affectedMembers);
        this.description = description;
        this.triggers = triggers == null ? List.of() : List.copyOf(triggers);
        this.mitigationStrategies = mitigationStrategies == null ? List.of() : List.copyOf(mitigationStrategies);
        this.probability = probability;
        this.impact = impact;
        this.riskScore = probability * impact;
        this.severity = RiskSeverity.fromScore(this.riskScore);
    }
}
