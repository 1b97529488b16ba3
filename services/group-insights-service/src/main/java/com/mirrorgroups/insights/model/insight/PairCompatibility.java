package com.mirrorgroups.insights.model.insight;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Compatibility detail for one unordered member pair; {@code memberA} is always the
 * lexicographically smaller ID.
 */
@Value
public class PairCompatibility {

    String memberA;

    String memberB;

    double score;

    double confidence;

    CompatibilityFactors factors;

    List<String> strengths;

    List<String> challenges;

    List<String> recommendations;

    @Builder
    @Jacksonized
    private PairCompatibility(String memberA, String memberB, double score, double confidence,
                              CompatibilityFactors factors, List<String> strengths,
                              List<String> challenges, List<String> recommendations) {
        this.memberA = memberA;
        this.memberB = memberB;
        this.score = score;
        this.confidence = confidence;
        this.factors = factors;
        this.strengths = strengths == null ? List.of() : List.copyOf(strengths);
        this.challenges = challenges == null ? List.of() : List.copyOf(challenges);
        this.recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }
}
