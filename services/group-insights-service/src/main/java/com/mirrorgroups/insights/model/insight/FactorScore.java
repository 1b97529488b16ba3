package com.mirrorgroups.insights.model.insight;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One compatibility factor. {@code hasData=false} marks the neutral 0.5 used when
 * either member did not share the underlying data.
 */
@Value
@Builder
@Jacksonized
public class FactorScore {

    public static final double NEUTRAL = 0.5;

    double score;

    boolean hasData;

    public static FactorScore of(double score) {
        return new FactorScore(Math.max(0.0, Math.min(1.0, score)), true);
    }

    public static FactorScore neutral() {
        return new FactorScore(NEUTRAL, false);
    }
}
