package com.mirrorgroups.insights.model.insight;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Pair score buckets: low below 0.4, high above 0.7, neutral exactly 0.5,
 * medium for everything else.
 */
@Value
@Builder
@Jacksonized
public class ScoreDistribution {

    int low;

    int medium;

    int high;

    int neutral;
}
