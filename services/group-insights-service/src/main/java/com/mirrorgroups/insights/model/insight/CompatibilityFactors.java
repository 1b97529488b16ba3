package com.mirrorgroups.insights.model.insight;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class CompatibilityFactors {

    FactorScore personality;

    FactorScore communication;

    FactorScore conflictStyle;

    FactorScore energyBalance;

    public int factorsWithData() {
        int count = 0;
        if (personality.isHasData()) count++;
        if (communication.isHasData()) count++;
        if (conflictStyle.isHasData()) count++;
        if (energyBalance.isHasData()) count++;
        return count;
    }
}
