package com.mirrorgroups.insights.model.insight;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class RiskSummary {

    int criticalCount;

    int highCount;

    int mediumCount;

    int lowCount;

    ConflictRisk topRisk;

    String overallRiskLevel;

    List<String> recommendations;
}
