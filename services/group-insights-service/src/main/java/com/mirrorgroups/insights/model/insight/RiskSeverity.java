package com.mirrorgroups.insights.model.insight;

/**
 * Ordinal severity derived from probability x impact
 */
public enum RiskSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public static RiskSeverity fromScore(double riskScore) {
        if (riskScore >= 0.7) {
            return CRITICAL;
        }
        if (riskScore >= 0.5) {
            return HIGH;
        }
        if (riskScore >= 0.3) {
            return MEDIUM;
        }
        return LOW;
    }
}
