package com.mirrorgroups.insights.entity;

public enum InsightType {
    FULL_ANALYSIS,
    COMPATIBILITY,
    STRENGTHS,
    RISKS,
    GOAL_ALIGNMENT,
    SYNTHESIS
}
