package com.mirrorgroups.insights.model.insight;

public enum StrengthCategory {
    BEHAVIORAL,
    COGNITIVE,
    VALUE,
    SKILL
}
