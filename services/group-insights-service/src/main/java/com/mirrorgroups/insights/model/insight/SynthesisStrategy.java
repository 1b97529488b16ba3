package com.mirrorgroups.insights.model.insight;

public enum SynthesisStrategy {
    REMOTE,
    TEMPLATE
}
