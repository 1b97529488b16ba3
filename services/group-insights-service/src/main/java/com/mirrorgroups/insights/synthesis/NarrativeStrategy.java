package com.mirrorgroups.insights.synthesis;

import com.mirrorgroups.insights.model.insight.GroupAnalysisResult;
import com.mirrorgroups.insights.model.insight.NarrativeSynthesis;

/**
 * Turns a completed analysis into a human-readable synthesis.
 */
public interface NarrativeStrategy {

    NarrativeSynthesis synthesize(GroupAnalysisResult result);
}
