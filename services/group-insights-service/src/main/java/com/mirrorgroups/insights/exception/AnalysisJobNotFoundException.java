package com.mirrorgroups.insights.exception;

import java.util.UUID;

public class AnalysisJobNotFoundException extends GroupInsightsException {

    public AnalysisJobNotFoundException(UUID jobId) {
        super("Analysis job not found: " + jobId);
    }
}
