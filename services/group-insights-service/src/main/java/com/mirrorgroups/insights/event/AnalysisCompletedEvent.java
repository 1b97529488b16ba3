package com.mirrorgroups.insights.event;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Published after a group analysis has been stored and cached
 */
@Value
@Builder
@Jacksonized
public class AnalysisCompletedEvent {

    String eventId;

    String groupId;

    String analysisId;

    int memberCount;

    double overallConfidence;

    List<String> insightTypes;

    String synthesisStrategy;

    Instant timestamp;
}
