package com.mirrorgroups.insights.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mirrorgroups.insights.config.GroupInsightsProperties;
import com.mirrorgroups.insights.model.insight.GroupAnalysisResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Analysis Event Publisher
 *
 * Publishes completion events so that notification and UI services can pick up fresh
 * insights. Publishing is best effort: a failed send is logged, never rethrown.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AnalysisEventPublisher {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final GroupInsightsProperties properties;
    private final Clock clock;

    public void publishCompleted(GroupAnalysisResult result) {
        String topic = properties.getEvents().getAnalysisCompletedTopic();
        try {
            AnalysisCompletedEvent event = AnalysisCompletedEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .groupId(result.getGroupId())
                .analysisId(result.getAnalysisId())
                .memberCount(result.getMemberCount())
                .overallConfidence(result.getMetadata() != null ? result.getMetadata().getOverallConfidence() : 0.0)
                .insightTypes(insightTypes(result))
                .synthesisStrategy(result.getSynthesis() != null ? result.getSynthesis().getStrategy().name() : null)
                .timestamp(Instant.now(clock))
                .build();

            kafkaTemplate.send(topic, result.getGroupId(), objectMapper.writeValueAsString(event))
                .whenComplete((sendResult, ex) -> {
                    if (ex != null) {
                        log.warn("Failed to publish analysis completion for group {}: {}",
                            result.getGroupId(), ex.getMessage());
                    }
                });

            log.debug("Published analysis completion {} for group {}", result.getAnalysisId(), result.getGroupId());
        } catch (JsonProcessingException e) {
            log.error("Could not serialize completion event for group {}", result.getGroupId(), e);
        } catch (RuntimeException e) {
            log.error("Failed to publish analysis completion for group {}", result.getGroupId(), e);
        }
    }

    private static List<String> insightTypes(GroupAnalysisResult result) {
        List<String> types = new ArrayList<>();
        if (result.getCompatibility() != null) types.add("compatibility");
        if (result.getStrengths() != null) types.add("strengths");
        if (result.getRisks() != null) types.add("risks");
        if (result.getGoalAlignment() != null) types.add("goal_alignment");
        if (result.getSynthesis() != null) types.add("synthesis");
        return types;
    }
}
