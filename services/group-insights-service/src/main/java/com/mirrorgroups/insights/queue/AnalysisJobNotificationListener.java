package com.mirrorgroups.insights.queue;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Push path of the job queue: each notification carries the ID of a freshly queued job.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AnalysisJobNotificationListener {

    private final AnalysisJobProcessor jobProcessor;

    @KafkaListener(
        topics = "${insights.queue.notification-topic:group-analysis-jobs}",
        groupId = "${spring.kafka.consumer.group-id:group-insights-service}"
    )
    public void onJobQueued(String payload) {
        UUID jobId;
        try {
            jobId = UUID.fromString(payload.trim());
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring job notification with invalid ID: {}", payload);
            return;
        }

        log.debug("Received notification for job {}", jobId);
        jobProcessor.processJob(jobId);
    }
}
