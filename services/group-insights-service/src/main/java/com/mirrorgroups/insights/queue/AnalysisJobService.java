package com.mirrorgroups.insights.queue;

import com.mirrorgroups.insights.config.GroupInsightsProperties;
import com.mirrorgroups.insights.entity.AnalysisJob;
import com.mirrorgroups.insights.exception.AnalysisJobNotFoundException;
import com.mirrorgroups.insights.repository.AnalysisJobRepository;
import com.mirrorgroups.insights.service.InsightCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Analysis Job Service
 *
 * Entry point for requesting group analyses. A job is durable once {@link #enqueue}
 * returns; the notification that follows is only a hint to pick it up sooner, and
 * polling covers any notification that is lost.
 *
 * @author MirrorGroups Insights Team
 * @version 1.0.0
 * @since 2026-10-01
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnalysisJobService {

    private final AnalysisJobRepository jobRepository;
    private final InsightCache insightCache;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final GroupInsightsProperties properties;

    public UUID enqueue(String groupId, String triggerReason) {
        return enqueue(groupId, triggerReason, properties.getQueue().getDefaultPriority());
    }

    public UUID enqueue(String groupId, String triggerReason, int priority) {
        AnalysisJob job = jobRepository.save(AnalysisJob.builder()
            .groupId(groupId)
            .triggerEvent(triggerReason)
            .priority(priority)
            .build());

        log.info("Queued analysis job {} for group {} (trigger={}, priority={})",
            job.getId(), groupId, triggerReason, priority);

        insightCache.evict(groupId);
        notifyProcessors(job);
        return job.getId();
    }

    /**
     * @throws AnalysisJobNotFoundException when no job has that ID
     */
    @Transactional(readOnly = true)
    public AnalysisJob getJob(UUID jobId) {
        return jobRepository.findById(jobId)
            .orElseThrow(() -> new AnalysisJobNotFoundException(jobId));
    }

    @Transactional(readOnly = true)
    public List<AnalysisJob> getJobsForGroup(String groupId) {
        return jobRepository.findByGroupIdOrderByCreatedAtDesc(groupId);
    }

    private void notifyProcessors(AnalysisJob job) {
        String topic = properties.getQueue().getNotificationTopic();
        try {
            kafkaTemplate.send(topic, job.getGroupId(), job.getId().toString())
                .whenComplete((result, ex) -> {
                    if (ex != null) {
                        log.warn("Notification for job {} was not delivered, polling will pick it up: {}",
                            job.getId(), ex.getMessage());
                    }
                });
        } catch (RuntimeException e) {
            log.warn("Could not notify processors about job {}, polling will pick it up: {}",
                job.getId(), e.getMessage());
        }
    }
}
