package com.mirrorgroups.insights.health;

import com.mirrorgroups.insights.config.GroupInsightsProperties;
import com.mirrorgroups.insights.entity.AnalysisJob;
import com.mirrorgroups.insights.entity.AnalysisJob.JobStatus;
import com.mirrorgroups.insights.queue.AnalysisJobProcessor;
import com.mirrorgroups.insights.repository.AnalysisJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Queue depth and throughput over the last hour.
 *
 * DOWN when the processor has stopped, DEGRADED when jobs failed permanently in the
 * last hour or the backlog exceeds ten times the concurrency cap, UP otherwise.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AnalysisQueueHealthIndicator implements HealthIndicator {

    static final int BACKLOG_FACTOR = 10;

    private final AnalysisJobRepository jobRepository;
    private final AnalysisJobProcessor jobProcessor;
    private final GroupInsightsProperties properties;
    private final Clock clock;

    @Override
    public Health health() {
        try {
            LocalDateTime hourAgo = LocalDateTime.now(clock).minusHours(1);
            long pending = jobRepository.countByStatus(JobStatus.PENDING);
            long processing = jobRepository.countByStatus(JobStatus.PROCESSING);
            long failedLastHour = jobRepository.countByStatusAndCompletedAtAfter(JobStatus.FAILED, hourAgo);
            List<AnalysisJob> completed = jobRepository.findByStatusAndCompletedAtAfter(JobStatus.COMPLETED, hourAgo);
            long avgProcessingTimeMs = Math.round(completed.stream()
                .mapToLong(job -> job.processingTime().toMillis())
                .average()
                .orElse(0.0));

            Health.Builder builder;
            if (!jobProcessor.isRunning()) {
                builder = Health.down().withDetail("issue", "Job processor is not running");
            } else if (failedLastHour > 0) {
                builder = Health.status(InsightsHealthStatus.DEGRADED)
                    .withDetail("issue", "Jobs failed permanently in the last hour");
            } else if (pending > (long) properties.getQueue().getMaxConcurrentJobs() * BACKLOG_FACTOR) {
                builder = Health.status(InsightsHealthStatus.DEGRADED)
                    .withDetail("issue", "Queue backlog is growing");
            } else {
                builder = Health.up();
            }

            return builder
                .withDetail("pending", pending)
                .withDetail("processing", processing)
                .withDetail("failedLastHour", failedLastHour)
                .withDetail("avgProcessingTimeMs", avgProcessingTimeMs)
                .withDetail("runningInProcess", jobProcessor.getRunningJobs().size())
                .build();

        } catch (RuntimeException e) {
            log.warn("Queue health check failed: {}", e.getMessage());
            return Health.down()
                .withDetail("error", e.getMessage())
                .build();
        }
    }
}
