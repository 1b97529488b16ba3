package com.mirrorgroups.insights.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Queued request to analyze one group.
 *
 * Lifecycle:
 * 1. PENDING - waiting to be picked up, possibly not before {@code nextRetryAt}
 * 2. PROCESSING - claimed by a processor
 * 3. COMPLETED - analysis finished (terminal)
 * 4. FAILED - last attempt failed with no retries remaining (terminal)
 *
 * A failed attempt with retries remaining returns the job to PENDING.
 *
 * @author MirrorGroups Insights Team
 * @version 1.0.0
 * @since 2026-10-01
 */
@Entity
@Table(name = "analysis_jobs", indexes = {
    @Index(name = "idx_analysis_jobs_group", columnList = "group_id"),
    @Index(name = "idx_analysis_jobs_ready", columnList = "status, next_retry_at, priority, created_at"),
    @Index(name = "idx_analysis_jobs_completed_at", columnList = "completed_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString(exclude = {"resultSummary"})
@EqualsAndHashCode(of = "id")
public class AnalysisJob {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "group_id", nullable = false, length = 100)
    private String groupId;

    /**
     * Requested analysis kind
     */
    @Column(name = "analysis_type", nullable = false, length = 50)
    @Builder.Default
    private String analysisType = "full";

    /**
     * Higher runs first
     */
    @Column(name = "priority", nullable = false)
    @Builder.Default
    private Integer priority = 5;

    /**
     * What caused the request, e.g. "member_data_shared"
     */
    @Column(name = "trigger_event", length = 100)
    private String triggerEvent;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    private JobStatus status = JobStatus.PENDING;

    /**
     * Failed attempts so far
     */
    @Column(name = "retry_count", nullable = false)
    @Builder.Default
    private Integer retryCount = 0;

    @Column(name = "next_retry_at")
    private LocalDateTime nextRetryAt;

    /**
     * Message of the most recent failure, kept verbatim
     */
    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "started_at")
    private LocalDateTime startedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    /**
     * Short JSON summary of the produced analysis
     */
    @Column(name = "result_summary", columnDefinition = "TEXT")
    private String resultSummary;

    /**
     * Optimistic locking version
     */
    @Version
    @Column(name = "version", nullable = false)
    @Builder.Default
    private Long version = 0L;

    public enum JobStatus {
        PENDING,
        PROCESSING,
        COMPLETED,
        FAILED
    }

    /**
     * Pending and not waiting out a retry delay
     */
    public boolean isReady(LocalDateTime now) {
        return status == JobStatus.PENDING && (nextRetryAt == null || !nextRetryAt.isAfter(now));
    }

    public boolean isTerminal() {
        return status == JobStatus.COMPLETED || status == JobStatus.FAILED;
    }

    public void markProcessing(LocalDateTime now) {
        this.status = JobStatus.PROCESSING;
        this.startedAt = now;
    }

    public void markCompleted(String summary, LocalDateTime now) {
        this.status = JobStatus.COMPLETED;
        this.resultSummary = summary;
        this.completedAt = now;
        this.nextRetryAt = null;
    }

    /**
     * Record a failed attempt. The job goes back to PENDING while
     * {@code retryCount + 1 < maxRetries}, otherwise it is marked FAILED.
     *
     * @return true when another attempt was scheduled
     */
    public boolean recordFailure(String error, int maxRetries, Duration retryDelay, LocalDateTime now) {
        boolean retry = retryCount + 1 < maxRetries;
        this.retryCount = retryCount + 1;
        this.lastError = error;
        if (retry) {
            this.status = JobStatus.PENDING;
            this.nextRetryAt = now.plus(retryDelay);
        } else {
            this.status = JobStatus.FAILED;
            this.completedAt = now;
            this.nextRetryAt = null;
        }
        return retry;
    }

    public Duration processingTime() {
        if (startedAt == null || completedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, completedAt);
    }
}
