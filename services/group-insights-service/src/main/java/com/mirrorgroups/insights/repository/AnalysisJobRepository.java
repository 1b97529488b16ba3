package com.mirrorgroups.insights.repository;

import com.mirrorgroups.insights.entity.AnalysisJob;
import com.mirrorgroups.insights.entity.AnalysisJob.JobStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Repository for analysis job persistence and queue queries
 *
 * @author MirrorGroups Insights Team
 * @version 1.0.0
 * @since 2026-10-01
 */
@Repository
public interface AnalysisJobRepository extends JpaRepository<AnalysisJob, UUID> {

    /**
     * Pending jobs whose retry delay has elapsed, highest priority first, then oldest first
     */
    @Query("SELECT j FROM AnalysisJob j WHERE j.status = :status " +
           "AND (j.nextRetryAt IS NULL OR j.nextRetryAt <= :now) " +
           "ORDER BY j.priority DESC, j.createdAt ASC")
    List<AnalysisJob> findReady(@Param("status") JobStatus status,
                                @Param("now") LocalDateTime now,
                                Pageable pageable);

    /**
     * Conditional PENDING to PROCESSING transition; returns 0 when another processor won
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE AnalysisJob j SET j.status = :processing, j.startedAt = :now, j.version = j.version + 1 " +
           "WHERE j.id = :id AND j.status = :pending")
    int claim(@Param("id") UUID id,
              @Param("pending") JobStatus pending,
              @Param("processing") JobStatus processing,
              @Param("now") LocalDateTime now);

    long countByStatus(JobStatus status);

    long countByStatusAndCompletedAtAfter(JobStatus status, LocalDateTime since);

    List<AnalysisJob> findByStatusAndCompletedAtAfter(JobStatus status, LocalDateTime since);

    List<AnalysisJob> findByGroupIdOrderByCreatedAtDesc(String groupId);
}
