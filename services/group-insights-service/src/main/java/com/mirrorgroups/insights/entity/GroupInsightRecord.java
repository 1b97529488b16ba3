package com.mirrorgroups.insights.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * One persisted insight block per (group, insight type). Rewritten in place on every
 * analysis run.
 */
@Entity
@Table(name = "group_insights",
    uniqueConstraints = @UniqueConstraint(name = "uk_group_insights_group_type", columnNames = {"group_id", "insight_type"}),
    indexes = {
        @Index(name = "idx_group_insights_expires", columnList = "expires_at")
    })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString(exclude = {"payload"})
@EqualsAndHashCode(of = "id")
public class GroupInsightRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "group_id", nullable = false, length = 100)
    private String groupId;

    @Enumerated(EnumType.STRING)
    @Column(name = "insight_type", nullable = false, length = 30)
    private InsightType insightType;

    @Column(name = "analysis_id", nullable = false, length = 64)
    private String analysisId;

    /**
     * JSON-serialized insight block
     */
    @Column(name = "payload", columnDefinition = "TEXT", nullable = false)
    private String payload;

    @Column(name = "confidence_score")
    private Double confidenceScore;

    @Column(name = "generated_at", nullable = false)
    private LocalDateTime generatedAt;

    @Column(name = "expires_at")
    private LocalDateTime expiresAt;
}
