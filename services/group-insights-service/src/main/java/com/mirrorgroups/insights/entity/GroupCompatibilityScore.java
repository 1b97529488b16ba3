package com.mirrorgroups.insights.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Pair compatibility row; member_a is always the lexicographically smaller ID.
 */
@Entity
@Table(name = "group_compatibility_scores",
    uniqueConstraints = @UniqueConstraint(name = "uk_group_compat_pair", columnNames = {"group_id", "member_a", "member_b"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@EqualsAndHashCode(of = "id")
public class GroupCompatibilityScore {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "group_id", nullable = false, length = 100)
    private String groupId;

    @Column(name = "member_a", nullable = false, length = 100)
    private String memberA;

    @Column(name = "member_b", nullable = false, length = 100)
    private String memberB;

    @Column(name = "score", nullable = false)
    private Double score;

    @Column(name = "confidence", nullable = false)
    private Double confidence;

    /**
     * JSON of the four factor scores
     */
    @Column(name = "factors", columnDefinition = "TEXT")
    private String factors;

    @Column(name = "calculated_at", nullable = false)
    private LocalDateTime calculatedAt;
}
