package com.mirrorgroups.insights.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * A member's encrypted data share with a group. Written by the sharing flow; this
 * service only reads it.
 */
@Entity
@Table(name = "group_shared_data", indexes = {
    @Index(name = "idx_group_shared_data_group", columnList = "group_id, shared_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString(exclude = {"encryptedPayload"})
@EqualsAndHashCode(of = "id")
public class SharedMemberData {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "group_id", nullable = false, length = 100)
    private String groupId;

    @Column(name = "user_id", nullable = false, length = 100)
    private String userId;

    /**
     * personality, behavioral, cognitive, values or full_profile
     */
    @Column(name = "data_type", nullable = false, length = 30)
    private String dataType;

    /**
     * Base64 of IV followed by AES-GCM ciphertext and tag
     */
    @Column(name = "encrypted_payload", columnDefinition = "TEXT", nullable = false)
    private String encryptedPayload;

    @Column(name = "shared_at", nullable = false)
    private LocalDateTime sharedAt;
}
