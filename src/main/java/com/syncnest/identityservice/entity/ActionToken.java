package com.syncnest.identityservice.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Single-use token for password reset or email verification.
 * Only the SHA-256 hash of the value handed to the user is persisted.
 */
@Entity
@Table(
        name = "action_tokens",
        indexes = {
                @Index(name = "ix_action_user_purpose", columnList = "user_id, purpose"),
                @Index(name = "ix_action_expires", columnList = "expires_at")
        },
        uniqueConstraints = @UniqueConstraint(name = "uk_action_token_hash", columnNames = "token_hash")
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ActionToken {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "token_hash", nullable = false, length = 64)
    private String tokenHash;

    @Enumerated(EnumType.STRING)
    @Column(name = "purpose", nullable = false, length = 30)
    private ActionTokenPurpose purpose;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false)
    private User user;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Column(name = "consumed_at")
    private Instant consumedAt;
}
