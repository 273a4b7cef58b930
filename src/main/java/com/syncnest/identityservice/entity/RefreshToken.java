package com.syncnest.identityservice.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Server-side record of an issued refresh token, keyed by its {@code jti} claim.
 * The signed token itself is never stored. Once {@code revoked} is set it is never cleared.
 */
@Entity
@Table(
        name = "refresh_tokens",
        indexes = {
                @Index(name = "ix_refresh_user", columnList = "user_id"),
                @Index(name = "ix_refresh_expires", columnList = "expires_at")
        },
        uniqueConstraints = @UniqueConstraint(name = "uk_refresh_jti", columnNames = "jti")
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RefreshToken {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "jti", nullable = false, length = 64)
    private String jti;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false)
    private User user;

    /** Client-supplied device label, "unknown" when absent. */
    @Column(name = "device_id", nullable = false, length = 64)
    private String deviceId;

    @Column(name = "issued_at", nullable = false)
    private Instant issuedAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Builder.Default
    @Column(name = "revoked", nullable = false)
    private boolean revoked = false;

    @Column(name = "revoked_at")
    private Instant revokedAt;
}
