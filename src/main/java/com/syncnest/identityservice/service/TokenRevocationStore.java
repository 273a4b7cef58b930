package com.syncnest.identityservice.service;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Revocation set for refresh tokens, keyed by {@code jti}. A token is honoured only while it is
 * tracked and not revoked; revocation is one-way.
 */
public interface TokenRevocationStore {

    /** Starts tracking a freshly issued refresh token as live. */
    void track(String jti, UUID userId, String deviceId, Instant issuedAt, Instant expiresAt);

    Optional<TrackedToken> find(String jti);

    /** True when the token must not be honoured: revoked, purged or never issued here. */
    default boolean contains(String jti) {
        return find(jti).map(TrackedToken::revoked).orElse(true);
    }

    /**
     * Revokes a live token.
     *
     * @return true only for the single caller that moved it from live to revoked
     */
    boolean add(String jti);

    /** Revokes every live token of the user; returns how many were revoked. */
    int addAll(UUID userId);

    /** Deletes rows that can no longer matter (expired or revoked). */
    int purge(Instant now);

    record TrackedToken(String jti, UUID userId, String deviceId, Instant expiresAt, boolean revoked) {}
}
