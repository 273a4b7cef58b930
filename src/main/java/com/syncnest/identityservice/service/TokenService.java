package com.syncnest.identityservice.service;

import com.syncnest.identityservice.entity.User;
import com.syncnest.identityservice.model.TokenClaims;
import com.syncnest.identityservice.model.TokenPair;

import java.util.UUID;

public interface TokenService {

    /** Issue an access + refresh pair and start tracking the refresh token. */
    TokenPair issue(User user, String deviceId);

    /**
     * Pure signature + expiry check of an access token; no store lookup.
     *
     * @throws com.syncnest.identityservice.exception.AuthExceptions.Unauthorized on any failure
     */
    TokenClaims verifyAccess(String accessToken);

    /**
     * Exchange a live refresh token for a new pair. With rotation on, the presented token is
     * revoked in the same transaction that issues its successor.
     *
     * @throws com.syncnest.identityservice.exception.AuthExceptions.Unauthorized when the token is
     *         invalid, expired, revoked, or its owner may no longer authenticate
     */
    TokenPair refresh(String refreshToken);

    /**
     * Revoke one refresh token of {@code ownerId}. Repeating it is harmless.
     *
     * @return false when the token is malformed, expired or belongs to somebody else
     */
    boolean revoke(String refreshToken, UUID ownerId);

    /** Revoke every live refresh token of the user; returns the count. */
    int revokeAll(UUID userId);

    /** Housekeeping: delete expired or revoked rows. */
    int purgeExpiredAndRevoked();
}
