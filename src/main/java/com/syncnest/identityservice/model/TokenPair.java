package com.syncnest.identityservice.model;

import java.time.Instant;

/**
 * Access + refresh token pair handed to a client.
 *
 * @param accessExpiresIn seconds until the access token expires
 */
public record TokenPair(
        String accessToken,
        String refreshToken,
        long accessExpiresIn,
        Instant refreshExpiresAt
) {}
