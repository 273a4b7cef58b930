package com.syncnest.identityservice.model;

import java.time.Instant;
import java.util.UUID;

/** Verified claims of an access or refresh token. {@code type} is "access" or "refresh". */
public record TokenClaims(
        UUID userId,
        String jti,
        String type,
        Instant issuedAt,
        Instant expiresAt
) {}
