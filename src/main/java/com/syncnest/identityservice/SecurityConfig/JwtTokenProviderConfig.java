package com.syncnest.identityservice.SecurityConfig;

import com.syncnest.identityservice.model.TokenClaims;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;

/**
 * HS256 signing and verification of access and refresh tokens.
 * <p>
 * Claims: {@code sub} = user id, {@code typ} = access|refresh, {@code jti}, {@code iat}, {@code exp},
 * plus {@code iss}/{@code aud} when configured. Verification is signature + expiry + type only.
 */
@Slf4j
@Component
public class JwtTokenProviderConfig {

    public static final String TYPE_CLAIM = "typ";
    public static final String ACCESS = "access";
    public static final String REFRESH = "refresh";

    private final Duration accessTtl;
    private final Duration refreshTtl;
    private final String issuer;
    private final String audience;

    /** Cached signing key & parser; both are thread-safe. */
    private final SecretKey signingKey;
    private final JwtParser jwtParser;

    public JwtTokenProviderConfig(@Value("${token.key.secret}") String secret,
                                  @Value("${token.key.jwtExpiration:3600000}") long accessTtlMs,
                                  @Value("${refresh-token.expiration.milliseconds:604800000}") long refreshTtlMs,
                                  @Value("${token.key.issuer:}") String issuer,
                                  @Value("${token.key.audience:}") String audience,
                                  Clock clock) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("JWT secret must be provided (base64).");
        }
        final byte[] keyBytes;
        try {
            keyBytes = Decoders.BASE64.decode(secret.trim());
        } catch (RuntimeException e) {
            throw new IllegalStateException("JWT secret must be valid Base64.", e);
        }
        // HS256 requires >= 256-bit (32 bytes) key
        if (keyBytes.length < 32) {
            throw new IllegalStateException("JWT secret too short for HS256. Provide >= 256-bit Base64 key.");
        }
        if (accessTtlMs <= 0 || refreshTtlMs <= 0) {
            throw new IllegalStateException("Token lifetimes must be positive.");
        }

        this.accessTtl = Duration.ofMillis(accessTtlMs);
        this.refreshTtl = Duration.ofMillis(refreshTtlMs);
        this.issuer = blankToNull(issuer);
        this.audience = blankToNull(audience);
        this.signingKey = Keys.hmacShaKeyFor(keyBytes);

        var parserBuilder = Jwts.parser()
                .verifyWith(signingKey)
                .clock(() -> Date.from(clock.instant()))
                .clockSkewSeconds(30);
        if (this.issuer != null) {
            parserBuilder = parserBuilder.requireIssuer(this.issuer);
        }
        if (this.audience != null) {
            parserBuilder = parserBuilder.requireAudience(this.audience);
        }
        this.jwtParser = parserBuilder.build();
    }

    public String generateAccessToken(UUID userId, String jti, Instant issuedAt) {
        return createToken(userId, jti, ACCESS, issuedAt, issuedAt.plus(accessTtl));
    }

    public String generateRefreshToken(UUID userId, String jti, Instant issuedAt) {
        return createToken(userId, jti, REFRESH, issuedAt, issuedAt.plus(refreshTtl));
    }

    /**
     * Verifies signature, expiry (with 30s skew) and the {@code typ} claim.
     *
     * @throws IllegalArgumentException on any failure; the message is for logs only
     */
    public TokenClaims parse(String token, String expectedType) {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("Token is blank.");
        }
        final Claims claims;
        try {
            claims = jwtParser.parseSignedClaims(token).getPayload();
        } catch (JwtException | IllegalArgumentException e) {
            throw new IllegalArgumentException("Failed to parse JWT token: " + e.getMessage(), e);
        }
        String type = claims.get(TYPE_CLAIM, String.class);
        if (!expectedType.equals(type)) {
            throw new IllegalArgumentException("Unexpected token type: " + type);
        }
        if (claims.getId() == null || claims.getSubject() == null || claims.getExpiration() == null) {
            throw new IllegalArgumentException("Token is missing required claims.");
        }
        final UUID userId;
        try {
            userId = UUID.fromString(claims.getSubject());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Token subject is not a user id.", e);
        }
        Date iat = claims.getIssuedAt();
        return new TokenClaims(
                userId,
                claims.getId(),
                type,
                iat != null ? iat.toInstant() : null,
                claims.getExpiration().toInstant()
        );
    }

    public long getAccessTokenValiditySeconds() {
        return accessTtl.toSeconds();
    }

    public Duration getRefreshTokenValidity() {
        return refreshTtl;
    }

    private String createToken(UUID userId, String jti, String type, Instant issuedAt, Instant expiresAt) {
        var builder = Jwts.builder()
                .subject(userId.toString())
                .id(jti)
                .claim(TYPE_CLAIM, type)
                .issuedAt(Date.from(issuedAt))
                .notBefore(Date.from(issuedAt))
                .expiration(Date.from(expiresAt));
        if (issuer != null) {
            builder = builder.issuer(issuer);
        }
        if (audience != null) {
            builder = builder.audience().add(audience).and();
        }
        return builder.signWith(signingKey, Jwts.SIG.HS256).compact();
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s.trim();
    }
}
