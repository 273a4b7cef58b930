package com.syncnest.identityservice.serviceImpl;

import com.syncnest.identityservice.SecurityConfig.JwtTokenProviderConfig;
import com.syncnest.identityservice.entity.User;
import com.syncnest.identityservice.exception.AuthExceptions;
import com.syncnest.identityservice.model.TokenClaims;
import com.syncnest.identityservice.model.TokenPair;
import com.syncnest.identityservice.repository.UserRepository;
import com.syncnest.identityservice.service.TokenRevocationStore;
import com.syncnest.identityservice.service.TokenService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Refresh tokens are signed JWTs whose {@code jti} is tracked in the {@link TokenRevocationStore}.
 * Every failure surfaces as the same {@link AuthExceptions.Unauthorized}; the cause is logged at debug.
 */
@Slf4j
@Service
public class TokenServiceImpl implements TokenService {

    private static final int MAX_DEVICE_ID_LENGTH = 64;

    private final JwtTokenProviderConfig jwt;
    private final TokenRevocationStore revocationStore;
    private final UserRepository userRepository;
    private final Clock clock;
    private final boolean rotate;

    public TokenServiceImpl(JwtTokenProviderConfig jwt,
                            TokenRevocationStore revocationStore,
                            UserRepository userRepository,
                            Clock clock,
                            @Value("${refresh-token.rotate:true}") boolean rotate) {
        this.jwt = jwt;
        this.revocationStore = revocationStore;
        this.userRepository = userRepository;
        this.clock = clock;
        this.rotate = rotate;
    }

    @Override
    @Transactional
    public TokenPair issue(User user, String deviceId) {
        Objects.requireNonNull(user.getId(), "user must be persisted");
        Instant now = clock.instant();
        String refreshJti = newJti();
        Instant refreshExpiresAt = now.plus(jwt.getRefreshTokenValidity());

        String access = jwt.generateAccessToken(user.getId(), newJti(), now);
        String refresh = jwt.generateRefreshToken(user.getId(), refreshJti, now);
        revocationStore.track(refreshJti, user.getId(), normalizeDevice(deviceId), now, refreshExpiresAt);

        return new TokenPair(access, refresh, jwt.getAccessTokenValiditySeconds(), refreshExpiresAt);
    }

    @Override
    public TokenClaims verifyAccess(String accessToken) {
        try {
            return jwt.parse(accessToken, JwtTokenProviderConfig.ACCESS);
        } catch (IllegalArgumentException e) {
            log.debug("Access token rejected: {}", e.getMessage());
            throw invalidToken();
        }
    }

    @Override
    @Transactional
    public TokenPair refresh(String refreshToken) {
        TokenClaims claims = parseRefresh(refreshToken)
                .orElseThrow(TokenServiceImpl::invalidToken);

        TokenRevocationStore.TrackedToken tracked = revocationStore.find(claims.jti())
                .filter(t -> t.userId().equals(claims.userId()))
                .orElseThrow(() -> {
                    log.debug("Refresh token jti={} is not tracked", claims.jti());
                    return invalidToken();
                });
        if (tracked.revoked()) {
            log.warn("Revoked refresh token presented for user={} jti={}", claims.userId(), claims.jti());
            throw invalidToken();
        }

        User user = userRepository.findByIdAndDeletedFalse(claims.userId())
                .filter(User::canAuthenticate)
                .orElseThrow(() -> {
                    log.debug("Refresh denied: user={} missing, inactive or blocked", claims.userId());
                    return invalidToken();
                });

        if (!rotate) {
            Instant now = clock.instant();
            String access = jwt.generateAccessToken(user.getId(), newJti(), now);
            return new TokenPair(access, refreshToken, jwt.getAccessTokenValiditySeconds(), tracked.expiresAt());
        }

        // Revoke first: only the caller whose update flipped the row may mint a successor.
        if (!revocationStore.add(claims.jti())) {
            log.warn("Concurrent reuse of refresh token for user={} jti={}", claims.userId(), claims.jti());
            throw invalidToken();
        }
        return issue(user, tracked.deviceId());
    }

    @Override
    @Transactional
    public boolean revoke(String refreshToken, UUID ownerId) {
        Optional<TokenClaims> claims = parseRefresh(refreshToken);
        if (claims.isEmpty() || !claims.get().userId().equals(ownerId)) {
            return false;
        }
        if (revocationStore.add(claims.get().jti())) {
            log.info("Revoked refresh token for user={}", ownerId);
        }
        return true;
    }

    @Override
    @Transactional
    public int revokeAll(UUID userId) {
        int revoked = revocationStore.addAll(userId);
        log.info("Revoked {} refresh token(s) for user={}", revoked, userId);
        return revoked;
    }

    @Override
    @Transactional
    public int purgeExpiredAndRevoked() {
        return revocationStore.purge(clock.instant());
    }

    // -------------------- helpers --------------------

    private Optional<TokenClaims> parseRefresh(String refreshToken) {
        try {
            return Optional.of(jwt.parse(refreshToken, JwtTokenProviderConfig.REFRESH));
        } catch (IllegalArgumentException e) {
            log.debug("Refresh token rejected: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private static AuthExceptions.Unauthorized invalidToken() {
        return new AuthExceptions.Unauthorized(AuthExceptions.INVALID_TOKEN);
    }

    private static String newJti() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    private static String normalizeDevice(String deviceId) {
        String d = (deviceId == null) ? "" : deviceId.trim();
        if (d.isEmpty()) return "unknown";
        return d.length() > MAX_DEVICE_ID_LENGTH ? d.substring(0, MAX_DEVICE_ID_LENGTH) : d;
    }
}
