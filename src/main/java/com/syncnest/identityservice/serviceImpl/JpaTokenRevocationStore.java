package com.syncnest.identityservice.serviceImpl;

import com.syncnest.identityservice.entity.RefreshToken;
import com.syncnest.identityservice.repository.RefreshTokenRepository;
import com.syncnest.identityservice.repository.UserRepository;
import com.syncnest.identityservice.service.TokenRevocationStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Revocation set backed by the {@code refresh_tokens} table. Revocation is a conditional
 * update on {@code revoked = false}, so the database row lock decides concurrent races.
 * Every call must join the caller's transaction.
 */
@Repository
@RequiredArgsConstructor
@Transactional(propagation = Propagation.MANDATORY)
public class JpaTokenRevocationStore implements TokenRevocationStore {

    private final RefreshTokenRepository refreshTokenRepo;
    private final UserRepository userRepository;
    private final Clock clock;

    @Override
    public void track(String jti, UUID userId, String deviceId, Instant issuedAt, Instant expiresAt) {
        refreshTokenRepo.save(RefreshToken.builder()
                .jti(jti)
                .user(userRepository.getReferenceById(userId))
                .deviceId(deviceId)
                .issuedAt(issuedAt)
                .expiresAt(expiresAt)
                .revoked(false)
                .build());
    }

    @Override
    public Optional<TrackedToken> find(String jti) {
        return refreshTokenRepo.findByJti(jti)
                .map(t -> new TrackedToken(t.getJti(), t.getUser().getId(), t.getDeviceId(),
                        t.getExpiresAt(), t.isRevoked()));
    }

    @Override
    public boolean add(String jti) {
        return refreshTokenRepo.revokeIfLive(jti, clock.instant()) == 1;
    }

    @Override
    public int addAll(UUID userId) {
        return refreshTokenRepo.revokeAllLiveForUser(userId, clock.instant());
    }

    @Override
    public int purge(Instant now) {
        return refreshTokenRepo.deleteExpiredOrRevoked(now);
    }
}
