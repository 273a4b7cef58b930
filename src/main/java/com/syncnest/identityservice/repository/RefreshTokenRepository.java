package com.syncnest.identityservice.repository;

import com.syncnest.identityservice.entity.RefreshToken;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

public interface RefreshTokenRepository extends JpaRepository<RefreshToken, Long> {

    Optional<RefreshToken> findByJti(String jti);

    boolean existsByJtiAndRevokedFalse(String jti);

    /** Flips a live token to revoked. Returns 1 only for the caller whose update won. */
    @Modifying(flushAutomatically = true)
    @Query("update RefreshToken t set t.revoked = true, t.revokedAt = :now " +
            "where t.jti = :jti and t.revoked = false")
    int revokeIfLive(@Param("jti") String jti, @Param("now") Instant now);

    @Modifying(flushAutomatically = true)
    @Query("update RefreshToken t set t.revoked = true, t.revokedAt = :now " +
            "where t.user.id = :userId and t.revoked = false and t.expiresAt > :now")
    int revokeAllLiveForUser(@Param("userId") UUID userId, @Param("now") Instant now);

    long countByUser_IdAndRevokedFalseAndExpiresAtAfter(UUID userId, Instant now);

    @Modifying
    @Query("delete from RefreshToken t where t.expiresAt < :now or t.revoked = true")
    int deleteExpiredOrRevoked(@Param("now") Instant now);
}
