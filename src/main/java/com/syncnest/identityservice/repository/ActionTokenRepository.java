package com.syncnest.identityservice.repository;

import com.syncnest.identityservice.entity.ActionToken;
import com.syncnest.identityservice.entity.ActionTokenPurpose;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.UUID;

public interface ActionTokenRepository extends JpaRepository<ActionToken, Long> {

    /**
     * Marks a matching, unconsumed, unexpired token as consumed.
     * Concurrent callers presenting the same token see exactly one row update between them.
     */
    @Modifying(flushAutomatically = true)
    @Query("update ActionToken t set t.consumedAt = :now " +
            "where t.tokenHash = :hash and t.purpose = :purpose and t.user.id = :userId " +
            "and t.consumedAt is null and t.expiresAt > :now")
    int consume(@Param("hash") String tokenHash,
                @Param("purpose") ActionTokenPurpose purpose,
                @Param("userId") UUID userId,
                @Param("now") Instant now);

    @Modifying(flushAutomatically = true)
    @Query("update ActionToken t set t.consumedAt = :now " +
            "where t.user.id = :userId and t.purpose = :purpose and t.consumedAt is null")
    int invalidateOutstanding(@Param("userId") UUID userId,
                              @Param("purpose") ActionTokenPurpose purpose,
                              @Param("now") Instant now);

    @Modifying
    @Query("delete from ActionToken t where t.expiresAt < :now or t.consumedAt is not null")
    int deleteExpiredOrConsumed(@Param("now") Instant now);
}
