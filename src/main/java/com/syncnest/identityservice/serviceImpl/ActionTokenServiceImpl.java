package com.syncnest.identityservice.serviceImpl;

import com.syncnest.identityservice.entity.ActionToken;
import com.syncnest.identityservice.entity.ActionTokenPurpose;
import com.syncnest.identityservice.entity.User;
import com.syncnest.identityservice.exception.AuthExceptions;
import com.syncnest.identityservice.repository.ActionTokenRepository;
import com.syncnest.identityservice.service.ActionTokenService;
import com.syncnest.identityservice.utils.TokenHashing;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

@Slf4j
@Service
public class ActionTokenServiceImpl implements ActionTokenService {

    /** 256 bits of entropy before encoding. */
    private static final int TOKEN_BYTES = 32;

    private final ActionTokenRepository tokenRepository;
    private final Clock clock;
    private final Duration resetTtl;
    private final Duration verificationTtl;

    public ActionTokenServiceImpl(ActionTokenRepository tokenRepository,
                                  Clock clock,
                                  @Value("${app.action-token.reset-ttl-minutes:60}") long resetTtlMinutes,
                                  @Value("${app.action-token.verification-ttl-minutes:1440}") long verificationTtlMinutes) {
        this.tokenRepository = tokenRepository;
        this.clock = clock;
        this.resetTtl = Duration.ofMinutes(resetTtlMinutes);
        this.verificationTtl = Duration.ofMinutes(verificationTtlMinutes);
    }

    @Override
    @Transactional
    public String issue(User user, ActionTokenPurpose purpose) {
        Instant now = clock.instant();
        int superseded = tokenRepository.invalidateOutstanding(user.getId(), purpose, now);
        if (superseded > 0) {
            log.debug("Superseded {} outstanding {} token(s) for user={}", superseded, purpose, user.getId());
        }

        String raw = TokenHashing.randomUrlToken(TOKEN_BYTES);
        tokenRepository.save(ActionToken.builder()
                .tokenHash(TokenHashing.sha256Hex(raw))
                .purpose(purpose)
                .user(user)
                .createdAt(now)
                .expiresAt(now.plus(ttlFor(purpose)))
                .build());
        log.info("Issued {} token for user={}", purpose, user.getId());
        return raw;
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void redeem(String rawToken, UUID userId, ActionTokenPurpose purpose) {
        if (rawToken == null || rawToken.isBlank() || userId == null) {
            throw new AuthExceptions.InvalidOrExpiredToken();
        }
        int consumed = tokenRepository.consume(TokenHashing.sha256Hex(rawToken.trim()), purpose, userId, clock.instant());
        if (consumed != 1) {
            log.info("Rejected {} token for user={}", purpose, userId);
            throw new AuthExceptions.InvalidOrExpiredToken();
        }
    }

    @Override
    @Transactional
    public int purgeExpiredAndConsumed() {
        return tokenRepository.deleteExpiredOrConsumed(clock.instant());
    }

    private Duration ttlFor(ActionTokenPurpose purpose) {
        return purpose == ActionTokenPurpose.PASSWORD_RESET ? resetTtl : verificationTtl;
    }
}
