package com.syncnest.identityservice.serviceImpl;

import com.syncnest.identityservice.service.ActionTokenService;
import com.syncnest.identityservice.service.TokenService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic cleanup of expired or spent refresh and action tokens.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HousekeepingJob {

    private final TokenService tokenService;
    private final ActionTokenService actionTokenService;

    @Scheduled(cron = "${app.housekeeping.cron:0 0 * * * *}")
    public void purge() {
        int refresh = tokenService.purgeExpiredAndRevoked();
        int action = actionTokenService.purgeExpiredAndConsumed();
        log.info("Housekeeping removed {} refresh token(s) and {} action token(s)", refresh, action);
    }
}
