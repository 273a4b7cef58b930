package com.syncnest.identityservice.serviceImpl;

import com.syncnest.identityservice.model.UserChange;
import com.syncnest.identityservice.model.UserEvent;
import com.syncnest.identityservice.service.TokenService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Follow-up for a persisted user change: audit log line per event, and revocation of every
 * refresh token when an event ends the user's sessions.
 */
@Slf4j
@Component
@RequiredArgsConstructor
class UserChangeHandler {

    private final TokenService tokenService;

    void handle(UserChange change, String actor) {
        Set<UserEvent> events = change.events();
        if (events.isEmpty()) return;

        for (UserEvent event : events) {
            log.info("User event {} user={} actor={}", event, change.after().id(), actor);
        }
        if (change.revokesSessions()) {
            tokenService.revokeAll(change.after().id());
        }
    }
}
