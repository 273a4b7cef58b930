package com.syncnest.identityservice.service;

import com.syncnest.identityservice.entity.ActionTokenPurpose;
import com.syncnest.identityservice.entity.User;

import java.util.UUID;

/**
 * Issues and redeems single-use password-reset and email-verification tokens.
 */
public interface ActionTokenService {

    /**
     * Creates a new token for {@code purpose}; earlier unconsumed tokens of the same purpose
     * for this user stop working.
     *
     * @return the raw token to send to the user; only its hash is stored
     */
    String issue(User user, ActionTokenPurpose purpose);

    /**
     * Consumes the token. Must run inside the caller's transaction so that consumption
     * commits or rolls back together with the action it authorises.
     *
     * @throws com.syncnest.identityservice.exception.AuthExceptions.InvalidOrExpiredToken when the token
     *         is unknown, belongs to another user, was already used or has expired
     */
    void redeem(String rawToken, UUID userId, ActionTokenPurpose purpose);

    /** Housekeeping: delete expired and consumed tokens. */
    int purgeExpiredAndConsumed();
}
