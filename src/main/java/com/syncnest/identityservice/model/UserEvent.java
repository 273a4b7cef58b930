package com.syncnest.identityservice.model;

/**
 * Security-relevant transitions detected between two snapshots of a user.
 */
public enum UserEvent {
    ROLE_CHANGED(false),
    ACTIVATED(false),
    DEACTIVATED(true),
    BLOCKED(true),
    UNBLOCKED(false),
    EMAIL_VERIFIED(false),
    PASSWORD_CHANGED(true),
    DELETED(true);

    private final boolean revokesSessions;

    UserEvent(boolean revokesSessions) {
        this.revokesSessions = revokesSessions;
    }

    /** Whether every refresh token of the user must be revoked after this transition. */
    public boolean revokesSessions() {
        return revokesSessions;
    }
}
