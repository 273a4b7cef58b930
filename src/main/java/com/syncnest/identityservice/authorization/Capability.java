package com.syncnest.identityservice.authorization;

/**
 * Named preconditions a route can require of the calling principal.
 * Object-level ownership is checked separately through
 * {@link AuthorizationEvaluator#isOwnerOrAdmin(AuthenticatedPrincipal, java.util.UUID)}.
 */
public enum Capability {
    /** A valid, unexpired access token was presented. */
    AUTHENTICATED,
    /** Authenticated and the account is active. */
    ACTIVE,
    /** Authenticated and the account is not blocked. */
    NOT_BLOCKED,
    /** Active and the email address has been verified. */
    VERIFIED,
    /** Authenticated with role ADMIN. */
    ADMIN,
    /** Authenticated with role ADMIN or MODERATOR. */
    STAFF
}
