package com.syncnest.identityservice.authorization;

import com.syncnest.identityservice.entity.UserRole;

import java.util.Collection;
import java.util.UUID;

/**
 * Pure capability table over a principal's role and status flags.
 * <p>
 * A blocked principal satisfies no capability at all. Capabilities compose by conjunction:
 * a missing principal is {@link Decision#UNAUTHENTICATED}, any unmet capability is
 * {@link Decision#FORBIDDEN}.
 */
public final class AuthorizationEvaluator {

    private AuthorizationEvaluator() {}

    public static Decision evaluate(AuthenticatedPrincipal principal, Collection<Capability> required) {
        if (required.isEmpty()) {
            return Decision.ALLOW;
        }
        if (principal == null) {
            return Decision.UNAUTHENTICATED;
        }
        for (Capability capability : required) {
            if (!satisfies(principal, capability)) {
                return Decision.FORBIDDEN;
            }
        }
        return Decision.ALLOW;
    }

    public static boolean satisfies(AuthenticatedPrincipal principal, Capability capability) {
        if (principal == null || principal.blocked()) {
            return false;
        }
        switch (capability) {
            case AUTHENTICATED:
            case NOT_BLOCKED:
                return true;
            case ACTIVE:
                return principal.active();
            case VERIFIED:
                return principal.active() && principal.emailVerified();
            case ADMIN:
                return principal.role() == UserRole.ADMIN;
            case STAFF:
                return principal.role().isStaff();
            default:
                return false;
        }
    }

    /** Object-level check; run after the identity-level capabilities have passed. */
    public static boolean isOwnerOrAdmin(AuthenticatedPrincipal principal, UUID ownerId) {
        if (!satisfies(principal, Capability.AUTHENTICATED)) {
            return false;
        }
        return satisfies(principal, Capability.ADMIN) || principal.id().equals(ownerId);
    }
}
