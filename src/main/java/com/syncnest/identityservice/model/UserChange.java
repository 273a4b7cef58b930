package com.syncnest.identityservice.model;

import com.syncnest.identityservice.entity.User;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Result of a credential-store update: the persisted user plus explicit before/after snapshots.
 */
public record UserChange(User user, UserSnapshot before, UserSnapshot after) {

    public UserChange {
        Objects.requireNonNull(user, "user");
        Objects.requireNonNull(before, "before");
        Objects.requireNonNull(after, "after");
    }

    public Set<UserEvent> events() {
        return diff(before, after);
    }

    public boolean revokesSessions() {
        return events().stream().anyMatch(UserEvent::revokesSessions);
    }

    /** Transitions from {@code before} to {@code after}; empty when nothing security-relevant changed. */
    public static Set<UserEvent> diff(UserSnapshot before, UserSnapshot after) {
        Set<UserEvent> events = EnumSet.noneOf(UserEvent.class);
        if (before.role() != after.role()) {
            events.add(UserEvent.ROLE_CHANGED);
        }
        if (before.active() != after.active()) {
            events.add(after.active() ? UserEvent.ACTIVATED : UserEvent.DEACTIVATED);
        }
        if (before.blocked() != after.blocked()) {
            events.add(after.blocked() ? UserEvent.BLOCKED : UserEvent.UNBLOCKED);
        }
        if (!before.emailVerified() && after.emailVerified()) {
            events.add(UserEvent.EMAIL_VERIFIED);
        }
        if (!Objects.equals(before.passwordHash(), after.passwordHash())) {
            events.add(UserEvent.PASSWORD_CHANGED);
        }
        if (!before.deleted() && after.deleted()) {
            events.add(UserEvent.DELETED);
        }
        return events;
    }
}
