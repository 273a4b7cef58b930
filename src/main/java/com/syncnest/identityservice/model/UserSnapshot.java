package com.syncnest.identityservice.model;

import com.syncnest.identityservice.entity.User;
import com.syncnest.identityservice.entity.UserRole;

import java.util.UUID;

/**
 * Immutable copy of the security-relevant state of a user at one point in time.
 */
public record UserSnapshot(
        UUID id,
        String email,
        String username,
        UserRole role,
        boolean active,
        boolean blocked,
        boolean emailVerified,
        String passwordHash,
        boolean deleted
) {
    public static UserSnapshot of(User user) {
        return new UserSnapshot(
                user.getId(),
                user.getEmail(),
                user.getUsername(),
                user.getRole(),
                user.isActive(),
                user.isBlocked(),
                user.isEmailVerified(),
                user.getPassword(),
                user.isDeleted()
        );
    }
}
