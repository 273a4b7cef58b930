package com.syncnest.identityservice.authorization;

import com.syncnest.identityservice.entity.User;
import com.syncnest.identityservice.entity.UserRole;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

import java.io.Serial;
import java.io.Serializable;
import java.security.Principal;
import java.util.List;
import java.util.UUID;

/**
 * The caller as seen by authorization checks: identity, role and status flags
 * loaded for the user id carried by the access token.
 */
public record AuthenticatedPrincipal(
        UUID id,
        String email,
        UserRole role,
        boolean active,
        boolean blocked,
        boolean emailVerified
) implements Principal, Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    public static AuthenticatedPrincipal of(User user) {
        return new AuthenticatedPrincipal(
                user.getId(),
                user.getEmail(),
                user.getRole(),
                user.isActive(),
                user.isBlocked(),
                user.isEmailVerified()
        );
    }

    public List<GrantedAuthority> authorities() {
        return List.of(new SimpleGrantedAuthority(role.authority()));
    }

    @Override
    public String getName() {
        return id.toString();
    }
}
