package com.syncnest.identityservice.utils;

import com.syncnest.identityservice.authorization.AuthenticatedPrincipal;
import lombok.NonNull;
import org.springframework.data.domain.AuditorAware;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

import java.util.Optional;

/**
 * Fills created_by / updated_by. Anonymous flows (registration, reset, bootstrap) are
 * recorded as SYSTEM; authenticated ones as {@code <ROLE>:<email>}.
 */
public class AuditorAwareImpl implements AuditorAware<String> {

    private static final String SYSTEM = "SYSTEM";

    @Override
    @NonNull
    public Optional<String> getCurrentAuditor() {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        if (auth == null || !auth.isAuthenticated()) {
            return Optional.of(SYSTEM);
        }
        if (auth.getPrincipal() instanceof AuthenticatedPrincipal p) {
            return Optional.of(p.role().name() + ":" + p.email());
        }
        return Optional.of(SYSTEM);
    }
}
