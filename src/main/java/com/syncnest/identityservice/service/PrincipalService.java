package com.syncnest.identityservice.service;

import com.syncnest.identityservice.authorization.AuthenticatedPrincipal;

import java.util.Optional;
import java.util.UUID;

public interface PrincipalService {

    /**
     * Current role and status flags of a non-deleted user, or empty when the user is gone.
     * Results are cached; {@link CredentialStore#update} evicts them.
     */
    Optional<AuthenticatedPrincipal> loadPrincipal(UUID userId);
}
