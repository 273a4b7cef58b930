package com.syncnest.identityservice.service;

import com.syncnest.identityservice.authorization.AuthenticatedPrincipal;
import com.syncnest.identityservice.dto.AdminUserUpdateRequest;
import com.syncnest.identityservice.dto.UserResponse;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

import java.util.UUID;

/**
 * Administrative user management. Callers are expected to hold the ADMIN capability;
 * an administrator can never demote, deactivate, block or delete their own account.
 */
public interface AdminUserService {

    Page<UserResponse> listUsers(Pageable pageable);

    UserResponse getUser(UUID id);

    UserResponse updateUser(AuthenticatedPrincipal actor, UUID id, AdminUserUpdateRequest request);

    /** Soft delete; the user's sessions are revoked. */
    void deleteUser(AuthenticatedPrincipal actor, UUID id);
}
