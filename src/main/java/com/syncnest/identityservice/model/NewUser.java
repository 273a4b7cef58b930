package com.syncnest.identityservice.model;

import com.syncnest.identityservice.entity.UserRole;
import lombok.Builder;

/**
 * Input to {@code CredentialStore.create}. The secret arrives already hashed.
 */
@Builder
public record NewUser(
        String email,
        String username,
        String passwordHash,
        UserRole role,
        String recoveryEmail,
        String phoneNumber,
        String address,
        String country,
        String bio
) {}
