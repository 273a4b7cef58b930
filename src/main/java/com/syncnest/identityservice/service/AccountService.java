package com.syncnest.identityservice.service;

import com.syncnest.identityservice.authorization.AuthenticatedPrincipal;
import com.syncnest.identityservice.dto.ProfileUpdateRequest;
import com.syncnest.identityservice.dto.UserResponse;

public interface AccountService {

    UserResponse getProfile(AuthenticatedPrincipal principal);

    UserResponse updateProfile(AuthenticatedPrincipal principal, ProfileUpdateRequest request);
}
