package com.syncnest.identityservice.serviceImpl;

import com.syncnest.identityservice.authorization.AuthenticatedPrincipal;
import com.syncnest.identityservice.dto.ProfileUpdateRequest;
import com.syncnest.identityservice.dto.UserResponse;
import com.syncnest.identityservice.model.UserChange;
import com.syncnest.identityservice.model.UserUpdate;
import com.syncnest.identityservice.service.AccountService;
import com.syncnest.identityservice.service.CredentialStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
public class AccountServiceImpl implements AccountService {

    private final CredentialStore credentialStore;

    @Override
    @Transactional(readOnly = true)
    public UserResponse getProfile(AuthenticatedPrincipal principal) {
        return UserResponse.from(credentialStore.findById(principal.id()));
    }

    @Override
    @Transactional
    public UserResponse updateProfile(AuthenticatedPrincipal principal, ProfileUpdateRequest request) {
        UserChange change = credentialStore.update(principal.id(), UserUpdate.builder()
                .username(request.getUsername())
                .recoveryEmail(request.getRecoveryEmail())
                .phoneNumber(request.getPhoneNumber())
                .address(request.getAddress())
                .country(request.getCountry())
                .bio(request.getBio())
                .build());
        log.info("Profile updated for user={}", principal.id());
        return UserResponse.from(change.user());
    }
}
