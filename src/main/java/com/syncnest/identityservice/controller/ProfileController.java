package com.syncnest.identityservice.controller;

import com.syncnest.identityservice.authorization.AuthenticatedPrincipal;
import com.syncnest.identityservice.authorization.Capability;
import com.syncnest.identityservice.authorization.RequireCapabilities;
import com.syncnest.identityservice.dto.ProfileUpdateRequest;
import com.syncnest.identityservice.dto.UserResponse;
import com.syncnest.identityservice.service.AccountService;
import com.syncnest.identityservice.utils.ResponseMessage;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/profile")
@RequiredArgsConstructor
@RequireCapabilities({Capability.ACTIVE, Capability.NOT_BLOCKED})
@SecurityRequirement(name = "bearerAuth")
@Tag(name = "Profile")
public class ProfileController {

    private final AccountService accountService;

    @GetMapping
    public UserResponse get(@AuthenticationPrincipal AuthenticatedPrincipal principal) {
        return accountService.getProfile(principal);
    }

    @PutMapping("/update")
    @ResponseMessage("Profile updated")
    public UserResponse update(@AuthenticationPrincipal AuthenticatedPrincipal principal,
                               @Valid @RequestBody ProfileUpdateRequest request) {
        return accountService.updateProfile(principal, request);
    }
}
