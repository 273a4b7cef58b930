package com.syncnest.identityservice.controller;

import com.syncnest.identityservice.authorization.AuthenticatedPrincipal;
import com.syncnest.identityservice.authorization.Capability;
import com.syncnest.identityservice.authorization.RequireCapabilities;
import com.syncnest.identityservice.dto.*;
import com.syncnest.identityservice.service.AuthService;
import com.syncnest.identityservice.utils.ClientInfo;
import com.syncnest.identityservice.utils.ResponseMessage;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
@Tag(name = "Authentication")
public class AuthController {

    static final String RESET_REQUESTED =
            "If an account exists for this email, a password reset link has been sent.";
    static final String VERIFICATION_REQUESTED =
            "If an unverified account exists for this email, a verification link has been sent.";

    private final AuthService authService;

    @PostMapping("/register")
    @ResponseStatus(HttpStatus.CREATED)
    @ResponseMessage("Registration successful. Check your inbox to verify your email.")
    @Operation(summary = "Create an account")
    public UserResponse register(@Valid @RequestBody RegistrationRequest request) {
        return authService.register(request);
    }

    @PostMapping("/login")
    @ResponseMessage("Login successful")
    @Operation(summary = "Exchange email and password for a token pair")
    public LoginResponse login(@Valid @RequestBody LoginRequest request, HttpServletRequest http) {
        request.setDeviceId(ClientInfo.deviceLabel(http, request.getDeviceId()));
        return authService.login(request, ClientInfo.clientIp(http));
    }

    @PostMapping("/token/refresh")
    @ResponseMessage("Token refreshed")
    @Operation(summary = "Exchange a refresh token for a new token pair")
    public RefreshTokenResponse refresh(@Valid @RequestBody RefreshTokenRequest request) {
        return authService.refresh(request.getRefreshToken());
    }

    @PostMapping("/logout")
    @SecurityRequirement(name = "bearerAuth")
    @Operation(summary = "Revoke the presented refresh token")
    public ResponseEntity<Void> logout(@AuthenticationPrincipal AuthenticatedPrincipal principal,
                                       @Valid @RequestBody LogoutRequest request) {
        authService.logout(principal, request.getRefreshToken());
        return ResponseEntity.status(HttpStatus.RESET_CONTENT).build();
    }

    @PostMapping("/logout/all")
    @ResponseMessage("Signed out on all devices")
    @SecurityRequirement(name = "bearerAuth")
    @Operation(summary = "Revoke every refresh token of the caller")
    public Map<String, Integer> logoutAll(@AuthenticationPrincipal AuthenticatedPrincipal principal) {
        return Map.of("revoked", authService.logoutAll(principal));
    }

    @PostMapping("/password/change")
    @RequireCapabilities({Capability.ACTIVE, Capability.NOT_BLOCKED})
    @ResponseMessage("Password changed")
    @SecurityRequirement(name = "bearerAuth")
    @Operation(summary = "Change password; signs out every session")
    public MessageResponse changePassword(@AuthenticationPrincipal AuthenticatedPrincipal principal,
                                          @Valid @RequestBody PasswordChangeRequest request) {
        authService.changePassword(principal, request);
        return new MessageResponse("Password changed. Please sign in again.");
    }

    @PostMapping("/password/reset")
    @Operation(summary = "Request a password reset link")
    public MessageResponse requestPasswordReset(@Valid @RequestBody EmailRequest request, HttpServletRequest http) {
        authService.requestPasswordReset(request.getEmail(), ClientInfo.clientIp(http));
        return new MessageResponse(RESET_REQUESTED);
    }

    @PostMapping("/password/reset/confirm")
    @ResponseMessage("Password reset")
    @Operation(summary = "Set a new password with a reset token")
    public MessageResponse confirmPasswordReset(@Valid @RequestBody PasswordResetConfirmRequest request) {
        authService.confirmPasswordReset(request);
        return new MessageResponse("Password has been reset. Please sign in.");
    }

    @PostMapping("/email/verify")
    @Operation(summary = "Request an email verification link")
    public MessageResponse requestEmailVerification(@Valid @RequestBody EmailRequest request, HttpServletRequest http) {
        authService.requestEmailVerification(request.getEmail(), ClientInfo.clientIp(http));
        return new MessageResponse(VERIFICATION_REQUESTED);
    }

    @PostMapping("/email/verify/confirm")
    @ResponseMessage("Email verified")
    @Operation(summary = "Confirm an email address with a verification token")
    public MessageResponse confirmEmailVerification(@Valid @RequestBody EmailVerificationConfirmRequest request) {
        authService.confirmEmailVerification(request);
        return new MessageResponse("Email address verified.");
    }
}
