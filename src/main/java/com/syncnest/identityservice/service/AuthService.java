package com.syncnest.identityservice.service;

import com.syncnest.identityservice.authorization.AuthenticatedPrincipal;
import com.syncnest.identityservice.dto.EmailVerificationConfirmRequest;
import com.syncnest.identityservice.dto.LoginRequest;
import com.syncnest.identityservice.dto.LoginResponse;
import com.syncnest.identityservice.dto.PasswordChangeRequest;
import com.syncnest.identityservice.dto.PasswordResetConfirmRequest;
import com.syncnest.identityservice.dto.RefreshTokenResponse;
import com.syncnest.identityservice.dto.RegistrationRequest;
import com.syncnest.identityservice.dto.UserResponse;

/**
 * Credential lifecycle: registration, sessions, password and email-verification flows.
 */
public interface AuthService {

    /** Creates a USER account. Does not log the user in. */
    UserResponse register(RegistrationRequest request);

    /**
     * @throws com.syncnest.identityservice.exception.RequestExceptions.RateLimited  too many attempts
     * @throws com.syncnest.identityservice.exception.AuthExceptions.Unauthorized    for every other failure,
     *         with the same detail whatever the cause
     */
    LoginResponse login(LoginRequest request, String clientIp);

    RefreshTokenResponse refresh(String refreshToken);

    /** Revokes the presented refresh token, which must belong to the caller. */
    void logout(AuthenticatedPrincipal principal, String refreshToken);

    /** Revokes every refresh token of the caller and returns how many were live. */
    int logoutAll(AuthenticatedPrincipal principal);

    void changePassword(AuthenticatedPrincipal principal, PasswordChangeRequest request);

    /**
     * Completes normally whether or not the email belongs to an account. Only the rate limit
     * is checked here; lookup, token issue and mail run on the notification executor.
     */
    void requestPasswordReset(String email, String clientIp);

    void confirmPasswordReset(PasswordResetConfirmRequest request);

    /** Completes normally whether or not the email belongs to an unverified account. */
    void requestEmailVerification(String email, String clientIp);

    void confirmEmailVerification(EmailVerificationConfirmRequest request);
}
