package com.syncnest.identityservice.serviceImpl;

import com.syncnest.identityservice.Validators.PasswordPolicyValidator;
import com.syncnest.identityservice.authorization.AuthenticatedPrincipal;
import com.syncnest.identityservice.config.RateLimitConfig;
import com.syncnest.identityservice.dto.*;
import com.syncnest.identityservice.entity.ActionTokenPurpose;
import com.syncnest.identityservice.entity.User;
import com.syncnest.identityservice.entity.UserRole;
import com.syncnest.identityservice.exception.UserExceptions;
import com.syncnest.identityservice.exception.AuthExceptions;
import com.syncnest.identityservice.exception.RequestExceptions;
import com.syncnest.identityservice.model.NewUser;
import com.syncnest.identityservice.model.NotificationTemplate;
import com.syncnest.identityservice.model.TokenPair;
import com.syncnest.identityservice.model.UserChange;
import com.syncnest.identityservice.model.UserUpdate;
import com.syncnest.identityservice.service.ActionTokenService;
import com.syncnest.identityservice.service.AuthService;
import com.syncnest.identityservice.service.CredentialStore;
import com.syncnest.identityservice.service.NotificationSender;
import com.syncnest.identityservice.service.RateLimiter;
import com.syncnest.identityservice.service.TokenService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
public class AuthServiceImpl implements AuthService {

    private static final String TOKEN_TYPE = "Bearer";

    private final CredentialStore credentialStore;
    private final TokenService tokenService;
    private final ActionTokenService actionTokenService;
    private final NotificationSender notificationSender;
    private final UserChangeHandler changeHandler;
    private final ActionLinkDispatcher linkDispatcher;
    private final RateLimiter loginRateLimiter;
    private final RateLimiter actionRateLimiter;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;
    private final long verificationTtlMinutes;

    /** Compared against on unknown emails so that branch costs one hash check too. */
    private final String dummyHash;

    public AuthServiceImpl(CredentialStore credentialStore,
                           TokenService tokenService,
                           ActionTokenService actionTokenService,
                           NotificationSender notificationSender,
                           UserChangeHandler changeHandler,
                           ActionLinkDispatcher linkDispatcher,
                           @Qualifier(RateLimitConfig.LOGIN) RateLimiter loginRateLimiter,
                           @Qualifier(RateLimitConfig.ACTION) RateLimiter actionRateLimiter,
                           PasswordEncoder passwordEncoder,
                           Clock clock,
                           @Value("${app.action-token.verification-ttl-minutes:1440}") long verificationTtlMinutes) {
        this.credentialStore = credentialStore;
        this.tokenService = tokenService;
        this.actionTokenService = actionTokenService;
        this.notificationSender = notificationSender;
        this.changeHandler = changeHandler;
        this.linkDispatcher = linkDispatcher;
        this.loginRateLimiter = loginRateLimiter;
        this.actionRateLimiter = actionRateLimiter;
        this.passwordEncoder = passwordEncoder;
        this.clock = clock;
        this.verificationTtlMinutes = verificationTtlMinutes;
        this.dummyHash = passwordEncoder.encode("dummy-password-for-timing");
    }

    // -------------------- registration --------------------

    @Override
    @Transactional
    public UserResponse register(RegistrationRequest request) {
        User user = credentialStore.create(NewUser.builder()
                .email(request.getEmail())
                .username(request.getUsername().trim())
                .passwordHash(credentialStore.hashSecret(request.getPassword()))
                .role(UserRole.USER)
                .build());

        String verificationToken = actionTokenService.issue(user, ActionTokenPurpose.EMAIL_VERIFICATION);
        notifyAfterCommit(NotificationTemplate.WELCOME, user, Map.of());
        notifyAfterCommit(NotificationTemplate.EMAIL_VERIFICATION, user,
                Map.of("token", verificationToken, "ttlMinutes", verificationTtlMinutes));

        log.info("Registered user={}", user.getId());
        return UserResponse.from(user);
    }

    // -------------------- sessions --------------------

    @Override
    @Transactional
    public LoginResponse login(LoginRequest request, String clientIp) {
        final String email = CredentialStore.normalizeEmail(request.getEmail());
        gate(loginRateLimiter, "login", clientIp, email);

        Optional<User> found = credentialStore.findByEmail(email);
        boolean secretOk;
        if (found.isPresent()) {
            secretOk = credentialStore.verifySecret(found.get(), request.getPassword());
        } else {
            passwordEncoder.matches(request.getPassword(), dummyHash);
            secretOk = false;
        }

        if (!secretOk || !found.get().canAuthenticate()) {
            log.info("Login failed from ip={}", clientIp);
            throw new AuthExceptions.Unauthorized(AuthExceptions.INVALID_CREDENTIALS);
        }

        User user = found.get();
        TokenPair pair = tokenService.issue(user, request.getDeviceId());
        UserChange change = credentialStore.update(user.getId(),
                UserUpdate.builder().lastLoginAt(clock.instant()).build());

        log.info("Login success for user={}", user.getId());
        return LoginResponse.builder()
                .user(UserResponse.from(change.user()))
                .accessToken(pair.accessToken())
                .refreshToken(pair.refreshToken())
                .tokenType(TOKEN_TYPE)
                .expiresIn(pair.accessExpiresIn())
                .refreshExpiresAt(pair.refreshExpiresAt())
                .build();
    }

    @Override
    public RefreshTokenResponse refresh(String refreshToken) {
        TokenPair pair = tokenService.refresh(refreshToken);
        return RefreshTokenResponse.builder()
                .accessToken(pair.accessToken())
                .refreshToken(pair.refreshToken())
                .tokenType(TOKEN_TYPE)
                .expiresIn(pair.accessExpiresIn())
                .refreshExpiresAt(pair.refreshExpiresAt())
                .build();
    }

    @Override
    public void logout(AuthenticatedPrincipal principal, String refreshToken) {
        if (!tokenService.revoke(refreshToken, principal.id())) {
            throw new RequestExceptions.ValidationFailed("Refresh token is invalid.");
        }
    }

    @Override
    public int logoutAll(AuthenticatedPrincipal principal) {
        return tokenService.revokeAll(principal.id());
    }

    // -------------------- password --------------------

    @Override
    @Transactional
    public void changePassword(AuthenticatedPrincipal principal, PasswordChangeRequest request) {
        User user = credentialStore.findById(principal.id());
        if (!credentialStore.verifySecret(user, request.getOldPassword())) {
            throw new RequestExceptions.ValidationFailed("Old password is incorrect.");
        }
        enforcePolicy(request.getNewPassword(), user);

        UserChange change = credentialStore.update(user.getId(),
                UserUpdate.builder().passwordHash(credentialStore.hashSecret(request.getNewPassword())).build());
        changeHandler.handle(change, actor(principal));
        notifyAfterCommit(NotificationTemplate.PASSWORD_CHANGED, change.user(), Map.of());
    }

    @Override
    public void requestPasswordReset(String email, String clientIp) {
        String normalized = CredentialStore.normalizeEmail(email);
        gate(actionRateLimiter, "reset", clientIp, normalized);
        linkDispatcher.dispatch(ActionTokenPurpose.PASSWORD_RESET, normalized);
    }

    @Override
    @Transactional
    public void confirmPasswordReset(PasswordResetConfirmRequest request) {
        User user = findForToken(request.getUserId());
        enforcePolicy(request.getNewPassword(), user);

        actionTokenService.redeem(request.getToken(), user.getId(), ActionTokenPurpose.PASSWORD_RESET);
        UserChange change = credentialStore.update(user.getId(),
                UserUpdate.builder().passwordHash(credentialStore.hashSecret(request.getNewPassword())).build());
        changeHandler.handle(change, "password-reset");
        notifyAfterCommit(NotificationTemplate.PASSWORD_CHANGED, change.user(), Map.of());
    }

    // -------------------- email verification --------------------

    @Override
    public void requestEmailVerification(String email, String clientIp) {
        String normalized = CredentialStore.normalizeEmail(email);
        gate(actionRateLimiter, "verify", clientIp, normalized);
        linkDispatcher.dispatch(ActionTokenPurpose.EMAIL_VERIFICATION, normalized);
    }

    @Override
    @Transactional
    public void confirmEmailVerification(EmailVerificationConfirmRequest request) {
        User user = findForToken(request.getUserId());
        actionTokenService.redeem(request.getToken(), user.getId(), ActionTokenPurpose.EMAIL_VERIFICATION);
        UserChange change = credentialStore.update(user.getId(), UserUpdate.builder().emailVerified(true).build());
        changeHandler.handle(change, "email-verification");
    }

    // -------------------- helpers --------------------

    /**
     * Rejects when either the IP or the account key is over its limit. Both keys are checked
     * before either is recorded, so an attempt rejected on one key costs nothing on the other.
     */
    private void gate(RateLimiter limiter, String scope, String clientIp, String email) {
        String ip = (clientIp == null || clientIp.isBlank()) ? "unknown" : clientIp;
        String ipKey = scope + ":ip:" + ip;
        String emailKey = scope + ":email:" + email;
        if (limiter.remaining(ipKey) == 0 || limiter.remaining(emailKey) == 0
                || !limiter.admit(ipKey) || !limiter.admit(emailKey)) {
            log.warn("Rate limit hit for {} from ip={}", scope, ip);
            throw new RequestExceptions.RateLimited("Too many attempts. Please try again later.");
        }
    }

    private User findForToken(UUID userId) {
        try {
            return credentialStore.findById(userId);
        } catch (UserExceptions.UserNotFound e) {
            throw new AuthExceptions.InvalidOrExpiredToken();
        }
    }

    private void enforcePolicy(String password, User user) {
        List<String> violations = PasswordPolicyValidator.violations(password, user.getEmail(), user.getUsername());
        if (!violations.isEmpty()) {
            throw new RequestExceptions.ValidationFailed(String.join(" ", violations));
        }
    }

    private void notifyAfterCommit(NotificationTemplate template, User user, Map<String, Object> extra) {
        Map<String, Object> context = new HashMap<>(extra);
        context.put("username", user.getUsername());
        context.put("userId", user.getId());
        String recipient = user.getEmail();

        Runnable send = () -> notificationSender.send(template, recipient, context);
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    send.run();
                }
            });
        } else {
            send.run();
        }
    }

    private static String actor(AuthenticatedPrincipal principal) {
        return principal.role() + ":" + principal.email();
    }
}
