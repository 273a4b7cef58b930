package com.syncnest.identityservice.serviceImpl;

import com.syncnest.identityservice.entity.ActionTokenPurpose;
import com.syncnest.identityservice.exception.RequestExceptions;
import com.syncnest.identityservice.service.ActionTokenService;
import com.syncnest.identityservice.service.CredentialStore;
import com.syncnest.identityservice.service.NotificationSender;
import com.syncnest.identityservice.service.TokenService;
import com.syncnest.identityservice.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class AuthServiceImplTest {

    @Mock
    private CredentialStore credentialStore;

    @Mock
    private TokenService tokenService;

    @Mock
    private ActionTokenService actionTokenService;

    @Mock
    private NotificationSender notificationSender;

    @Mock
    private ActionLinkDispatcher linkDispatcher;

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    private SlidingWindowRateLimiter actionLimiter;
    private AuthServiceImpl service;

    @BeforeEach
    void setUp() {
        SlidingWindowRateLimiter loginLimiter = new SlidingWindowRateLimiter("login", 5, Duration.ofSeconds(60), clock);
        actionLimiter = new SlidingWindowRateLimiter("action", 5, Duration.ofHours(1), clock);
        service = new AuthServiceImpl(credentialStore, tokenService, actionTokenService, notificationSender,
                new UserChangeHandler(tokenService), linkDispatcher, loginLimiter, actionLimiter,
                new BCryptPasswordEncoder(4), clock, 1440);
    }

    @Test
    void resetRequestDoesNoAccountWorkOnRequestThread() {
        service.requestPasswordReset("  Someone@Example.COM ", "10.0.0.1");

        verify(linkDispatcher).dispatch(ActionTokenPurpose.PASSWORD_RESET, "someone@example.com");
        verifyNoInteractions(credentialStore, actionTokenService, notificationSender);
    }

    @Test
    void verificationRequestDoesNoAccountWorkOnRequestThread() {
        service.requestEmailVerification("someone@example.com", "10.0.0.1");

        verify(linkDispatcher).dispatch(ActionTokenPurpose.EMAIL_VERIFICATION, "someone@example.com");
        verifyNoInteractions(credentialStore, actionTokenService, notificationSender);
    }

    @Test
    void emailLimitRejectionDoesNotSpendIpBudget() {
        for (int i = 1; i <= 5; i++) {
            service.requestPasswordReset("victim@example.com", "10.0.0." + i);
        }

        assertThatThrownBy(() -> service.requestPasswordReset("victim@example.com", "10.9.9.9"))
                .isInstanceOf(RequestExceptions.RateLimited.class);

        assertThat(actionLimiter.remaining("reset:ip:10.9.9.9")).isEqualTo(5);
        verify(linkDispatcher, times(5)).dispatch(any(), any());
    }

    @Test
    void ipLimitRejectionDoesNotSpendEmailBudget() {
        for (int i = 0; i < 5; i++) {
            service.requestEmailVerification("other-" + i + "@example.com", "10.0.0.7");
        }

        assertThatThrownBy(() -> service.requestEmailVerification("fresh@example.com", "10.0.0.7"))
                .isInstanceOf(RequestExceptions.RateLimited.class);

        assertThat(actionLimiter.remaining("verify:email:fresh@example.com")).isEqualTo(5);
        verify(linkDispatcher, never()).dispatch(ActionTokenPurpose.EMAIL_VERIFICATION, "fresh@example.com");
    }
}
