package com.syncnest.identityservice.serviceImpl;

import com.syncnest.identityservice.dto.LoginRequest;
import com.syncnest.identityservice.dto.PasswordResetConfirmRequest;
import com.syncnest.identityservice.dto.RegistrationRequest;
import com.syncnest.identityservice.model.NotificationTemplate;
import com.syncnest.identityservice.service.AuthService;
import com.syncnest.identityservice.support.IntegrationTestSupport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Races on the same record must leave exactly one winner.
 */
class ConcurrencyIntegrationTest extends IntegrationTestSupport {

    private static final int THREADS = 6;

    @Autowired
    private AuthService authService;

    private final ExecutorService pool = Executors.newFixedThreadPool(THREADS);

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void sameEmailRegisteredOnce() throws Exception {
        String email = "race-" + unique() + "@example.com";

        int winners = race(i -> {
            RegistrationRequest request = new RegistrationRequest();
            request.setEmail(email);
            request.setUsername("race_" + unique());
            request.setPassword(PASSWORD);
            request.setPasswordConfirm(PASSWORD);
            authService.register(request);
        });

        assertThat(winners).isEqualTo(1);
        assertThat(userRepository.findByEmailAndDeletedFalse(email)).isPresent();
    }

    @Test
    void resetTokenRedeemedOnce() throws Exception {
        Account account = registerUser();
        authService.requestPasswordReset(account.email(), randomIp());
        String token = capturedToken(NotificationTemplate.PASSWORD_RESET, account.email());

        int winners = race(i -> authService.confirmPasswordReset(PasswordResetConfirmRequest.builder()
                .token(token)
                .userId(account.id())
                .newPassword("Racing-Password-" + i)
                .newPasswordConfirm("Racing-Password-" + i)
                .build()));

        assertThat(winners).isEqualTo(1);
    }

    @Test
    void refreshTokenRotatedOnce() throws Exception {
        Account account = registerUser();
        LoginRequest login = new LoginRequest();
        login.setEmail(account.email());
        login.setPassword(PASSWORD);
        String refreshToken = authService.login(login, randomIp()).getRefreshToken();

        int winners = race(i -> authService.refresh(refreshToken));

        assertThat(winners).isEqualTo(1);
    }

    private interface Attempt {
        void run(int index) throws Exception;
    }

    /** Starts every attempt at once and returns how many completed without an exception. */
    private int race(Attempt attempt) throws InterruptedException {
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        for (int i = 0; i < THREADS; i++) {
            final int index = i;
            Callable<Boolean> task = () -> {
                start.await();
                try {
                    attempt.run(index);
                    return true;
                } catch (Exception e) {
                    return false;
                }
            };
            results.add(pool.submit(task));
        }
        start.countDown();

        int winners = 0;
        for (Future<Boolean> result : results) {
            try {
                if (result.get(30, TimeUnit.SECONDS)) {
                    winners++;
                }
            } catch (ExecutionException | TimeoutException e) {
                throw new AssertionError("Attempt did not finish", e);
            }
        }
        return winners;
    }
}
