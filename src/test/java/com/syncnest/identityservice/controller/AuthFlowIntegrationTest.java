package com.syncnest.identityservice.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.syncnest.identityservice.exception.AuthExceptions;
import com.syncnest.identityservice.model.NotificationTemplate;
import com.syncnest.identityservice.support.IntegrationTestSupport;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.ResultActions;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class AuthFlowIntegrationTest extends IntegrationTestSupport {

    private static final String NEW_PASSWORD = "Fresh-Harbor-77";

    @Test
    void registerLoginAndReadProfile() throws Exception {
        Account account = registerUser();

        JsonNode session = login(account.email(), PASSWORD);
        assertThat(session.path("tokenType").asText()).isEqualTo("Bearer");
        assertThat(session.path("refreshToken").asText()).isNotBlank();
        assertThat(session.path("user").hasNonNull("lastLogin")).isTrue();

        mockMvc.perform(get("/profile").header("Authorization", bearer(session.path("accessToken").asText())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("OK"))
                .andExpect(jsonPath("$.data.email").value(account.email()))
                .andExpect(jsonPath("$.data.role").value("USER"))
                .andExpect(jsonPath("$.data.emailVerified").value(false))
                .andExpect(jsonPath("$.data.password").doesNotExist());
    }

    @Test
    void registrationNormalizesEmailAndRejectsDuplicates() throws Exception {
        Account account = registerUser();

        mockMvc.perform(post("/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"email":"%s","username":"%s","password":"%s","passwordConfirm":"%s"}
                                """.formatted(account.email().toUpperCase(), "other_" + unique(), PASSWORD, PASSWORD)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("DUPLICATE_RESOURCE"));
    }

    @Test
    void registrationRejectsWeakOrMismatchedPasswords() throws Exception {
        String suffix = unique();
        mockMvc.perform(post("/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"email":"weak-%s@example.com","username":"weak_%s","password":"12345678","passwordConfirm":"12345678"}
                                """.formatted(suffix, suffix)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("VALIDATION_ERROR"));

        mockMvc.perform(post("/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"email":"mismatch-%s@example.com","username":"mm_%s","password":"%s","password_confirm":"%s"}
                                """.formatted(suffix, suffix, PASSWORD, NEW_PASSWORD)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("VALIDATION_ERROR"));

        assertThat(userRepository.existsByEmail("weak-" + suffix + "@example.com")).isFalse();
    }

    @Test
    void loginFailuresAreIndistinguishable() throws Exception {
        Account account = registerUser();
        Account blocked = registerUser();
        modifyUser(blocked.id(), u -> u.setBlocked(true));
        Account inactive = registerUser();
        modifyUser(inactive.id(), u -> u.setActive(false));

        attemptLogin(account.email(), "Wrong-Password-99", randomIp())
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.kind").value("UNAUTHORIZED"))
                .andExpect(jsonPath("$.detail").value(AuthExceptions.INVALID_CREDENTIALS));
        attemptLogin("nobody-" + unique() + "@example.com", PASSWORD, randomIp())
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.detail").value(AuthExceptions.INVALID_CREDENTIALS));
        attemptLogin(blocked.email(), PASSWORD, randomIp())
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.detail").value(AuthExceptions.INVALID_CREDENTIALS));
        attemptLogin(inactive.email(), PASSWORD, randomIp())
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.kind").value("UNAUTHORIZED"))
                .andExpect(jsonPath("$.detail").value(AuthExceptions.INVALID_CREDENTIALS));
    }

    @Test
    void sixthLoginAttemptFromOneAddressIsRateLimited() throws Exception {
        String ip = randomIp();
        for (int i = 0; i < 5; i++) {
            attemptLogin("ghost-" + unique() + "@example.com", PASSWORD, ip)
                    .andExpect(status().isUnauthorized());
        }
        attemptLogin("ghost-" + unique() + "@example.com", PASSWORD, ip)
                .andExpect(status().isTooManyRequests())
                .andExpect(jsonPath("$.kind").value("RATE_LIMITED"));
    }

    @Test
    void refreshRotatesAndRejectsReplay() throws Exception {
        Account account = registerUser();
        String first = login(account.email(), PASSWORD).path("refreshToken").asText();

        JsonNode rotated = body(refresh(first).andExpect(status().isOk()).andReturn()).path("data");
        String second = rotated.path("refreshToken").asText();
        assertThat(second).isNotEqualTo(first);
        assertThat(rotated.path("accessToken").asText()).isNotBlank();

        refresh(first)
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.kind").value("UNAUTHORIZED"));
        refresh(second).andExpect(status().isOk());
    }

    @Test
    void refreshRejectsGarbageAndAccessTokens() throws Exception {
        Account account = registerUser();
        String access = login(account.email(), PASSWORD).path("accessToken").asText();

        refresh("not-a-token").andExpect(status().isUnauthorized());
        refresh(access).andExpect(status().isUnauthorized());
    }

    @Test
    void logoutRevokesRefreshToken() throws Exception {
        Account account = registerUser();
        JsonNode session = login(account.email(), PASSWORD);
        String access = session.path("accessToken").asText();
        String refreshToken = session.path("refreshToken").asText();

        logout(access, refreshToken).andExpect(status().isResetContent());
        refresh(refreshToken).andExpect(status().isUnauthorized());
        logout(access, refreshToken).andExpect(status().isResetContent());
    }

    @Test
    void logoutWithSomeoneElsesTokenIsRejected() throws Exception {
        Account alice = registerUser();
        Account bob = registerUser();
        String aliceAccess = accessToken(alice);
        String bobRefresh = login(bob.email(), PASSWORD).path("refreshToken").asText();

        logout(aliceAccess, bobRefresh)
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("VALIDATION_ERROR"));
        refresh(bobRefresh).andExpect(status().isOk());
    }

    @Test
    void logoutRequiresAuthentication() throws Exception {
        mockMvc.perform(post("/auth/logout")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"refreshToken\":\"x\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.kind").value("UNAUTHORIZED"));

        mockMvc.perform(post("/auth/logout")
                        .header("Authorization", bearer("expired-or-forged"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"refreshToken\":\"x\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(header().exists("WWW-Authenticate"));
    }

    @Test
    void logoutAllRevokesEverySession() throws Exception {
        Account account = registerUser();
        String refreshA = login(account.email(), PASSWORD).path("refreshToken").asText();
        JsonNode sessionB = login(account.email(), PASSWORD);

        mockMvc.perform(post("/auth/logout/all")
                        .header("Authorization", bearer(sessionB.path("accessToken").asText())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.revoked").value(2));

        refresh(refreshA).andExpect(status().isUnauthorized());
        refresh(sessionB.path("refreshToken").asText()).andExpect(status().isUnauthorized());
    }

    @Test
    void changePasswordSignsOutEverywhere() throws Exception {
        Account account = registerUser();
        JsonNode session = login(account.email(), PASSWORD);
        String access = session.path("accessToken").asText();

        changePassword(access, "Not-My-Password-1", NEW_PASSWORD)
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("VALIDATION_ERROR"));

        changePassword(access, PASSWORD, NEW_PASSWORD).andExpect(status().isOk());

        refresh(session.path("refreshToken").asText()).andExpect(status().isUnauthorized());
        attemptLogin(account.email(), PASSWORD, randomIp()).andExpect(status().isUnauthorized());
        login(account.email(), NEW_PASSWORD);
    }

    @Test
    void changePasswordEnforcesPolicy() throws Exception {
        Account account = registerUser();
        String access = accessToken(account);

        changePassword(access, PASSWORD, account.username() + "1")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("VALIDATION_ERROR"));
        login(account.email(), PASSWORD);
    }

    @Test
    void profileRequiresAuthentication() throws Exception {
        mockMvc.perform(get("/profile"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.kind").value("UNAUTHORIZED"));
        mockMvc.perform(get("/profile").header("Authorization", bearer("garbage")))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void profileUpdateChangesOnlyGivenFields() throws Exception {
        Account account = registerUser();
        Account other = registerUser();
        String access = accessToken(account);

        mockMvc.perform(put("/profile/update")
                        .header("Authorization", bearer(access))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"country\":\"Norway\",\"phone_number\":\"+47 1234 5678\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Profile updated"))
                .andExpect(jsonPath("$.data.country").value("Norway"))
                .andExpect(jsonPath("$.data.phoneNumber").value("+47 1234 5678"))
                .andExpect(jsonPath("$.data.username").value(account.username()));

        mockMvc.perform(put("/profile/update")
                        .header("Authorization", bearer(access))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\":\"" + other.username() + "\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("DUPLICATE_RESOURCE"));
    }

    @Test
    void emailVerificationTokenIsSingleUse() throws Exception {
        Account account = registerUser();
        String token = capturedToken(NotificationTemplate.EMAIL_VERIFICATION, account.email());
        String payload = "{\"token\":\"%s\",\"uid\":\"%s\"}".formatted(token, account.id());

        mockMvc.perform(post("/auth/email/verify/confirm")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(payload))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Email verified"));
        assertThat(userRepository.findById(account.id()).orElseThrow().isEmailVerified()).isTrue();

        mockMvc.perform(post("/auth/email/verify/confirm")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(payload))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("INVALID_OR_EXPIRED_TOKEN"));
    }

    @Test
    void verificationRequestAnswersTheSameForEveryEmail() throws Exception {
        Account account = registerUser();

        for (String email : new String[]{account.email(), "unknown-" + unique() + "@example.com"}) {
            mockMvc.perform(post("/auth/email/verify")
                            .with(fromIp(randomIp()))
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"email\":\"" + email + "\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.message").value(AuthController.VERIFICATION_REQUESTED));
        }
    }

    @Test
    void malformedJsonIsAValidationError() throws Exception {
        mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("VALIDATION_ERROR"));
    }

    private ResultActions attemptLogin(String email, String password, String ip) throws Exception {
        return mockMvc.perform(post("/auth/login")
                .with(fromIp(ip))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"email\":\"%s\",\"password\":\"%s\"}".formatted(email, password)));
    }

    private ResultActions refresh(String refreshToken) throws Exception {
        return mockMvc.perform(post("/auth/token/refresh")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"refresh\":\"" + refreshToken + "\"}"));
    }

    private ResultActions logout(String accessToken, String refreshToken) throws Exception {
        return mockMvc.perform(post("/auth/logout")
                .header("Authorization", bearer(accessToken))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"refreshToken\":\"" + refreshToken + "\"}"));
    }

    private ResultActions changePassword(String accessToken, String oldPassword, String newPassword) throws Exception {
        return mockMvc.perform(post("/auth/password/change")
                .header("Authorization", bearer(accessToken))
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                        {"oldPassword":"%s","newPassword":"%s","newPasswordConfirm":"%s"}
                        """.formatted(oldPassword, newPassword, newPassword)));
    }
}
