package com.syncnest.identityservice.support;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.syncnest.identityservice.config.CacheConfig;
import com.syncnest.identityservice.entity.User;
import com.syncnest.identityservice.entity.UserRole;
import com.syncnest.identityservice.model.NotificationTemplate;
import com.syncnest.identityservice.repository.UserRepository;
import com.syncnest.identityservice.service.NotificationSender;
import org.mockito.ArgumentCaptor;
import org.mockito.verification.VerificationMode;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.request.RequestPostProcessor;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Consumer;

import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Shared Spring context for HTTP-level tests: H2, in-memory rate limits, mail replaced by a mock.
 * Every helper works on fresh accounts and client addresses so tests never share limiter keys.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
public abstract class IntegrationTestSupport {

    protected static final String PASSWORD = "Sturdy-Lantern-42";

    private static final long MAIL_WAIT_MILLIS = 5_000;

    @Autowired
    protected MockMvc mockMvc;

    @Autowired
    protected ObjectMapper objectMapper;

    @Autowired
    protected UserRepository userRepository;

    @Autowired
    private CacheManager cacheManager;

    @MockBean
    protected NotificationSender notificationSender;

    protected record Account(UUID id, String email, String username) {}

    protected static String unique() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    protected static String randomIp() {
        ThreadLocalRandom r = ThreadLocalRandom.current();
        return "10." + r.nextInt(256) + "." + r.nextInt(256) + "." + r.nextInt(1, 255);
    }

    protected static RequestPostProcessor fromIp(String ip) {
        return request -> {
            request.setRemoteAddr(ip);
            return request;
        };
    }

    protected static String bearer(String token) {
        return "Bearer " + token;
    }

    protected JsonNode body(MvcResult result) throws Exception {
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    protected Account registerUser() throws Exception {
        String suffix = unique();
        String email = "user-" + suffix + "@example.com";
        String username = "user_" + suffix;

        MvcResult result = mockMvc.perform(post("/auth/register")
                        .with(fromIp(randomIp()))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"email":"%s","username":"%s","password":"%s","passwordConfirm":"%s"}
                                """.formatted(email, username, PASSWORD, PASSWORD)))
                .andExpect(status().isCreated())
                .andReturn();
        return new Account(UUID.fromString(body(result).path("data").path("id").asText()), email, username);
    }

    protected Account registerWithRole(UserRole role) throws Exception {
        Account account = registerUser();
        modifyUser(account.id(), u -> u.setRole(role));
        return account;
    }

    /** Logs in from a fresh address and returns the {@code data} node of the envelope. */
    protected JsonNode login(String email, String password) throws Exception {
        MvcResult result = mockMvc.perform(post("/auth/login")
                        .with(fromIp(randomIp()))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"email":"%s","password":"%s"}
                                """.formatted(email, password)))
                .andExpect(status().isOk())
                .andReturn();
        return body(result).path("data");
    }

    protected String accessToken(Account account) throws Exception {
        return login(account.email(), PASSWORD).path("accessToken").asText();
    }

    /** Direct store edit for test setup; drops the cached principal like a real update would. */
    protected void modifyUser(UUID id, Consumer<User> change) {
        User user = userRepository.findById(id).orElseThrow();
        change.accept(user);
        userRepository.save(user);
        Cache cache = cacheManager.getCache(CacheConfig.PRINCIPAL_BY_ID);
        if (cache != null) {
            cache.evict(id);
        }
    }

    /**
     * Token from the most recent notification of this kind sent to {@code email}. Reset and
     * verification links are mailed from the notification executor, so this waits for them.
     */
    protected String capturedToken(NotificationTemplate template, String email) {
        return capturedToken(template, email, timeout(MAIL_WAIT_MILLIS).atLeastOnce());
    }

    /** Waits until exactly {@code sends} notifications of this kind reached {@code email}. */
    protected String capturedToken(NotificationTemplate template, String email, int sends) {
        return capturedToken(template, email, timeout(MAIL_WAIT_MILLIS).times(sends));
    }

    private String capturedToken(NotificationTemplate template, String email, VerificationMode mode) {
        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> captor = ArgumentCaptor.forClass(Map.class);
        verify(notificationSender, mode).send(eq(template), eq(email), captor.capture());
        return String.valueOf(captor.getValue().get("token"));
    }
}
