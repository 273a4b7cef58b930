package com.syncnest.identityservice.controller;

import com.syncnest.identityservice.entity.UserRole;
import com.syncnest.identityservice.support.IntegrationTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.ResultActions;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class AdminUserIntegrationTest extends IntegrationTestSupport {

    private Account admin;
    private String adminToken;

    @BeforeEach
    void setUp() throws Exception {
        admin = registerWithRole(UserRole.ADMIN);
        adminToken = accessToken(admin);
    }

    @Test
    void bootstrapAdminExists() {
        assertThat(userRepository.findByEmailAndDeletedFalse("root-admin@example.com"))
                .hasValueSatisfying(u -> {
                    assertThat(u.getRole()).isEqualTo(UserRole.ADMIN);
                    assertThat(u.isEmailVerified()).isTrue();
                });
    }

    @Test
    void nonAdminsAreForbidden() throws Exception {
        String moderator = accessToken(registerWithRole(UserRole.MODERATOR));
        String user = accessToken(registerUser());

        for (String token : new String[]{moderator, user}) {
            mockMvc.perform(get("/admin/users").header("Authorization", bearer(token)))
                    .andExpect(status().isForbidden())
                    .andExpect(jsonPath("$.kind").value("FORBIDDEN"));
        }
        mockMvc.perform(get("/admin/users")).andExpect(status().isUnauthorized());
    }

    @Test
    void listIsPagedWithMeta() throws Exception {
        registerUser();

        mockMvc.perform(get("/admin/users").param("size", "2").header("Authorization", bearer(adminToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.length()").value(2))
                .andExpect(jsonPath("$.meta.page").value(0))
                .andExpect(jsonPath("$.meta.size").value(2))
                .andExpect(jsonPath("$.meta.totalItems").isNumber())
                .andExpect(jsonPath("$.meta.totalPages").isNumber());
    }

    @Test
    void getUnknownUserIsNotFound() throws Exception {
        mockMvc.perform(get("/admin/users/{id}", UUID.randomUUID()).header("Authorization", bearer(adminToken)))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.kind").value("NOT_FOUND"));
    }

    @Test
    void promotesUserToModerator() throws Exception {
        Account target = registerUser();

        update(target.id(), "{\"role\":\"MODERATOR\"}")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("User updated"))
                .andExpect(jsonPath("$.data.role").value("MODERATOR"))
                .andExpect(jsonPath("$.data.active").value(true));
    }

    @Test
    void rejectsUnknownRole() throws Exception {
        Account target = registerUser();

        update(target.id(), "{\"role\":\"SUPERUSER\"}")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("VALIDATION_ERROR"));
    }

    @Test
    void adminCannotWeakenOwnAccount() throws Exception {
        update(admin.id(), "{\"is_blocked\":true}").andExpect(status().isForbidden());
        update(admin.id(), "{\"is_active\":false}").andExpect(status().isForbidden());
        update(admin.id(), "{\"role\":\"USER\"}").andExpect(status().isForbidden());

        mockMvc.perform(delete("/admin/users/{id}", admin.id()).header("Authorization", bearer(adminToken)))
                .andExpect(status().isForbidden());

        assertThat(userRepository.findById(admin.id()).orElseThrow().getRole()).isEqualTo(UserRole.ADMIN);
    }

    @Test
    void blockingUserEndsTheirSessions() throws Exception {
        Account target = registerUser();
        var session = login(target.email(), PASSWORD);
        String access = session.path("accessToken").asText();

        update(target.id(), "{\"blocked\":true}")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.blocked").value(true));

        mockMvc.perform(post("/auth/token/refresh")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"refreshToken\":\"" + session.path("refreshToken").asText() + "\"}"))
                .andExpect(status().isUnauthorized());
        mockMvc.perform(get("/profile").header("Authorization", bearer(access)))
                .andExpect(status().isForbidden());

        update(target.id(), "{\"blocked\":false}").andExpect(status().isOk());
        mockMvc.perform(get("/profile").header("Authorization", bearer(access)))
                .andExpect(status().isOk());
    }

    @Test
    void deletedUserDisappears() throws Exception {
        Account target = registerUser();
        String access = accessToken(target);

        mockMvc.perform(delete("/admin/users/{id}", target.id()).header("Authorization", bearer(adminToken)))
                .andExpect(status().isNoContent());

        mockMvc.perform(get("/admin/users/{id}", target.id()).header("Authorization", bearer(adminToken)))
                .andExpect(status().isNotFound());
        mockMvc.perform(get("/profile").header("Authorization", bearer(access)))
                .andExpect(status().isUnauthorized());
        assertThat(userRepository.findById(target.id())).hasValueSatisfying(u -> assertThat(u.isDeleted()).isTrue());
    }

    private ResultActions update(UUID id, String json) throws Exception {
        return mockMvc.perform(put("/admin/users/{id}/update", id)
                .header("Authorization", bearer(adminToken))
                .contentType(MediaType.APPLICATION_JSON)
                .content(json));
    }
}
