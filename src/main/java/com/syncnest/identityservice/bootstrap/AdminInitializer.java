package com.syncnest.identityservice.bootstrap;

import com.syncnest.identityservice.entity.User;
import com.syncnest.identityservice.entity.UserRole;
import com.syncnest.identityservice.exception.UserExceptions;
import com.syncnest.identityservice.model.NewUser;
import com.syncnest.identityservice.model.UserUpdate;
import com.syncnest.identityservice.service.CredentialStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Creates the first administrator when {@code app.init.admin.email} and
 * {@code app.init.admin.password} are set. Does nothing if the account already exists.
 */
@Slf4j
@Component
@Order(1)
public class AdminInitializer implements CommandLineRunner {

    private final CredentialStore credentialStore;
    private final String adminEmail;
    private final String adminPassword;
    private final String adminUsername;

    public AdminInitializer(CredentialStore credentialStore,
                            @Value("${app.init.admin.email:}") String adminEmail,
                            @Value("${app.init.admin.password:}") String adminPassword,
                            @Value("${app.init.admin.username:admin}") String adminUsername) {
        this.credentialStore = credentialStore;
        this.adminEmail = adminEmail;
        this.adminPassword = adminPassword;
        this.adminUsername = adminUsername;
    }

    @Override
    public void run(String... args) {
        if (!StringUtils.hasText(adminEmail) || !StringUtils.hasText(adminPassword)) {
            log.debug("No bootstrap admin configured");
            return;
        }
        if (credentialStore.findByEmail(adminEmail).isPresent()) {
            log.info("Bootstrap admin '{}' already present.", adminEmail);
            return;
        }

        try {
            User admin = credentialStore.create(NewUser.builder()
                    .email(adminEmail)
                    .username(adminUsername)
                    .passwordHash(ensureEncoded(adminPassword))
                    .role(UserRole.ADMIN)
                    .build());
            credentialStore.update(admin.getId(), UserUpdate.builder().emailVerified(true).build());
            log.info("Bootstrap admin '{}' added successfully.", adminEmail);
        } catch (UserExceptions.DuplicateEmail | UserExceptions.DuplicateUsername ex) {
            // Another instance created it first
            log.info("Bootstrap admin not created: {}", ex.getMessage());
        }
    }

    private String ensureEncoded(String rawOrEncoded) {
        if (isBcrypt(rawOrEncoded)) return rawOrEncoded;
        return credentialStore.hashSecret(rawOrEncoded);
    }

    private boolean isBcrypt(String value) {
        return value.startsWith("$2a$") || value.startsWith("$2b$") || value.startsWith("$2y$");
    }
}
