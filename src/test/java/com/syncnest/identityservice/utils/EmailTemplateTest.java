package com.syncnest.identityservice.utils;

import com.syncnest.identityservice.model.NotificationTemplate;
import org.junit.jupiter.api.Test;
import org.springframework.mail.SimpleMailMessage;

import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class EmailTemplateTest {

    private final EmailTemplate template = new EmailTemplate("no-reply@syncnest.dev", "https://app.syncnest.dev");

    @Test
    void resetMailCarriesLinkWithTokenAndUserId() {
        UUID userId = UUID.randomUUID();

        SimpleMailMessage message = template.render(NotificationTemplate.PASSWORD_RESET, "bob@example.com",
                Map.of("username", "bob", "userId", userId, "token", "abc_DEF-123", "ttlMinutes", 60L));

        assertThat(message.getTo()).containsExactly("bob@example.com");
        assertThat(message.getFrom()).isEqualTo("no-reply@syncnest.dev");
        assertThat(message.getSubject()).isEqualTo("Reset your password");
        assertThat(message.getText())
                .contains("https://app.syncnest.dev/reset-password?uid=" + userId + "&token=abc_DEF-123")
                .contains("60 minutes");
    }

    @Test
    void everyTemplateHasSubjectAndBody() {
        for (NotificationTemplate t : NotificationTemplate.values()) {
            SimpleMailMessage message = template.render(t, "x@example.com",
                    Map.of("userId", UUID.randomUUID(), "token", "t", "ttlMinutes", 5L));
            assertThat(message.getSubject()).as(t.name()).isNotBlank();
            assertThat(message.getText()).as(t.name()).startsWith("Hi there,");
        }
    }
}
