package com.syncnest.identityservice.utils;

import com.syncnest.identityservice.model.NotificationTemplate;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Map;

/**
 * Plain-text bodies for account notifications. Links point at the front end, which posts
 * the token back to the matching confirm endpoint.
 */
@Component
public class EmailTemplate {

    private final String from;
    private final String frontendUrl;

    public EmailTemplate(@Value("${app.mail.from:no-reply@syncnest.dev}") String from,
                         @Value("${app.frontend.url:http://localhost:3000}") String frontendUrl) {
        this.from = from;
        this.frontendUrl = frontendUrl;
    }

    public SimpleMailMessage render(NotificationTemplate template, String to, Map<String, Object> context) {
        String username = String.valueOf(context.getOrDefault("username", "there"));

        SimpleMailMessage message = new SimpleMailMessage();
        message.setFrom(from);
        message.setTo(to);

        switch (template) {
            case WELCOME -> {
                message.setSubject("Welcome to SyncNest");
                message.setText("Hi " + username + ",\n\nYour account has been created. "
                        + "Please confirm your email address using the separate verification message.");
            }
            case EMAIL_VERIFICATION -> {
                message.setSubject("Confirm your email address");
                message.setText("Hi " + username + ",\n\nConfirm your email address by opening this link:\n"
                        + link("/verify-email", context)
                        + "\n\nThe link expires in " + context.get("ttlMinutes") + " minutes.");
            }
            case PASSWORD_RESET -> {
                message.setSubject("Reset your password");
                message.setText("Hi " + username + ",\n\nReset your password by opening this link:\n"
                        + link("/reset-password", context)
                        + "\n\nThe link expires in " + context.get("ttlMinutes") + " minutes. "
                        + "If you did not ask for a reset, ignore this message.");
            }
            case PASSWORD_CHANGED -> {
                message.setSubject("Your password was changed");
                message.setText("Hi " + username + ",\n\nThe password on your account was just changed "
                        + "and every other session was signed out. If this was not you, reset your password now.");
            }
        }
        return message;
    }

    private String link(String path, Map<String, Object> context) {
        return UriComponentsBuilder.fromHttpUrl(frontendUrl)
                .path(path)
                .queryParam("uid", context.get("userId"))
                .queryParam("token", context.get("token"))
                .build()
                .encode()
                .toUriString();
    }
}
