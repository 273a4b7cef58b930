package com.syncnest.identityservice.Validators;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.BeanWrapperImpl;
import org.springframework.core.io.ClassPathResource;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Password strength rules:
 * <ul>
 *   <li>at least {@value #MIN_LENGTH} characters</li>
 *   <li>not entirely numeric</li>
 *   <li>not on the common-password list</li>
 *   <li>not too similar to the user's email or username</li>
 * </ul>
 * Usable as a bean-validation constraint and directly from services via {@link #violations}.
 */
@Slf4j
public class PasswordPolicyValidator implements ConstraintValidator<PasswordPolicy, Object> {

    public static final int MIN_LENGTH = 8;

    /** Ratio at or above which a password counts as too similar to a user attribute. */
    static final double MAX_SIMILARITY = 0.7;

    private static final Set<String> COMMON_PASSWORDS = loadCommonPasswords();

    private String passwordField;
    private String emailField;
    private String usernameField;

    @Override
    public void initialize(PasswordPolicy constraint) {
        this.passwordField = constraint.passwordField();
        this.emailField = constraint.emailField();
        this.usernameField = constraint.usernameField();
    }

    @Override
    public boolean isValid(Object value, ConstraintValidatorContext context) {
        if (value == null) return true;

        BeanWrapperImpl wrapper = new BeanWrapperImpl(value);
        String password = (String) wrapper.getPropertyValue(passwordField);
        if (password == null || password.isBlank()) return true;

        String email = emailField.isEmpty() ? null : (String) wrapper.getPropertyValue(emailField);
        String username = usernameField.isEmpty() ? null : (String) wrapper.getPropertyValue(usernameField);

        List<String> violations = violations(password, email, username);
        if (violations.isEmpty()) return true;

        context.disableDefaultConstraintViolation();
        for (String violation : violations) {
            context.buildConstraintViolationWithTemplate(violation)
                    .addPropertyNode(passwordField)
                    .addConstraintViolation();
        }
        return false;
    }

    /**
     * @return human-readable rule violations, empty when the password is acceptable
     */
    public static List<String> violations(String password, String email, String username) {
        List<String> out = new ArrayList<>(4);
        if (password == null) {
            out.add("Password is required.");
            return out;
        }
        if (password.length() < MIN_LENGTH) {
            out.add("This password is too short. It must contain at least " + MIN_LENGTH + " characters.");
        }
        if (password.chars().allMatch(Character::isDigit)) {
            out.add("This password is entirely numeric.");
        }
        if (COMMON_PASSWORDS.contains(password.trim().toLowerCase(Locale.ROOT))) {
            out.add("This password is too common.");
        }
        if (tooSimilar(password, email) || tooSimilar(password, username)) {
            out.add("The password is too similar to your email or username.");
        }
        return out;
    }

    static boolean tooSimilar(String password, String attribute) {
        if (attribute == null || attribute.isBlank()) return false;
        String pw = password.toLowerCase(Locale.ROOT);
        String attr = attribute.toLowerCase(Locale.ROOT);

        // Compare against the whole value and each of its word parts (e.g. "jane", "doe", "example")
        List<String> candidates = new ArrayList<>();
        candidates.add(attr);
        for (String part : attr.split("\\W+")) {
            if (part.length() >= 3) candidates.add(part);
        }
        for (String candidate : candidates) {
            if (similarity(pw, candidate) >= MAX_SIMILARITY) return true;
        }
        return false;
    }

    /** 2 * LCS / (|a| + |b|), in [0, 1]. */
    static double similarity(String a, String b) {
        if (a.isEmpty() && b.isEmpty()) return 1.0;
        int[] prev = new int[b.length() + 1];
        int[] curr = new int[b.length() + 1];
        for (int i = 1; i <= a.length(); i++) {
            for (int j = 1; j <= b.length(); j++) {
                curr[j] = a.charAt(i - 1) == b.charAt(j - 1)
                        ? prev[j - 1] + 1
                        : Math.max(prev[j], curr[j - 1]);
            }
            int[] tmp = prev;
            prev = curr;
            curr = tmp;
        }
        return 2.0 * prev[b.length()] / (a.length() + b.length());
    }

    private static Set<String> loadCommonPasswords() {
        ClassPathResource resource = new ClassPathResource("common-passwords.txt");
        if (!resource.exists()) {
            log.warn("common-passwords.txt not found on classpath; common-password check disabled");
            return Collections.emptySet();
        }
        Set<String> set = new HashSet<>();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                String trimmed = line.trim();
                if (!trimmed.isEmpty() && !trimmed.startsWith("#")) {
                    set.add(trimmed.toLowerCase(Locale.ROOT));
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load common-passwords.txt", e);
        }
        return Collections.unmodifiableSet(set);
    }
}
