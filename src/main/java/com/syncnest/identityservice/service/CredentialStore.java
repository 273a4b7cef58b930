package com.syncnest.identityservice.service;

import com.syncnest.identityservice.entity.User;
import com.syncnest.identityservice.model.NewUser;
import com.syncnest.identityservice.model.UserChange;
import com.syncnest.identityservice.model.UserUpdate;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

import java.util.Optional;
import java.util.UUID;

/**
 * Sole writer of user records. Uniqueness of email and username is enforced by the
 * database, so concurrent creates with the same email cannot both succeed.
 */
public interface CredentialStore {

    /**
     * @throws com.syncnest.identityservice.exception.UserExceptions.DuplicateEmail    email taken
     * @throws com.syncnest.identityservice.exception.UserExceptions.DuplicateUsername username taken
     */
    User create(NewUser newUser);

    Optional<User> findByEmail(String email);

    /** @throws com.syncnest.identityservice.exception.UserExceptions.UserNotFound when absent or deleted */
    User findById(UUID id);

    Page<User> findPage(Pageable pageable);

    /**
     * Applies the non-null fields of {@code update} and returns both snapshots.
     *
     * @throws com.syncnest.identityservice.exception.UserExceptions.UserNotFound      when absent or deleted
     * @throws com.syncnest.identityservice.exception.UserExceptions.DuplicateUsername new username taken
     */
    UserChange update(UUID id, UserUpdate update);

    boolean verifySecret(User user, String plaintext);

    String hashSecret(String plaintext);

    /** Normalized form used for storage and lookup. */
    static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(java.util.Locale.ROOT);
    }
}
