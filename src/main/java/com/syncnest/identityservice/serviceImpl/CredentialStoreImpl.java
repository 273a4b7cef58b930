package com.syncnest.identityservice.serviceImpl;

import com.syncnest.identityservice.config.CacheConfig;
import com.syncnest.identityservice.entity.User;
import com.syncnest.identityservice.entity.UserRole;
import com.syncnest.identityservice.exception.ApiException;
import com.syncnest.identityservice.exception.UserExceptions;
import com.syncnest.identityservice.model.NewUser;
import com.syncnest.identityservice.model.UserChange;
import com.syncnest.identityservice.model.UserSnapshot;
import com.syncnest.identityservice.model.UserUpdate;
import com.syncnest.identityservice.repository.UserRepository;
import com.syncnest.identityservice.service.CredentialStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.hibernate.exception.ConstraintViolationException;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class CredentialStoreImpl implements CredentialStore {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final CacheManager cacheManager;

    @Override
    @Transactional
    public User create(NewUser newUser) {
        final String email = CredentialStore.normalizeEmail(newUser.email());
        final String username = newUser.username().trim();

        // Friendly early answer only; the unique constraints below are the real guarantee.
        if (userRepository.existsByEmail(email)) {
            throw new UserExceptions.DuplicateEmail();
        }
        if (userRepository.existsByUsername(username)) {
            throw new UserExceptions.DuplicateUsername();
        }

        User user = User.builder()
                .email(email)
                .username(username)
                .password(newUser.passwordHash())
                .role(newUser.role() != null ? newUser.role() : UserRole.USER)
                .recoveryEmail(trimToNull(newUser.recoveryEmail()))
                .phoneNumber(trimToNull(newUser.phoneNumber()))
                .address(trimToNull(newUser.address()))
                .country(trimToNull(newUser.country()))
                .bio(trimToNull(newUser.bio()))
                .build();
        try {
            return userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException ex) {
            throw translate(ex);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<User> findByEmail(String email) {
        if (email == null || email.isBlank()) return Optional.empty();
        return userRepository.findByEmailAndDeletedFalse(CredentialStore.normalizeEmail(email));
    }

    @Override
    @Transactional(readOnly = true)
    public User findById(UUID id) {
        return userRepository.findByIdAndDeletedFalse(id)
                .orElseThrow(UserExceptions.UserNotFound::new);
    }

    @Override
    @Transactional(readOnly = true)
    public Page<User> findPage(Pageable pageable) {
        return userRepository.findAllByDeletedFalse(pageable);
    }

    @Override
    @Transactional
    public UserChange update(UUID id, UserUpdate update) {
        User user = userRepository.findByIdAndDeletedFalse(id)
                .orElseThrow(UserExceptions.UserNotFound::new);
        UserSnapshot before = UserSnapshot.of(user);

        if (update.getUsername() != null) {
            String username = update.getUsername().trim();
            if (!username.equals(user.getUsername())) {
                if (userRepository.existsByUsernameAndIdNot(username, id)) {
                    throw new UserExceptions.DuplicateUsername();
                }
                user.setUsername(username);
            }
        }
        if (update.getRecoveryEmail() != null) {
            String recovery = trimToNull(update.getRecoveryEmail());
            user.setRecoveryEmail(recovery == null ? null : recovery.toLowerCase(Locale.ROOT));
        }
        if (update.getPhoneNumber() != null) user.setPhoneNumber(trimToNull(update.getPhoneNumber()));
        if (update.getAddress() != null) user.setAddress(trimToNull(update.getAddress()));
        if (update.getCountry() != null) user.setCountry(trimToNull(update.getCountry()));
        if (update.getBio() != null) user.setBio(trimToNull(update.getBio()));
        if (update.getRole() != null) user.setRole(update.getRole());
        if (update.getActive() != null) user.setActive(update.getActive());
        if (update.getBlocked() != null) user.setBlocked(update.getBlocked());
        if (update.getEmailVerified() != null) user.setEmailVerified(update.getEmailVerified());
        if (update.getPasswordHash() != null) user.setPassword(update.getPasswordHash());
        if (update.getLastLoginAt() != null) user.setLastLoginAt(update.getLastLoginAt());
        if (update.getDeleted() != null) user.setDeleted(update.getDeleted());

        final User saved;
        try {
            saved = userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException ex) {
            throw translate(ex);
        }
        evictPrincipal(id);
        return new UserChange(saved, before, UserSnapshot.of(saved));
    }

    @Override
    public boolean verifySecret(User user, String plaintext) {
        if (user == null || plaintext == null) return false;
        return passwordEncoder.matches(plaintext, user.getPassword());
    }

    @Override
    public String hashSecret(String plaintext) {
        return passwordEncoder.encode(plaintext);
    }

    // -------------------- helpers --------------------

    /** Evicts now and again after commit, so a concurrent reader cannot re-cache the old state. */
    private void evictPrincipal(UUID id) {
        Cache cache = cacheManager.getCache(CacheConfig.PRINCIPAL_BY_ID);
        if (cache == null) return;
        cache.evict(id);
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    cache.evict(id);
                }
            });
        }
    }

    private ApiException translate(DataIntegrityViolationException ex) {
        String constraint = constraintName(ex);
        log.debug("Unique constraint violated: {}", constraint);
        if (constraint.contains(User.UK_USERNAME)) {
            return new UserExceptions.DuplicateUsername();
        }
        if (constraint.contains(User.UK_EMAIL)) {
            return new UserExceptions.DuplicateEmail();
        }
        throw ex;
    }

    private String constraintName(DataIntegrityViolationException ex) {
        Throwable t = ex;
        while (t != null) {
            if (t instanceof ConstraintViolationException cve && cve.getConstraintName() != null) {
                return cve.getConstraintName().toLowerCase(Locale.ROOT);
            }
            t = t.getCause();
        }
        String msg = ex.getMostSpecificCause().getMessage();
        return msg == null ? "" : msg.toLowerCase(Locale.ROOT);
    }

    private static String trimToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
