package com.syncnest.identityservice.serviceImpl;

import com.syncnest.identityservice.authorization.AuthenticatedPrincipal;
import com.syncnest.identityservice.config.CacheConfig;
import com.syncnest.identityservice.repository.UserRepository;
import com.syncnest.identityservice.service.PrincipalService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class PrincipalServiceImpl implements PrincipalService {

    private final UserRepository userRepository;

    @Override
    @Transactional(readOnly = true)
    @Cacheable(
            cacheNames = CacheConfig.PRINCIPAL_BY_ID,
            key = "#userId",
            unless = "#result == null"
    )
    public Optional<AuthenticatedPrincipal> loadPrincipal(UUID userId) {
        if (userId == null) return Optional.empty();
        log.debug("Loading principal for user={}", userId);
        return userRepository.findByIdAndDeletedFalse(userId).map(AuthenticatedPrincipal::of);
    }
}
