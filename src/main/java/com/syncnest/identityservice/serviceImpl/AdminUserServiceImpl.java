package com.syncnest.identityservice.serviceImpl;

import com.syncnest.identityservice.authorization.AuthenticatedPrincipal;
import com.syncnest.identityservice.dto.AdminUserUpdateRequest;
import com.syncnest.identityservice.dto.UserResponse;
import com.syncnest.identityservice.entity.UserRole;
import com.syncnest.identityservice.exception.AuthExceptions;
import com.syncnest.identityservice.model.UserChange;
import com.syncnest.identityservice.model.UserUpdate;
import com.syncnest.identityservice.service.AdminUserService;
import com.syncnest.identityservice.service.CredentialStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class AdminUserServiceImpl implements AdminUserService {

    private final CredentialStore credentialStore;
    private final UserChangeHandler changeHandler;

    @Override
    @Transactional(readOnly = true)
    public Page<UserResponse> listUsers(Pageable pageable) {
        return credentialStore.findPage(pageable).map(UserResponse::from);
    }

    @Override
    @Transactional(readOnly = true)
    public UserResponse getUser(UUID id) {
        return UserResponse.from(credentialStore.findById(id));
    }

    @Override
    @Transactional
    public UserResponse updateUser(AuthenticatedPrincipal actor, UUID id, AdminUserUpdateRequest request) {
        if (actor.id().equals(id) && weakensOwnAccount(request)) {
            log.warn("Admin user={} attempted to demote, deactivate or block their own account", actor.id());
            throw new AuthExceptions.Forbidden("You cannot demote, deactivate or block your own account.");
        }

        UserChange change = credentialStore.update(id, UserUpdate.builder()
                .role(request.getRole())
                .active(request.getActive())
                .blocked(request.getBlocked())
                .build());
        changeHandler.handle(change, actor(actor));
        return UserResponse.from(change.user());
    }

    @Override
    @Transactional
    public void deleteUser(AuthenticatedPrincipal actor, UUID id) {
        if (actor.id().equals(id)) {
            log.warn("Admin user={} attempted to delete their own account", actor.id());
            throw new AuthExceptions.Forbidden("You cannot delete your own account.");
        }
        UserChange change = credentialStore.update(id, UserUpdate.builder().deleted(true).build());
        changeHandler.handle(change, actor(actor));
    }

    private static boolean weakensOwnAccount(AdminUserUpdateRequest request) {
        return (request.getRole() != null && request.getRole() != UserRole.ADMIN)
                || Boolean.FALSE.equals(request.getActive())
                || Boolean.TRUE.equals(request.getBlocked());
    }

    private static String actor(AuthenticatedPrincipal principal) {
        return principal.role() + ":" + principal.email();
    }
}
