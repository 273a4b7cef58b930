package com.syncnest.identityservice.controller;

import com.syncnest.identityservice.authorization.AuthenticatedPrincipal;
import com.syncnest.identityservice.authorization.Capability;
import com.syncnest.identityservice.authorization.RequireCapabilities;
import com.syncnest.identityservice.dto.AdminUserUpdateRequest;
import com.syncnest.identityservice.dto.UserResponse;
import com.syncnest.identityservice.service.AdminUserService;
import com.syncnest.identityservice.utils.ResponseMessage;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.web.PageableDefault;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/admin/users")
@RequiredArgsConstructor
@RequireCapabilities(Capability.ADMIN)
@SecurityRequirement(name = "bearerAuth")
@Tag(name = "User administration")
public class AdminUserController {

    private final AdminUserService adminUserService;

    @GetMapping
    public Page<UserResponse> list(@PageableDefault(size = 20, sort = "createdAt", direction = Sort.Direction.DESC)
                                   Pageable pageable) {
        return adminUserService.listUsers(pageable);
    }

    @GetMapping("/{id}")
    public UserResponse get(@PathVariable UUID id) {
        return adminUserService.getUser(id);
    }

    @PutMapping("/{id}/update")
    @ResponseMessage("User updated")
    public UserResponse update(@AuthenticationPrincipal AuthenticatedPrincipal actor,
                               @PathVariable UUID id,
                               @Valid @RequestBody AdminUserUpdateRequest request) {
        return adminUserService.updateUser(actor, id, request);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@AuthenticationPrincipal AuthenticatedPrincipal actor, @PathVariable UUID id) {
        adminUserService.deleteUser(actor, id);
        return ResponseEntity.noContent().build();
    }
}
