package com.syncnest.identityservice.dto;

import com.syncnest.identityservice.entity.User;
import com.syncnest.identityservice.entity.UserRole;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Builder
public class UserResponse {
    private UUID id;
    private String email;
    private String username;
    private String recoveryEmail;
    private String phoneNumber;
    private String address;
    private String country;
    private String bio;
    private UserRole role;
    private boolean active;
    private boolean blocked;
    private boolean emailVerified;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private Instant lastLogin;

    public static UserResponse from(User user) {
        return UserResponse.builder()
                .id(user.getId())
                .email(user.getEmail())
                .username(user.getUsername())
                .recoveryEmail(user.getRecoveryEmail())
                .phoneNumber(user.getPhoneNumber())
                .address(user.getAddress())
                .country(user.getCountry())
                .bio(user.getBio())
                .role(user.getRole())
                .active(user.isActive())
                .blocked(user.isBlocked())
                .emailVerified(user.isEmailVerified())
                .createdAt(user.getCreatedAt())
                .updatedAt(user.getUpdatedAt())
                .lastLogin(user.getLastLoginAt())
                .build();
    }
}
