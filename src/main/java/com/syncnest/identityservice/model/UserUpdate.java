package com.syncnest.identityservice.model;

import com.syncnest.identityservice.entity.UserRole;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Partial update of a user. A null field leaves the stored value untouched; for the optional
 * profile fields an empty string clears the stored value.
 */
@Value
@Builder
public class UserUpdate {
    String username;
    String recoveryEmail;
    String phoneNumber;
    String address;
    String country;
    String bio;
    UserRole role;
    Boolean active;
    Boolean blocked;
    Boolean emailVerified;
    String passwordHash;
    Instant lastLoginAt;
    Boolean deleted;
}
