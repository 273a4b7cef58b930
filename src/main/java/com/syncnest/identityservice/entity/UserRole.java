package com.syncnest.identityservice.entity;

public enum UserRole {
    ADMIN,
    MODERATOR,
    USER;

    /** Spring Security authority name. */
    public String authority() {
        return "ROLE_" + name();
    }

    public boolean isStaff() {
        return this == ADMIN || this == MODERATOR;
    }
}
