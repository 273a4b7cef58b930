package com.syncnest.identityservice.model;

public enum NotificationTemplate {
    WELCOME,
    EMAIL_VERIFICATION,
    PASSWORD_RESET,
    PASSWORD_CHANGED
}
