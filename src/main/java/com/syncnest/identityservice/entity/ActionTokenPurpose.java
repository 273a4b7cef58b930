package com.syncnest.identityservice.entity;

public enum ActionTokenPurpose {
    PASSWORD_RESET,
    EMAIL_VERIFICATION
}
