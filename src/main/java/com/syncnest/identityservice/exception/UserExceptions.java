package com.syncnest.identityservice.exception;

import org.springframework.http.HttpStatus;

/**
 * User-record exceptions (registration, profile and admin updates).
 */
public final class UserExceptions {

    private UserExceptions() {}

    /** 404 Not Found – user record not present or soft-deleted. */
    public static final class UserNotFound extends ApiException {
        public UserNotFound() {
            super(HttpStatus.NOT_FOUND, ErrorKind.NOT_FOUND,
                    "user-not-found",
                    "User Not Found",
                    "User not found.");
        }
    }

    /** 400 Bad Request – email already registered. */
    public static final class DuplicateEmail extends ApiException {
        public DuplicateEmail() {
            super(HttpStatus.BAD_REQUEST, ErrorKind.DUPLICATE_RESOURCE,
                    "duplicate-email",
                    "Duplicate Resource",
                    "A user with this email already exists.");
        }
    }

    /** 400 Bad Request – username already taken. */
    public static final class DuplicateUsername extends ApiException {
        public DuplicateUsername() {
            super(HttpStatus.BAD_REQUEST, ErrorKind.DUPLICATE_RESOURCE,
                    "duplicate-username",
                    "Duplicate Resource",
                    "This username is already taken.");
        }
    }
}
