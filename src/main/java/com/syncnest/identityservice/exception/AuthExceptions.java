package com.syncnest.identityservice.exception;

import org.springframework.http.HttpStatus;

/**
 * Authentication and authorization failures. Details stay generic so callers
 * cannot tell which check failed.
 */
public final class AuthExceptions {

    private AuthExceptions() {}

    public static final String INVALID_CREDENTIALS = "Invalid email or password.";
    public static final String INVALID_TOKEN = "Token is invalid or expired.";

    /** 401 Unauthorized – bad credentials or a bad, expired or revoked token. */
    public static final class Unauthorized extends ApiException {
        public Unauthorized(String detail) {
            super(HttpStatus.UNAUTHORIZED, ErrorKind.UNAUTHORIZED,
                    "unauthorized",
                    "Unauthorized",
                    detail);
        }
    }

    /** 403 Forbidden – authenticated but lacking a required capability. */
    public static final class Forbidden extends ApiException {
        public Forbidden(String detail) {
            super(HttpStatus.FORBIDDEN, ErrorKind.FORBIDDEN,
                    "forbidden",
                    "Forbidden",
                    detail);
        }
    }

    /** 400 Bad Request – reset or verification token unknown, consumed or expired. */
    public static final class InvalidOrExpiredToken extends ApiException {
        public InvalidOrExpiredToken() {
            super(HttpStatus.BAD_REQUEST, ErrorKind.INVALID_OR_EXPIRED_TOKEN,
                    "invalid-or-expired-token",
                    "Invalid Or Expired Token",
                    "The link is invalid or has expired.");
        }
    }
}
