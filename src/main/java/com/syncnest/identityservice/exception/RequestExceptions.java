package com.syncnest.identityservice.exception;

import org.springframework.http.HttpStatus;

/**
 * Problems with the incoming client request itself (malformed input, request volume).
 *
 * Conventions:
 *  - type:  https://syncnest.dev/problems/<slug>
 *  - detail: safe, non-sensitive explanation suitable for clients
 */
public final class RequestExceptions {

    private RequestExceptions() {}

    /** 400 Bad Request – field-level or business-rule validation failed. */
    public static final class ValidationFailed extends ApiException {
        public ValidationFailed(String detail) {
            super(HttpStatus.BAD_REQUEST, ErrorKind.VALIDATION_ERROR,
                    "validation-error",
                    "Validation Error",
                    detail);
        }
    }

    /** 429 Too Many Requests – client breached request limits applied by this service. */
    public static final class RateLimited extends ApiException {
        public RateLimited(String detail) {
            super(HttpStatus.TOO_MANY_REQUESTS, ErrorKind.RATE_LIMITED,
                    "rate-limited",
                    "Too Many Requests",
                    detail);
        }
    }
}
