package com.syncnest.identityservice.exception;

/**
 * Stable, machine-readable error categories. Rendered as the {@code kind} property of every problem response.
 */
public enum ErrorKind {
    VALIDATION_ERROR,
    DUPLICATE_RESOURCE,
    INVALID_OR_EXPIRED_TOKEN,
    UNAUTHORIZED,
    FORBIDDEN,
    NOT_FOUND,
    RATE_LIMITED,
    TRANSIENT_DEPENDENCY_FAILURE,
    INTERNAL_ERROR
}
