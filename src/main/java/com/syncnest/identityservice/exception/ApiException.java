package com.syncnest.identityservice.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base exception carrying HTTP semantics for RFC 7807 responses.
 * Throw these from services/controllers; GlobalExceptionHandler maps them.
 */
@Getter
public abstract class ApiException extends RuntimeException {

    private static final String TYPE_BASE = "https://syncnest.dev/problems/";

    private final HttpStatus status;
    private final ErrorKind kind;
    private final String type;   // e.g., https://syncnest.dev/problems/not-found
    private final String title;

    protected ApiException(HttpStatus status, ErrorKind kind, String slug, String title, String detail) {
        super(detail);
        this.status = status;
        this.kind = kind;
        this.type = TYPE_BASE + slug;
        this.title = title;
    }
}
