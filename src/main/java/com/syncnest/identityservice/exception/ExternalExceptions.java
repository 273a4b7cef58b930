package com.syncnest.identityservice.exception;

import org.springframework.http.HttpStatus;

/**
 * Failures of collaborators this service depends on (database, token signer, Redis).
 * Callers may retry; the service itself does not.
 */
public final class ExternalExceptions {

    private ExternalExceptions() {}

    /** 503 Service Unavailable – a dependency is down or timed out. */
    public static final class DependencyUnavailable extends ApiException {
        public DependencyUnavailable(String detail) {
            super(HttpStatus.SERVICE_UNAVAILABLE, ErrorKind.TRANSIENT_DEPENDENCY_FAILURE,
                    "dependency-unavailable",
                    "Service Unavailable",
                    detail);
        }
    }
}
