package com.syncnest.identityservice.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Success envelope applied by {@link com.syncnest.identityservice.utils.SuccessEnvelopeAdvice}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(
        Instant timestamp,
        String requestId,
        String message,
        T data,
        Object meta
) {
    public static <T> ApiResponse<T> of(Instant timestamp, String requestId, String message, T data, Object meta) {
        return new ApiResponse<>(timestamp, requestId, message, data, meta);
    }
}
