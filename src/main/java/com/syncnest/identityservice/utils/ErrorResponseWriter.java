package com.syncnest.identityservice.utils;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.syncnest.identityservice.exception.ApiException;
import com.syncnest.identityservice.exception.ErrorKind;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.time.Clock;
import java.time.OffsetDateTime;

/**
 * Writes RFC 7807 problem responses. Used by the MVC exception handler and by the
 * security entry point / access-denied handler, which run outside the dispatcher.
 */
@Component
public class ErrorResponseWriter {

    private static final String TYPE_BASE = "https://syncnest.dev/problems/";

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ErrorResponseWriter(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public void write(@NonNull HttpServletRequest req,
                      @NonNull HttpServletResponse resp,
                      @NonNull ApiException ex) throws IOException {
        String detail = ex.getMessage();
        render(req, resp, ex.getStatus(), ex.getKind(), ex.getType(), ex.getTitle(),
                (detail == null || detail.isBlank()) ? "Request could not be processed." : detail);
    }

    public void write(@NonNull HttpServletRequest req,
                      @NonNull HttpServletResponse resp,
                      @NonNull HttpStatus status,
                      @NonNull ErrorKind kind,
                      @NonNull String slug,
                      @NonNull String title,
                      @NonNull String detail) throws IOException {
        render(req, resp, status, kind, TYPE_BASE + slug, title, detail);
    }

    private void render(HttpServletRequest req,
                        HttpServletResponse resp,
                        HttpStatus status,
                        ErrorKind kind,
                        String type,
                        String title,
                        String detail) throws IOException {

        if (resp.isCommitted()) return;

        ProblemDetail pd = ProblemDetail.forStatus(status);
        pd.setType(URI.create(type));
        pd.setTitle(title);
        pd.setDetail(detail);
        pd.setInstance(URI.create(req.getRequestURI()));

        pd.setProperty("kind", kind.name());
        pd.setProperty("timestamp", OffsetDateTime.now(clock).toString());
        pd.setProperty("path", req.getRequestURI());
        pd.setProperty("requestId", RequestIds.resolve(req, resp));

        resp.setStatus(status.value());
        resp.setHeader("Cache-Control", "no-store");
        resp.setHeader("Pragma", "no-cache");
        resp.setCharacterEncoding("UTF-8");
        resp.setContentType("application/problem+json");

        objectMapper.writeValue(resp.getOutputStream(), pd);
    }
}
