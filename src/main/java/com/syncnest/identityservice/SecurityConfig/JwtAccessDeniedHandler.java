package com.syncnest.identityservice.SecurityConfig;

import com.syncnest.identityservice.exception.ErrorKind;
import com.syncnest.identityservice.utils.ErrorResponseWriter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.lang.NonNull;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.web.access.AccessDeniedHandler;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Sends 403 Forbidden for authenticated requests that lack permission.
 */
@Slf4j
@Component
public class JwtAccessDeniedHandler implements AccessDeniedHandler {

    private final ErrorResponseWriter writer;

    public JwtAccessDeniedHandler(ErrorResponseWriter writer) {
        this.writer = writer;
    }

    @Override
    public void handle(@NonNull HttpServletRequest request,
                       @NonNull HttpServletResponse response,
                       @NonNull AccessDeniedException accessDeniedException) throws IOException {
        log.debug("Access denied to {}: {}", request.getRequestURI(), accessDeniedException.getMessage());
        writer.write(
                request,
                response,
                HttpStatus.FORBIDDEN,
                ErrorKind.FORBIDDEN,
                "forbidden",
                "Forbidden",
                "You do not have permission to access this resource."
        );
    }
}
