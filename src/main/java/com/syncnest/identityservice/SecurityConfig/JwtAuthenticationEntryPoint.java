package com.syncnest.identityservice.SecurityConfig;

import com.syncnest.identityservice.exception.ErrorKind;
import com.syncnest.identityservice.utils.ErrorResponseWriter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.lang.NonNull;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Sends 401 Unauthorized for unauthenticated requests.
 * Adds RFC 6750 WWW-Authenticate hint when the client attempted Bearer auth.
 */
@Slf4j
@Component
public class JwtAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private final ErrorResponseWriter writer;

    public JwtAuthenticationEntryPoint(ErrorResponseWriter writer) {
        this.writer = writer;
    }

    @Override
    public void commence(@NonNull HttpServletRequest request,
                         @NonNull HttpServletResponse response,
                         @NonNull AuthenticationException authException) throws IOException {
        String ah = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (ah != null && ah.startsWith("Bearer ")) {
            response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Bearer error=\"invalid_token\"");
        }

        log.debug("Unauthenticated request to {}", request.getRequestURI());
        writer.write(
                request,
                response,
                HttpStatus.UNAUTHORIZED,
                ErrorKind.UNAUTHORIZED,
                "unauthorized",
                "Unauthorized",
                "Authentication is required to access this resource."
        );
    }
}
