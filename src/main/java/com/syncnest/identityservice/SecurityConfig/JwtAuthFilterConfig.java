package com.syncnest.identityservice.SecurityConfig;

import com.syncnest.identityservice.authorization.AuthenticatedPrincipal;
import com.syncnest.identityservice.exception.ApiException;
import com.syncnest.identityservice.model.TokenClaims;
import com.syncnest.identityservice.service.PrincipalService;
import com.syncnest.identityservice.service.TokenService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Optional;

/**
 * Authenticates requests carrying a Bearer access token. The token itself is checked
 * statelessly; role and status flags come from the cached principal lookup.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JwtAuthFilterConfig extends OncePerRequestFilter {

    private static final String BEARER = "Bearer ";

    private final TokenService tokenService;
    private final PrincipalService principalService;

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {

        final String authHeader = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (!StringUtils.hasText(authHeader) || !authHeader.startsWith(BEARER)
                || SecurityContextHolder.getContext().getAuthentication() != null) {
            filterChain.doFilter(request, response);
            return;
        }

        try {
            TokenClaims claims = tokenService.verifyAccess(authHeader.substring(BEARER.length()).trim());
            Optional<AuthenticatedPrincipal> principal = principalService.loadPrincipal(claims.userId());

            if (principal.isPresent()) {
                SecurityContext securityContext = SecurityContextHolder.createEmptyContext();
                UsernamePasswordAuthenticationToken authToken =
                        new UsernamePasswordAuthenticationToken(principal.get(), null, principal.get().authorities());
                authToken.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
                securityContext.setAuthentication(authToken);
                SecurityContextHolder.setContext(securityContext);
            } else {
                log.debug("Access token for unknown or deleted user={}", claims.userId());
            }
        } catch (ApiException ex) {
            // Unauthenticated; the entry point answers 401 if the route needs a caller
            log.debug("Access token rejected: {}", ex.getMessage());
        }

        filterChain.doFilter(request, response);
    }
}
