package com.syncnest.identityservice.authorization;

import com.syncnest.identityservice.exception.AuthExceptions;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.lang.NonNull;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

import java.util.Arrays;
import java.util.List;

/**
 * Enforces {@link RequireCapabilities} before a handler runs.
 */
@Slf4j
@Component
public class CapabilityInterceptor implements HandlerInterceptor {

    @Override
    public boolean preHandle(@NonNull HttpServletRequest request,
                             @NonNull HttpServletResponse response,
                             @NonNull Object handler) {
        if (!(handler instanceof HandlerMethod hm)) {
            return true;
        }
        RequireCapabilities required = AnnotatedElementUtils.findMergedAnnotation(hm.getMethod(), RequireCapabilities.class);
        if (required == null) {
            required = AnnotatedElementUtils.findMergedAnnotation(hm.getBeanType(), RequireCapabilities.class);
        }
        if (required == null) {
            return true;
        }

        List<Capability> capabilities = Arrays.asList(required.value());
        AuthenticatedPrincipal principal = currentPrincipal();
        Decision decision = AuthorizationEvaluator.evaluate(principal, capabilities);
        switch (decision) {
            case UNAUTHENTICATED:
                throw new AuthExceptions.Unauthorized("Authentication is required to access this resource.");
            case FORBIDDEN:
                log.debug("Denied {} {} for user={} (required={})",
                        request.getMethod(), request.getRequestURI(), principal.id(), capabilities);
                throw new AuthExceptions.Forbidden("You do not have permission to perform this action.");
            default:
                return true;
        }
    }

    private AuthenticatedPrincipal currentPrincipal() {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        if (auth != null && auth.getPrincipal() instanceof AuthenticatedPrincipal p) {
            return p;
        }
        return null;
    }
}
