package com.syncnest.identityservice.config;

import com.syncnest.identityservice.service.RateLimiter;
import com.syncnest.identityservice.serviceImpl.RedisSlidingWindowRateLimiter;
import com.syncnest.identityservice.serviceImpl.SlidingWindowRateLimiter;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.time.Duration;

/**
 * Named rate limiter instances. Backend is chosen by {@code app.rate-limit.backend}:
 * {@code memory} (default, per process) or {@code redis} (shared across instances).
 */
@Configuration
public class RateLimitConfig {

    public static final String LOGIN = "loginRateLimiter";
    public static final String ACTION = "actionRateLimiter";

    @Value("${app.rate-limit.backend:memory}")
    private String backend;

    @Bean(name = LOGIN)
    public RateLimiter loginRateLimiter(@Value("${app.rate-limit.login.max-requests:5}") int maxRequests,
                                        @Value("${app.rate-limit.login.window-seconds:60}") long windowSeconds,
                                        Clock clock,
                                        ObjectProvider<StringRedisTemplate> redis) {
        return create("login", maxRequests, Duration.ofSeconds(windowSeconds), clock, redis);
    }

    /** Password-reset and verification-email requests. */
    @Bean(name = ACTION)
    public RateLimiter actionRateLimiter(@Value("${app.rate-limit.action.max-requests:5}") int maxRequests,
                                         @Value("${app.rate-limit.action.window-seconds:3600}") long windowSeconds,
                                         Clock clock,
                                         ObjectProvider<StringRedisTemplate> redis) {
        return create("action", maxRequests, Duration.ofSeconds(windowSeconds), clock, redis);
    }

    private RateLimiter create(String name, int maxRequests, Duration window, Clock clock,
                               ObjectProvider<StringRedisTemplate> redis) {
        if ("redis".equalsIgnoreCase(backend)) {
            StringRedisTemplate template = redis.getIfAvailable();
            if (template == null) {
                throw new IllegalStateException("app.rate-limit.backend=redis but no Redis template is configured");
            }
            return new RedisSlidingWindowRateLimiter(name, maxRequests, window, clock, template);
        }
        return new SlidingWindowRateLimiter(name, maxRequests, window, clock);
    }
}
