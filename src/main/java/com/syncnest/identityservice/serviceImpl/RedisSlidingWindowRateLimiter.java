package com.syncnest.identityservice.serviceImpl;

import com.syncnest.identityservice.service.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * Sliding window shared by every instance, kept in a Redis sorted set per key
 * (score = admission time in millis). Prune, count and add run in one Lua script,
 * which Redis executes atomically.
 * Redis failures propagate as Spring DataAccessExceptions and surface as 503.
 */
@Slf4j
public class RedisSlidingWindowRateLimiter implements RateLimiter {

    private static final String ADMIT_LUA = """
            redis.call('ZREMRANGEBYSCORE', KEYS[1], '-inf', tonumber(ARGV[1]) - tonumber(ARGV[2]))
            if redis.call('ZCARD', KEYS[1]) < tonumber(ARGV[3]) then
              redis.call('ZADD', KEYS[1], ARGV[1], ARGV[4])
              redis.call('PEXPIRE', KEYS[1], ARGV[2])
              return 1
            end
            return 0
            """;

    private static final DefaultRedisScript<Long> ADMIT_SCRIPT = new DefaultRedisScript<>(ADMIT_LUA, Long.class);

    private final String name;
    private final int maxRequests;
    private final Duration window;
    private final Clock clock;
    private final StringRedisTemplate redis;

    public RedisSlidingWindowRateLimiter(String name, int maxRequests, Duration window,
                                         Clock clock, StringRedisTemplate redis) {
        this.name = name;
        this.maxRequests = maxRequests;
        this.window = window;
        this.clock = clock;
        this.redis = redis;
    }

    @Override
    public boolean admit(String key) {
        long now = clock.millis();
        Long result = redis.execute(ADMIT_SCRIPT, List.of(redisKey(key)),
                Long.toString(now),
                Long.toString(window.toMillis()),
                Integer.toString(maxRequests),
                now + ":" + UUID.randomUUID());
        boolean admitted = result != null && result == 1L;
        if (!admitted) {
            log.warn("Rate limit '{}' exceeded for key={}", name, key);
        }
        return admitted;
    }

    @Override
    public int remaining(String key) {
        long threshold = clock.millis() - window.toMillis();
        Long live = redis.opsForZSet().count(redisKey(key), threshold + 1, Double.POSITIVE_INFINITY);
        return Math.max(0, maxRequests - (live == null ? 0 : live.intValue()));
    }

    @Override
    public int maxRequests() {
        return maxRequests;
    }

    private String redisKey(String key) {
        return "rl:" + name + ":" + key;
    }
}
