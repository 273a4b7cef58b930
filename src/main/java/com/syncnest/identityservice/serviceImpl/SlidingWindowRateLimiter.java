package com.syncnest.identityservice.serviceImpl;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.syncnest.identityservice.service.RateLimiter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.concurrent.ConcurrentMap;

/**
 * In-process sliding window. Each key owns a deque of admission timestamps; pruning,
 * counting and appending happen inside {@link ConcurrentMap#compute}, so calls for the
 * same key are serialized while different keys proceed in parallel.
 * Idle keys are dropped by Caffeine once a full window has passed without an admission;
 * {@link #remaining} reads quietly and never extends a key's lifetime.
 */
@Slf4j
public class SlidingWindowRateLimiter implements RateLimiter {

    private final String name;
    private final int maxRequests;
    private final Duration window;
    private final Clock clock;
    private final Cache<String, Deque<Instant>> cache;
    private final ConcurrentMap<String, Deque<Instant>> windows;

    public SlidingWindowRateLimiter(String name, int maxRequests, Duration window, Clock clock) {
        this(name, maxRequests, window, clock, Ticker.systemTicker());
    }

    SlidingWindowRateLimiter(String name, int maxRequests, Duration window, Clock clock, Ticker ticker) {
        if (maxRequests < 1) throw new IllegalArgumentException("maxRequests must be >= 1");
        if (window.isZero() || window.isNegative()) throw new IllegalArgumentException("window must be positive");
        this.name = name;
        this.maxRequests = maxRequests;
        this.window = window;
        this.clock = clock;
        this.cache = Caffeine.newBuilder()
                .expireAfterAccess(window)
                .maximumSize(100_000)
                .ticker(ticker)
                .build();
        this.windows = cache.asMap();
    }

    @Override
    public boolean admit(String key) {
        Instant now = clock.instant();
        boolean[] admitted = {false};
        windows.compute(key, (k, timestamps) -> {
            Deque<Instant> d = (timestamps != null) ? timestamps : new ArrayDeque<>();
            synchronized (d) {
                prune(d, now);
                if (d.size() < maxRequests) {
                    d.addLast(now);
                    admitted[0] = true;
                }
            }
            return d;
        });
        if (!admitted[0]) {
            log.warn("Rate limit '{}' exceeded for key={}", name, key);
        }
        return admitted[0];
    }

    @Override
    public int remaining(String key) {
        Instant threshold = clock.instant().minus(window);
        Deque<Instant> timestamps = cache.policy().getIfPresentQuietly(key);
        if (timestamps == null) {
            return maxRequests;
        }
        int live = 0;
        synchronized (timestamps) {
            for (Instant t : timestamps) {
                if (t.isAfter(threshold)) live++;
            }
        }
        return Math.max(0, maxRequests - live);
    }

    /** Whether a window is still held for {@code key}, without touching its expiry. */
    boolean isTracked(String key) {
        return cache.policy().getIfPresentQuietly(key) != null;
    }

    @Override
    public int maxRequests() {
        return maxRequests;
    }

    /** Drops entries whose age is at least one full window. Deque is in insertion (time) order. */
    private void prune(Deque<Instant> timestamps, Instant now) {
        Instant threshold = now.minus(window);
        Iterator<Instant> it = timestamps.iterator();
        while (it.hasNext()) {
            if (it.next().isAfter(threshold)) break;
            it.remove();
        }
    }
}
