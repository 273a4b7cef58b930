package com.syncnest.identityservice.serviceImpl;

import com.syncnest.identityservice.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SlidingWindowRateLimiterTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    private final SlidingWindowRateLimiter limiter =
            new SlidingWindowRateLimiter("login", 5, Duration.ofSeconds(60), clock);

    @Test
    void sixthAttemptInsideWindowIsRejected() {
        for (int i = 0; i < 5; i++) {
            assertThat(limiter.admit("ip:1.2.3.4")).isTrue();
            clock.advance(Duration.ofSeconds(1));
        }
        assertThat(limiter.admit("ip:1.2.3.4")).isFalse();
        assertThat(limiter.remaining("ip:1.2.3.4")).isZero();
    }

    @Test
    void admitsAgainOnceOldestEntryLeavesWindow() {
        for (int i = 0; i < 5; i++) {
            limiter.admit("k");
            clock.advance(Duration.ofSeconds(10));
        }
        // now = t0 + 50s; the first entry (t0) leaves the window at t0 + 60s
        assertThat(limiter.admit("k")).isFalse();

        clock.advance(Duration.ofSeconds(10));
        assertThat(limiter.admit("k")).isTrue();
        assertThat(limiter.admit("k")).isFalse();
    }

    @Test
    void rejectedAttemptsAreNotRecorded() {
        for (int i = 0; i < 5; i++) {
            limiter.admit("k");
        }
        for (int i = 0; i < 10; i++) {
            assertThat(limiter.admit("k")).isFalse();
        }
        clock.advance(Duration.ofSeconds(60));
        assertThat(limiter.remaining("k")).isEqualTo(5);
        assertThat(limiter.admit("k")).isTrue();
    }

    @Test
    void remainingDoesNotConsume() {
        limiter.admit("k");
        assertThat(limiter.remaining("k")).isEqualTo(4);
        assertThat(limiter.remaining("k")).isEqualTo(4);
        assertThat(limiter.remaining("unknown")).isEqualTo(5);
    }

    @Test
    void keysAreIndependent() {
        for (int i = 0; i < 5; i++) {
            limiter.admit("a");
        }
        assertThat(limiter.admit("a")).isFalse();
        assertThat(limiter.admit("b")).isTrue();
    }

    @Test
    void concurrentCallersNeverExceedLimit() throws Exception {
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        try {
            for (int i = 0; i < threads * 4; i++) {
                Callable<Boolean> task = () -> {
                    start.await();
                    return limiter.admit("shared");
                };
                results.add(pool.submit(task));
            }
            start.countDown();

            int admitted = 0;
            for (Future<Boolean> f : results) {
                if (f.get(10, TimeUnit.SECONDS)) admitted++;
            }
            assertThat(admitted).isEqualTo(5);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void rejectsNonPositiveSettings() {
        assertThatThrownBy(() -> new SlidingWindowRateLimiter("x", 0, Duration.ofSeconds(1), clock))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SlidingWindowRateLimiter("x", 1, Duration.ZERO, clock))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void remainingDoesNotKeepIdleWindowAlive() {
        AtomicLong nanos = new AtomicLong();
        SlidingWindowRateLimiter quiet =
                new SlidingWindowRateLimiter("action", 5, Duration.ofSeconds(60), clock, nanos::get);

        assertThat(quiet.admit("k")).isTrue();
        nanos.addAndGet(Duration.ofSeconds(40).toNanos());
        assertThat(quiet.remaining("k")).isEqualTo(4);

        // 70s since the admission, 30s since the last read
        nanos.addAndGet(Duration.ofSeconds(30).toNanos());
        assertThat(quiet.isTracked("k")).isFalse();
        assertThat(quiet.remaining("k")).isEqualTo(5);
    }
}
