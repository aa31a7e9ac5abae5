package com.castleflow.castleflow_backend.engine;

import com.castleflow.castleflow_backend.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryRateLimiterTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T12:00:00Z"));
    private final InMemoryRateLimiter limiter = new InMemoryRateLimiter(clock);

    @Test
    void firstPassAlwaysSucceeds() {
        assertThat(limiter.remainingMillis("node-1", 500)).isZero();
        assertThat(limiter.tryAcquire("node-1", 500)).isTrue();
    }

    @Test
    void blocksUntilIntervalElapsed() {
        limiter.tryAcquire("node-1", 500);

        clock.advance(Duration.ofMillis(499));
        assertThat(limiter.tryAcquire("node-1", 500)).isFalse();
        assertThat(limiter.remainingMillis("node-1", 500)).isEqualTo(1);

        clock.advance(Duration.ofMillis(1));
        assertThat(limiter.tryAcquire("node-1", 500)).isTrue();
        assertThat(limiter.remainingMillis("node-1", 500)).isEqualTo(500);
    }

    @Test
    void keysAreIndependent() {
        limiter.tryAcquire("node-1", 500);

        assertThat(limiter.tryAcquire("node-2", 500)).isTrue();
        assertThat(limiter.tryAcquire("node-1", 500)).isFalse();
    }
}
