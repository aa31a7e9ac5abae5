package com.castleflow.castleflow_backend.engine;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

public class InMemoryRateLimiter implements RateLimiter {

    private final Clock clock;
    private final Map<String, Long> lastPass = new ConcurrentHashMap<>();

    public InMemoryRateLimiter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public boolean tryAcquire(String key, long intervalMs) {
        long now = clock.millis();
        AtomicBoolean acquired = new AtomicBoolean(false);
        lastPass.compute(key, (k, last) -> {
            if (last == null || now - last >= intervalMs) {
                acquired.set(true);
                return now;
            }
            return last;
        });
        return acquired.get();
    }

    @Override
    public long remainingMillis(String key, long intervalMs) {
        Long last = lastPass.get(key);
        if (last == null) {
            return 0;
        }
        return Math.max(0, intervalMs - (clock.millis() - last));
    }
}
