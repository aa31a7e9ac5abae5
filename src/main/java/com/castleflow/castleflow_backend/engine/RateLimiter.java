package com.castleflow.castleflow_backend.engine;

public interface RateLimiter {

    /**
     * Records a pass for {@code key} and returns true when at least {@code intervalMs}
     * elapsed since the previous pass; otherwise leaves the table untouched and returns false.
     */
    boolean tryAcquire(String key, long intervalMs);

    // 0 when the key may pass now
    long remainingMillis(String key, long intervalMs);
}
