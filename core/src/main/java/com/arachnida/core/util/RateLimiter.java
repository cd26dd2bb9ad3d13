package com.arachnida.core.util;

/** 토큰 버킷. capacity 만큼 버스트 허용, 초당 refillPerSecond 개 보충. */
public final class RateLimiter {
    private final long capacity;
    private final long refillPerSecond;
    private double tokens;
    private long lastNs;

    public RateLimiter(long capacity, long refillPerSecond) {
        if (capacity < 1 || refillPerSecond < 1) {
            throw new IllegalArgumentException("capacity and refillPerSecond must be >= 1");
        }
        this.capacity = capacity;
        this.refillPerSecond = refillPerSecond;
        this.tokens = capacity;
        this.lastNs = System.nanoTime();
    }

    /** 버스트 1, 초당 rps 개 */
    public static RateLimiter perSecond(int rps) {
        return new RateLimiter(1, rps);
    }

    public synchronized void acquire() throws InterruptedException {
        for (;;) {
            refill();
            if (tokens >= 1.0) { tokens -= 1.0; return; }
            long waitMs = Math.max(1, (long) Math.ceil((1.0 - tokens) * 1000.0 / refillPerSecond));
            this.wait(Math.min(waitMs, 50));
        }
    }

    private void refill() {
        long now = System.nanoTime();
        double add = (now - lastNs) / 1_000_000_000.0 * refillPerSecond;
        if (add > 0) {
            tokens = Math.min(capacity, tokens + add);
            lastNs = now;
        }
    }
}
