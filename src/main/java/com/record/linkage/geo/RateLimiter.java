package com.record.linkage.geo;

/**
 * Blocking token bucket. {@link #acquire()} waits until a token is available, which is never
 * longer than one refill interval once the bucket is drained.
 */
public class RateLimiter {

    private final int maxTokens;
    private final double refillRate; // tokens per nanosecond
    private double tokens;
    private long lastRefillNanos;

    public RateLimiter(double permitsPerSecond) {
        this(permitsPerSecond, 1);
    }

    public RateLimiter(double permitsPerSecond, int burstSize) {
        if (!(permitsPerSecond > 0)) {
            throw new IllegalArgumentException("permitsPerSecond must be > 0");
        }
        if (burstSize <= 0) {
            throw new IllegalArgumentException("burstSize must be > 0");
        }
        this.maxTokens = burstSize;
        this.refillRate = permitsPerSecond / 1_000_000_000.0;
        this.tokens = burstSize;
        this.lastRefillNanos = System.nanoTime();
    }

    /**
     * Takes one token, sleeping until one is available.
     */
    public void acquire() throws InterruptedException {
        while (true) {
            long waitNanos;
            synchronized (this) {
                refill();
                if (tokens >= 1.0) {
                    tokens -= 1.0;
                    return;
                }
                waitNanos = (long) Math.ceil((1.0 - tokens) / refillRate);
            }
            Thread.sleep(waitNanos / 1_000_000, (int) (waitNanos % 1_000_000));
        }
    }

    /**
     * Takes one token if available without waiting.
     */
    public synchronized boolean tryAcquire() {
        refill();
        if (tokens >= 1.0) {
            tokens -= 1.0;
            return true;
        }
        return false;
    }

    private void refill() {
        long now = System.nanoTime();
        long elapsed = now - lastRefillNanos;
        if (elapsed <= 0) {
            return;
        }
        tokens = Math.min(maxTokens, tokens + elapsed * refillRate);
        lastRefillNanos = now;
    }
}
