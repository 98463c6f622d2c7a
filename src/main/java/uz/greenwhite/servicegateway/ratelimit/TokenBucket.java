package uz.greenwhite.servicegateway.ratelimit;

import lombok.Getter;

/**
 * Burst control bucket. Refilled lazily from elapsed time on every access.
 * Not thread-safe on its own: callers mutate it under the owning entry's lock.
 */
@Getter
public class TokenBucket {

    private final double maxTokens;
    private final double refillRate; // tokens per second
    private double tokens;
    private long lastRefill;

    public TokenBucket(double maxTokens, double refillRate, long now) {
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be > 0: " + maxTokens);
        }
        if (refillRate <= 0) {
            throw new IllegalArgumentException("refillRate must be > 0: " + refillRate);
        }
        this.maxTokens = maxTokens;
        this.refillRate = refillRate;
        this.tokens = maxTokens;
        this.lastRefill = now;
    }

    /**
     * Bucket sized for {@code maxRequests} per {@code windowMs}, refilled evenly across the window.
     */
    public static TokenBucket forWindow(int maxRequests, long windowMs, long now) {
        double refillRate = maxRequests / (windowMs / 1000.0);
        return new TokenBucket(maxRequests, refillRate, now);
    }

    public void refill(long now) {
        // Clock going backwards must not drain the bucket
        long elapsedMs = Math.max(0, now - lastRefill);
        double tokensToAdd = (elapsedMs / 1000.0) * refillRate;
        tokens = Math.min(maxTokens, tokens + tokensToAdd);
        lastRefill = Math.max(lastRefill, now);
    }

    public boolean hasToken() {
        return tokens >= 1;
    }

    /**
     * Take one token. Caller must have refilled and checked {@link #hasToken()} first.
     */
    public void consume() {
        if (tokens < 1) {
            throw new IllegalStateException("No token available: " + tokens);
        }
        tokens -= 1;
    }

    public boolean tryConsume(long now) {
        refill(now);
        if (!hasToken()) {
            return false;
        }
        consume();
        return true;
    }
}
