package uz.greenwhite.servicegateway.ratelimit;

import lombok.Getter;

/**
 * Per-key limiter state: fixed window counter plus its token bucket.
 * All mutation goes through the synchronized methods.
 */
@Getter
public class RateLimitEntry {

    private final TokenBucket bucket;
    private final long windowMs;
    private final int maxRequests;
    private int count;
    private long resetTime;

    public RateLimitEntry(int maxRequests, long windowMs, long now) {
        this.maxRequests = maxRequests;
        this.windowMs = windowMs;
        this.bucket = TokenBucket.forWindow(maxRequests, windowMs, now);
        this.count = 0;
        this.resetTime = now + windowMs;
    }

    /**
     * Both checks are evaluated first and committed together, so a denied
     * request never spends a token.
     */
    public synchronized Decision tryAcquire(long now) {
        rollWindow(now);
        bucket.refill(now);

        if (!bucket.hasToken()) {
            return Decision.DENIED_BURST;
        }
        if (count >= maxRequests) {
            return Decision.DENIED_WINDOW;
        }

        bucket.consume();
        count++;
        return Decision.ALLOWED;
    }

    public synchronized RateLimitStatus snapshot(long now) {
        rollWindow(now);
        bucket.refill(now);
        return RateLimitStatus.builder()
                .allowed(count < maxRequests && bucket.hasToken())
                .count(count)
                .limit(maxRequests)
                .resetTime(resetTime)
                .tokens(bucket.getTokens())
                .build();
    }

    public synchronized boolean isExpired(long now) {
        return resetTime < now;
    }

    public synchronized int currentCount() {
        return count;
    }

    private void rollWindow(long now) {
        if (now > resetTime) {
            count = 0;
            resetTime = now + windowMs;
        }
    }

    public enum Decision {
        ALLOWED,
        DENIED_BURST,
        DENIED_WINDOW;

        public boolean isAllowed() {
            return this == ALLOWED;
        }
    }
}
