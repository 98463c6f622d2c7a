package uz.greenwhite.servicegateway.ratelimit;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RateLimitStatus {

    boolean allowed;
    int count;
    int limit;
    long resetTime;
    double tokens;

    public int getRemaining() {
        return Math.max(0, Math.min(limit - count, (int) Math.floor(tokens)));
    }

    /**
     * Seconds until the current window resets, never below 1.
     */
    public long retryAfterSeconds(long now) {
        long millis = Math.max(0, resetTime - now);
        return Math.max(1, (millis + 999) / 1000);
    }
}
