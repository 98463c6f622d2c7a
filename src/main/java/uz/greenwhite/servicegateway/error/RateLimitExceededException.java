package uz.greenwhite.servicegateway.error;

import lombok.Getter;

@Getter
public class RateLimitExceededException extends RuntimeException {

    private final String key;
    private final int limit;
    private final long resetTime;

    /**
     * Seconds until the window resets, at least 1
     */
    private final long retryAfterSeconds;

    public RateLimitExceededException(String key, int limit, long resetTime, long retryAfterSeconds) {
        super("Rate limit exceeded for [" + key + "]");
        this.key = key;
        this.limit = limit;
        this.resetTime = resetTime;
        this.retryAfterSeconds = retryAfterSeconds;
    }
}
