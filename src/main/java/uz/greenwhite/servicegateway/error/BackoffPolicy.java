package uz.greenwhite.servicegateway.error;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff capped at {@code maxDelayMs}, plus up to 10% jitter.
 */
public class BackoffPolicy {

    static final double JITTER_RATIO = 0.1;

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double factor;

    public BackoffPolicy(long baseDelayMs, long maxDelayMs, double factor) {
        if (baseDelayMs < 0 || maxDelayMs < 0) {
            throw new IllegalArgumentException("Backoff delays must be >= 0");
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.factor = factor;
    }

    /**
     * Delay before retrying after the given (1-based) attempt, without jitter.
     */
    public long baseDelay(int attempt) {
        double raw = baseDelayMs * Math.pow(factor, Math.max(0, attempt - 1));
        return (long) Math.min(raw, maxDelayMs);
    }

    public long delay(int attempt) {
        long delay = baseDelay(attempt);
        long jitter = (long) (ThreadLocalRandom.current().nextDouble() * delay * JITTER_RATIO);
        return delay + jitter;
    }
}
