package uz.greenwhite.servicegateway.error;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Set;

@Value
@Builder(toBuilder = true)
public class RetryConfig {

    @Builder.Default
    int maxAttempts = 3;

    @Builder.Default
    Duration baseDelay = Duration.ofSeconds(1);

    @Builder.Default
    Duration maxDelay = Duration.ofSeconds(10);

    @Builder.Default
    double backoffFactor = 2.0;

    @Builder.Default
    Set<ErrorCategory> retryableCategories = ErrorCategory.TRANSIENT;

    public RetryConfig(int maxAttempts, Duration baseDelay, Duration maxDelay,
                       double backoffFactor, Set<ErrorCategory> retryableCategories) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        if (backoffFactor < 1.0) {
            throw new IllegalArgumentException("backoffFactor must be >= 1, got " + backoffFactor);
        }
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.backoffFactor = backoffFactor;
        this.retryableCategories = Set.copyOf(retryableCategories);
    }

    public static RetryConfig noRetry() {
        return RetryConfig.builder().maxAttempts(1).build();
    }

    public BackoffPolicy backoff() {
        return new BackoffPolicy(baseDelay.toMillis(), maxDelay.toMillis(), backoffFactor);
    }
}
