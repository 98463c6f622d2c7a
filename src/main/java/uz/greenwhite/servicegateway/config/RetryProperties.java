package uz.greenwhite.servicegateway.config;

import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import uz.greenwhite.servicegateway.error.ErrorCategory;
import uz.greenwhite.servicegateway.error.GatewayConfigurationException;
import uz.greenwhite.servicegateway.error.RetryConfig;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "gateway.retry")
public class RetryProperties {

    /**
     * Attempts including the first one.
     * Default: 3
     */
    private int maxAttempts = 3;

    /**
     * Delay before the first retry in milliseconds.
     * Default: 1000
     */
    private long baseDelayMs = 1000;

    /**
     * Upper bound for a single backoff delay.
     * Default: 10000
     */
    private long maxDelayMs = 10_000;

    private double backoffFactor = 2.0;

    /**
     * Categories retried by executeWithErrorHandling
     */
    private Set<ErrorCategory> retryableCategories = EnumSet.copyOf(ErrorCategory.TRANSIENT);

    /**
     * Comma-separated HTTP status codes that are retryable
     * Default: 408,429,500,502,503,504
     */
    private String retryableStatuses = "408,429,500,502,503,504";

    /**
     * Parsed once at startup
     */
    private Set<Integer> retryableStatusSet = Set.of(408, 429, 500, 502, 503, 504);

    @PostConstruct
    public void init() {
        try {
            this.retryableStatusSet = Collections.unmodifiableSet(
                    Arrays.stream(retryableStatuses.split(","))
                            .map(String::trim)
                            .filter(s -> !s.isEmpty())
                            .map(Integer::parseInt)
                            .collect(Collectors.toSet())
            );
        } catch (NumberFormatException e) {
            throw new GatewayConfigurationException(
                    "gateway.retry.retryable-statuses is not a list of numbers: " + retryableStatuses, e);
        }
        if (maxAttempts < 1) {
            throw new GatewayConfigurationException("gateway.retry.max-attempts must be >= 1");
        }
        if (baseDelayMs < 0 || maxDelayMs < baseDelayMs) {
            throw new GatewayConfigurationException("gateway.retry delays must satisfy 0 <= base-delay-ms <= max-delay-ms");
        }
        if (backoffFactor < 1.0) {
            throw new GatewayConfigurationException("gateway.retry.backoff-factor must be >= 1");
        }
    }

    /**
     * Check if HTTP status is retryable
     */
    public boolean isRetryable(int httpStatus) {
        return retryableStatusSet.contains(httpStatus);
    }

    public RetryConfig toRetryConfig() {
        return RetryConfig.builder()
                .maxAttempts(maxAttempts)
                .baseDelay(Duration.ofMillis(baseDelayMs))
                .maxDelay(Duration.ofMillis(maxDelayMs))
                .backoffFactor(backoffFactor)
                .retryableCategories(retryableCategories)
                .build();
    }
}
