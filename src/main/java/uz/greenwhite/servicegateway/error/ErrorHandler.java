package uz.greenwhite.servicegateway.error;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import uz.greenwhite.servicegateway.circuit.CircuitBreaker;
import uz.greenwhite.servicegateway.circuit.CircuitBreakerRegistry;
import uz.greenwhite.servicegateway.config.CircuitBreakerProperties;
import uz.greenwhite.servicegateway.config.ErrorHandlingProperties;
import uz.greenwhite.servicegateway.config.RetryProperties;
import uz.greenwhite.servicegateway.notification.NotificationService;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Turns raw failures into {@link StandardError}s and drives the two recovery
 * strategies built on them: retry with backoff and circuit-breaker protection.
 */
@Slf4j
@Component
public class ErrorHandler {

    private final ErrorClassifier classifier;
    private final ErrorFrequencyTracker frequencyTracker;
    @Getter
    private final CircuitBreakerRegistry circuitBreakers;
    @Getter
    private final RetryConfig defaultRetryConfig;
    private final NotificationService notificationService;
    private final Executor notificationExecutor;
    private final boolean criticalNotifications;

    public ErrorHandler(ErrorHandlingProperties errorProperties,
                        RetryProperties retryProperties,
                        CircuitBreakerProperties circuitBreakerProperties,
                        NotificationService notificationService,
                        @Qualifier("notificationExecutor") Executor notificationExecutor,
                        Clock clock) {
        this.classifier = new ErrorClassifier(retryProperties::isRetryable,
                errorProperties.isUserFriendlyMessages(), errorProperties.isIncludeStackTrace(), clock);
        this.frequencyTracker = new ErrorFrequencyTracker(errorProperties.getPatternThreshold(), clock);
        this.circuitBreakers = new CircuitBreakerRegistry("service", circuitBreakerProperties.toConfig(), clock);
        this.defaultRetryConfig = retryProperties.toRetryConfig();
        this.notificationService = notificationService;
        this.notificationExecutor = notificationExecutor;
        this.criticalNotifications = errorProperties.isCriticalNotifications();
    }

    /**
     * Pure classification. An already standardized error is returned unchanged.
     */
    public StandardError standardize(Throwable error, ErrorContext context) {
        return classifier.classify(error, context);
    }

    /**
     * Standardize, log by severity, track frequency and alert on CRITICAL.
     */
    public StandardError handleError(Throwable error, ErrorContext context) {
        StandardError standard = standardize(error, context);

        logError(standard, context);
        frequencyTracker.track(standard);

        if (standard.getSeverity() == ErrorSeverity.CRITICAL) {
            notifyCritical(standard);
        }
        return standard;
    }

    // ==================== Retry ====================

    public <T> T executeWithErrorHandling(Callable<T> operation, ErrorContext context) {
        return executeWithErrorHandling(operation, context, defaultRetryConfig);
    }

    /**
     * Run {@code operation} up to {@code maxAttempts} times. Stops early on a
     * non-retryable error, on a category outside the config, or on interruption.
     *
     * @throws StandardErrorException carrying the last error
     */
    public <T> T executeWithErrorHandling(Callable<T> operation, ErrorContext context, RetryConfig retryConfig) {
        BackoffPolicy backoff = retryConfig.backoff();
        int maxAttempts = retryConfig.getMaxAttempts();
        StandardErrorException last = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return operation.call();
            } catch (Exception e) {
                ErrorContext attemptContext = context.withAdditional(
                        Map.of("attempt", attempt, "maxAttempts", maxAttempts));
                StandardError error = handleError(e, attemptContext);
                last = e instanceof StandardErrorException se ? se : new StandardErrorException(error, e);

                if (!shouldRetry(error, retryConfig) || attempt == maxAttempts) {
                    break;
                }

                long delay = backoff.delay(attempt);
                log.info("Retrying [{}] attempt {}/{} in {}ms: {}",
                        context.getOperation(), attempt + 1, maxAttempts, delay, error.getCode());
                if (!sleep(delay)) {
                    log.warn("Retry of [{}] interrupted after attempt {}", context.getOperation(), attempt);
                    break;
                }
            }
        }
        throw last;
    }

    private boolean shouldRetry(StandardError error, RetryConfig retryConfig) {
        return error.isRetryable() && retryConfig.getRetryableCategories().contains(error.getCategory());
    }

    private boolean sleep(long delayMs) {
        try {
            Thread.sleep(delayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    // ==================== Circuit breaker ====================

    public <T> T executeWithCircuitBreaker(Callable<T> operation, ErrorContext context, String key) {
        return executeWithCircuitBreaker(operation, context, key, null);
    }

    /**
     * Run {@code operation} behind the breaker for {@code key}. With a fallback, an open
     * circuit yields {@code fallback.call()} instead of an error.
     *
     * @throws StandardErrorException for any failure that was not absorbed by the fallback
     */
    public <T> T executeWithCircuitBreaker(Callable<T> operation, ErrorContext context,
                                           String key, Callable<T> fallback) {
        CircuitBreaker breaker = circuitBreakers.circuitBreaker(key);
        try {
            return fallback == null
                    ? breaker.execute(operation)
                    : breaker.executeWithFallback(operation, fallback);
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            StandardError error = handleError(e, context);
            throw e instanceof StandardErrorException se ? se : new StandardErrorException(error, e);
        }
    }

    public ErrorStats getErrorStats() {
        return frequencyTracker.getErrorStats();
    }

    /**
     * Called by the maintenance task.
     */
    public int sweepErrorCounters() {
        return frequencyTracker.sweepExpired();
    }

    // ==================== Logging & alerts ====================

    private void logError(StandardError error, ErrorContext context) {
        String operation = context != null ? context.getOperation() : null;
        switch (error.getSeverity()) {
            case CRITICAL, HIGH -> log.error("[{}] {} source={} operation={} correlationId={}: {}",
                    error.getSeverity(), error.getCode(), error.getSource(), operation,
                    error.getCorrelationId(), error.getMessage());
            case MEDIUM -> log.warn("[{}] {} source={} operation={} correlationId={}: {}",
                    error.getSeverity(), error.getCode(), error.getSource(), operation,
                    error.getCorrelationId(), error.getMessage());
            case LOW -> log.debug("[{}] {} source={} operation={} correlationId={}: {}",
                    error.getSeverity(), error.getCode(), error.getSource(), operation,
                    error.getCorrelationId(), error.getMessage());
        }
    }

    private void notifyCritical(StandardError error) {
        if (!criticalNotifications) {
            return;
        }
        try {
            CompletableFuture.runAsync(() -> notificationService.sendCriticalAlert(error), notificationExecutor)
                    .exceptionally(ex -> {
                        log.error("Critical alert for [{}] failed: {}", error.getId(), ex.getMessage());
                        return null;
                    });
        } catch (RejectedExecutionException e) {
            log.error("Critical alert for [{}] rejected: {}", error.getId(), e.getMessage());
        }
    }
}
