package uz.greenwhite.servicegateway.circuit;

import java.time.Duration;

/**
 * @param failureThreshold  failures inside the monitoring window that open the circuit
 * @param recoveryTimeout   time in OPEN before the next call is let through as a probe
 * @param monitoringPeriod  sliding window for failure and success records
 * @param minimumThroughput calls inside the window required before the circuit may open
 */
public record CircuitBreakerConfig(int failureThreshold,
                                   Duration recoveryTimeout,
                                   Duration monitoringPeriod,
                                   int minimumThroughput) {

    public static final int DEFAULT_MINIMUM_THROUGHPUT = 10;

    public CircuitBreakerConfig {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException("failureThreshold must be > 0: " + failureThreshold);
        }
        if (recoveryTimeout == null || recoveryTimeout.isNegative()) {
            throw new IllegalArgumentException("recoveryTimeout must be >= 0");
        }
        if (monitoringPeriod == null || monitoringPeriod.isNegative() || monitoringPeriod.isZero()) {
            throw new IllegalArgumentException("monitoringPeriod must be > 0");
        }
        if (minimumThroughput < 0) {
            throw new IllegalArgumentException("minimumThroughput must be >= 0: " + minimumThroughput);
        }
    }

    public CircuitBreakerConfig(int failureThreshold, Duration recoveryTimeout, Duration monitoringPeriod) {
        this(failureThreshold, recoveryTimeout, monitoringPeriod, DEFAULT_MINIMUM_THROUGHPUT);
    }

    /**
     * Threshold 5, recovery 60s, window 10s.
     */
    public static CircuitBreakerConfig defaults() {
        return new CircuitBreakerConfig(5, Duration.ofSeconds(60), Duration.ofSeconds(10));
    }
}
