package uz.greenwhite.servicegateway.circuit;

import lombok.Getter;

/**
 * Thrown instead of invoking the protected call while the circuit is open.
 */
@Getter
public class CircuitBreakerOpenException extends RuntimeException {

    private final String circuitName;
    private final long nextAttemptTime;

    public CircuitBreakerOpenException(String circuitName, long nextAttemptTime) {
        super("Circuit breaker [" + circuitName + "] is open");
        this.circuitName = circuitName;
        this.nextAttemptTime = nextAttemptTime;
    }
}
