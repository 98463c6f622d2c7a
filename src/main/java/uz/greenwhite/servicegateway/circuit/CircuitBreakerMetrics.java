package uz.greenwhite.servicegateway.circuit;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CircuitBreakerMetrics {

    String name;
    CircuitState state;
    int failureCount;
    int successCount;
    double failureRate;
    long lastFailureTime;
    long nextAttemptTime;
}
