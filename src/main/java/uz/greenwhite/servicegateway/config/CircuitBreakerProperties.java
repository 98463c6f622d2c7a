package uz.greenwhite.servicegateway.config;

import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import uz.greenwhite.servicegateway.circuit.CircuitBreakerConfig;
import uz.greenwhite.servicegateway.error.GatewayConfigurationException;

import java.time.Duration;

/**
 * Defaults for every circuit breaker created by the gateway (per endpoint)
 * and by the error handler (per operation key).
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "gateway.circuit-breaker")
public class CircuitBreakerProperties {

    private int failureThreshold = 5;

    private long recoveryTimeoutMs = 60_000;

    private long monitoringPeriodMs = 10_000;

    /**
     * Calls inside the monitoring window required before a circuit may open
     */
    private int minimumThroughput = CircuitBreakerConfig.DEFAULT_MINIMUM_THROUGHPUT;

    @PostConstruct
    public void validate() {
        try {
            toConfig();
        } catch (IllegalArgumentException e) {
            throw new GatewayConfigurationException("Invalid gateway.circuit-breaker settings: " + e.getMessage(), e);
        }
    }

    public CircuitBreakerConfig toConfig() {
        return new CircuitBreakerConfig(
                failureThreshold,
                Duration.ofMillis(recoveryTimeoutMs),
                Duration.ofMillis(monitoringPeriodMs),
                minimumThroughput);
    }
}
