package uz.greenwhite.servicegateway.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uz.greenwhite.servicegateway.error.ErrorCategory;

import java.time.Duration;

/**
 * Metrics for the request pipeline and the orchestrator.
 *
 * Naming convention:
 *   gateway.{component}.{metric}
 *
 * Tags:
 *   result   = success | error
 *   category = error category name, on failures
 *   service  = supabase | vapi | twilio | google-maps | n8n
 */
@Slf4j
@Getter
@Component
public class GatewayMetrics {

    private final MeterRegistry registry;

    // ==================== Pipeline ====================
    private final Counter requestSuccess;
    private final Counter retries;
    private final Counter rateLimitRejected;
    private final Counter circuitBreakerRejected;
    private final Counter validationRejected;
    private final Counter authRejected;

    // ==================== Orchestrator ====================
    private final Counter fallbackHit;
    private final Counter fallbackMiss;
    private final Counter batchOperations;
    private final Counter batchAborted;

    public GatewayMetrics(MeterRegistry registry) {
        this.registry = registry;

        // ==================== Pipeline ====================

        this.requestSuccess = Counter.builder("gateway.request.total")
                .description("Gateway requests completed successfully")
                .tag("result", "success")
                .tag("category", "none")
                .register(registry);

        this.retries = Counter.builder("gateway.request.retry")
                .description("Backend call retry attempts")
                .register(registry);

        this.rateLimitRejected = Counter.builder("gateway.request.rejected")
                .description("Requests rejected by the rate limiter")
                .tag("stage", "rate_limit")
                .register(registry);

        this.circuitBreakerRejected = Counter.builder("gateway.request.rejected")
                .description("Requests rejected by an open circuit breaker")
                .tag("stage", "circuit_breaker")
                .register(registry);

        this.validationRejected = Counter.builder("gateway.request.rejected")
                .description("Requests rejected by validation")
                .tag("stage", "validation")
                .register(registry);

        this.authRejected = Counter.builder("gateway.request.rejected")
                .description("Requests rejected by authentication")
                .tag("stage", "auth")
                .register(registry);

        // ==================== Orchestrator ====================

        this.fallbackHit = Counter.builder("gateway.fallback.cache")
                .description("Failed calls served from the fallback cache")
                .tag("result", "hit")
                .register(registry);

        this.fallbackMiss = Counter.builder("gateway.fallback.cache")
                .description("Failed calls with no usable cached value")
                .tag("result", "miss")
                .register(registry);

        this.batchOperations = Counter.builder("gateway.batch.operations")
                .description("Operations executed inside batches")
                .register(registry);

        this.batchAborted = Counter.builder("gateway.batch.aborted")
                .description("Batches aborted by fail-fast")
                .register(registry);

        log.info("Gateway metrics registered");
    }

    // ==================== Convenience Methods ====================

    public Timer.Sample startTimer() {
        return Timer.start(registry);
    }

    /**
     * Stop the request timer, tagged by method and outcome.
     */
    public long recordRequest(Timer.Sample sample, String method, boolean success) {
        return sample.stop(Timer.builder("gateway.request.duration")
                .description("Gateway request duration, all pipeline stages included")
                .tag("method", method)
                .tag("result", success ? "success" : "error")
                .register(registry));
    }

    public void recordSuccess() {
        requestSuccess.increment();
    }

    public void recordFailure(ErrorCategory category) {
        Counter.builder("gateway.request.total")
                .description("Gateway requests that failed")
                .tag("result", "error")
                .tag("category", category.name())
                .register(registry)
                .increment();
    }

    public void recordServiceCall(String service, Duration duration, boolean success) {
        Timer.builder("gateway.service.duration")
                .description("Orchestrator call duration per backend service")
                .tag("service", service)
                .tag("result", success ? "success" : "error")
                .register(registry)
                .record(duration);
    }

    public void recordBatch(int operations, boolean aborted) {
        batchOperations.increment(operations);
        if (aborted) {
            batchAborted.increment();
        }
    }
}
