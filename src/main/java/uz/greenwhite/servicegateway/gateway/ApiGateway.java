package uz.greenwhite.servicegateway.gateway;

import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uz.greenwhite.servicegateway.circuit.CircuitBreaker;
import uz.greenwhite.servicegateway.circuit.CircuitBreakerOpenException;
import uz.greenwhite.servicegateway.circuit.CircuitBreakerRegistry;
import uz.greenwhite.servicegateway.config.CircuitBreakerProperties;
import uz.greenwhite.servicegateway.config.GatewayProperties;
import uz.greenwhite.servicegateway.config.RetryProperties;
import uz.greenwhite.servicegateway.error.AuthenticationRequiredException;
import uz.greenwhite.servicegateway.error.BackoffPolicy;
import uz.greenwhite.servicegateway.error.ErrorCategory;
import uz.greenwhite.servicegateway.error.ErrorContext;
import uz.greenwhite.servicegateway.error.ErrorHandler;
import uz.greenwhite.servicegateway.error.RateLimitExceededException;
import uz.greenwhite.servicegateway.error.RequestValidationException;
import uz.greenwhite.servicegateway.error.StandardError;
import uz.greenwhite.servicegateway.metrics.GatewayMetrics;
import uz.greenwhite.servicegateway.ratelimit.RateLimitStatus;
import uz.greenwhite.servicegateway.ratelimit.RateLimiter;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Single entry point for calls to the backend functions. Each request runs through
 * validate → authenticate → rate limit → circuit breaker gate → execute with retry
 * → transform → metrics. Every public method returns an envelope and never throws.
 */
@Slf4j
@Component
public class ApiGateway {

    public static final String CLIENT_ID_HEADER = "X-Client-ID";
    public static final String ANONYMOUS_CLIENT = "anonymous";

    private static final String SOURCE = "api-gateway";

    private final GatewayProperties properties;
    private final RequestValidator validator;
    private final RequestAuthenticator authenticator;
    private final RateLimiter rateLimiter;
    private final ResponseTransformer transformer;
    private final BackendTransport transport;
    private final ErrorHandler errorHandler;
    private final GatewayMetrics metrics;
    private final BackoffPolicy backoff;
    private final CircuitBreakerRegistry circuitBreakers;
    private final Clock clock;

    public ApiGateway(GatewayProperties properties,
                      RequestValidator validator,
                      RequestAuthenticator authenticator,
                      RateLimiter rateLimiter,
                      ResponseTransformer transformer,
                      BackendTransport transport,
                      ErrorHandler errorHandler,
                      GatewayMetrics metrics,
                      RetryProperties retryProperties,
                      CircuitBreakerProperties circuitBreakerProperties,
                      Clock clock) {
        this.properties = properties;
        this.validator = validator;
        this.authenticator = authenticator;
        this.rateLimiter = rateLimiter;
        this.transformer = transformer;
        this.transport = transport;
        this.errorHandler = errorHandler;
        this.metrics = metrics;
        this.backoff = retryProperties.toRetryConfig().backoff();
        this.circuitBreakers = new CircuitBreakerRegistry("endpoint", circuitBreakerProperties.toConfig(), clock);
        this.clock = clock;
    }

    // ==================== Public API ====================

    public GatewayResponse<Object> get(String endpoint) {
        return request(GatewayRequest.builder().method("GET").endpoint(endpoint).build());
    }

    public GatewayResponse<Object> post(String endpoint, Object data, Map<String, String> headers) {
        return request(GatewayRequest.builder().method("POST").endpoint(endpoint).data(data).headers(orEmpty(headers)).build());
    }

    public GatewayResponse<Object> put(String endpoint, Object data, Map<String, String> headers) {
        return request(GatewayRequest.builder().method("PUT").endpoint(endpoint).data(data).headers(orEmpty(headers)).build());
    }

    public GatewayResponse<Object> patch(String endpoint, Object data, Map<String, String> headers) {
        return request(GatewayRequest.builder().method("PATCH").endpoint(endpoint).data(data).headers(orEmpty(headers)).build());
    }

    public GatewayResponse<Object> delete(String endpoint, Map<String, String> headers) {
        return request(GatewayRequest.builder().method("DELETE").endpoint(endpoint).headers(orEmpty(headers)).build());
    }

    public GatewayResponse<Object> request(GatewayRequest request) {
        String requestId = UUID.randomUUID().toString();
        long start = clock.millis();
        Timer.Sample sample = metrics.startTimer();
        Map<String, String> signalHeaders = new LinkedHashMap<>();
        String endpoint = request != null ? request.getEndpoint() : null;
        String method = request != null && request.getMethod() != null ? request.getMethod().toUpperCase() : "UNKNOWN";

        ErrorContext context = ErrorContext.builder()
                .source(SOURCE)
                .operation(method + " " + endpoint)
                .correlationId(requestId)
                .build();

        try {
            // 1. Validate
            ValidationResult validation = validator.validate(request);
            if (!validation.valid()) {
                metrics.getValidationRejected().increment();
                log.warn("Request validation failed: requestId={}, endpoint={}, errors={}",
                        requestId, endpoint, validation.errors());
                throw new RequestValidationException(validation.errors());
            }

            // 2. Authenticate
            try {
                authenticator.authenticate(request, requestId);
            } catch (AuthenticationRequiredException e) {
                metrics.getAuthRejected().increment();
                throw e;
            }

            // 3. Rate limit
            if (!request.isSkipRateLimit() && rateLimiter.isEnabled()) {
                checkRateLimit(request, requestId, signalHeaders);
            }

            // 4. Circuit breaker gate
            String route = request.breakerKey();
            CircuitBreaker breaker = circuitBreakers.circuitBreaker(route);
            if (!breaker.tryAcquirePermission()) {
                metrics.getCircuitBreakerRejected().increment();
                log.warn("Circuit breaker [{}] not admitting calls, request rejected: requestId={}", route, requestId);
                throw new CircuitBreakerOpenException(route, breaker.getMetrics().getNextAttemptTime());
            }

            // 5. Execute with retry
            Attempted result = executeWithRetries(request, validation.sanitizedData(), requestId, breaker);

            // 6. Transform
            Object data = transformer.transform(result.value(), request.getTransform());

            // 7. Metrics
            long duration = clock.millis() - start;
            recordSuccess(sample, method, endpoint, requestId, duration);

            return GatewayResponse.success(data,
                    meta(requestId, endpoint, duration, result.attempt() > 0 ? result.attempt() : null),
                    signalHeaders);

        } catch (Exception e) {
            StandardError error = errorHandler.handleError(e, context);
            long duration = clock.millis() - start;

            metrics.recordRequest(sample, method, false);
            metrics.recordFailure(error.getCategory());
            log.warn("Gateway request failed: requestId={}, method={}, endpoint={}, code={}, duration={}ms",
                    requestId, method, endpoint, error.getCode(), duration);

            if (error.getRetryAfter() != null) {
                signalHeaders.put("Retry-After", String.valueOf(error.getRetryAfter()));
            }
            return GatewayResponse.failure(GatewayError.from(error),
                    meta(requestId, endpoint, duration, null), signalHeaders);
        }
    }

    public CircuitBreakerRegistry getCircuitBreakers() {
        return circuitBreakers;
    }

    // ==================== Stages ====================

    private void checkRateLimit(GatewayRequest request, String requestId, Map<String, String> signalHeaders) {
        String clientId = clientIdentifier(request);
        boolean allowed = rateLimiter.isAllowed(clientId, request.getEndpoint());
        RateLimitStatus status = rateLimiter.getStatus(clientId, request.getEndpoint());

        signalHeaders.put("X-RateLimit-Limit", String.valueOf(status.getLimit()));
        signalHeaders.put("X-RateLimit-Remaining", String.valueOf(status.getRemaining()));
        signalHeaders.put("X-RateLimit-Reset", String.valueOf((status.getResetTime() + 999) / 1000));

        if (!allowed) {
            metrics.getRateLimitRejected().increment();
            log.warn("Rate limit exceeded: requestId={}, endpoint={}, client={}",
                    requestId, request.getEndpoint(), clientId);
            throw new RateLimitExceededException(clientId + ":" + request.getEndpoint(),
                    status.getLimit(), status.getResetTime(), status.retryAfterSeconds(clock.millis()));
        }
    }

    private Attempted executeWithRetries(GatewayRequest request, Object body, String requestId,
                                         CircuitBreaker breaker) throws Exception {
        int maxRetries = request.getRetries() != null ? request.getRetries() : properties.getRetries();
        Duration timeout = Duration.ofMillis(request.getTimeoutMs() != null
                ? request.getTimeoutMs() : properties.getTimeoutMs());

        for (int attempt = 0; ; attempt++) {
            BackendCall call = new BackendCall(request.getMethod().toUpperCase(), request.getEndpoint(), body,
                    request.getHeaders(), requestId, attempt, timeout);
            try {
                log.debug("Executing backend call: requestId={}, {} {}, attempt={}",
                        requestId, call.method(), call.endpoint(), attempt);
                Object response = transport.exchange(call);
                breaker.recordSuccess();
                return new Attempted(response, attempt);

            } catch (Exception e) {
                if (Thread.currentThread().isInterrupted()) {
                    breaker.releasePermission();
                    throw e;
                }
                breaker.recordFailure(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());

                if (attempt >= maxRetries || !isRetryable(e) || breaker.isOpen()) {
                    throw e;
                }

                long delay = backoff.delay(attempt + 1);
                metrics.getRetries().increment();
                log.info("Retrying request: requestId={}, endpoint={}, attempt={}/{}, delay={}ms",
                        requestId, request.getEndpoint(), attempt + 1, maxRetries, delay);
                try {
                    Thread.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw e;
                }
            }
        }
    }

    /**
     * Network, timeout and 5xx failures are retried; everything else fails at once.
     */
    private boolean isRetryable(Exception e) {
        StandardError error = errorHandler.standardize(e, null);
        return error.getCategory() == ErrorCategory.NETWORK_ERROR
                || error.getCategory() == ErrorCategory.TIMEOUT_ERROR
                || (error.getHttpStatus() != null && error.getHttpStatus() >= 500);
    }

    private void recordSuccess(Timer.Sample sample, String method, String endpoint, String requestId, long duration) {
        metrics.recordRequest(sample, method, true);
        metrics.recordSuccess();

        GatewayProperties.Monitoring monitoring = properties.getMonitoring();
        if (monitoring.isEnabled() && ThreadLocalRandom.current().nextDouble() < monitoring.getSampleRate()) {
            log.info("Request completed: requestId={}, method={}, endpoint={}, duration={}ms",
                    requestId, method, endpoint, duration);
        }
    }

    private static Map<String, String> orEmpty(Map<String, String> headers) {
        return headers != null ? headers : Map.of();
    }

    private static String clientIdentifier(GatewayRequest request) {
        return request.header(CLIENT_ID_HEADER)
                .filter(id -> !id.isBlank())
                .orElse(ANONYMOUS_CLIENT);
    }

    private GatewayMeta meta(String requestId, String endpoint, long duration, Integer retryAttempt) {
        return GatewayMeta.builder()
                .requestId(requestId)
                .timestamp(clock.instant())
                .duration(duration)
                .endpoint(endpoint)
                .retryAttempt(retryAttempt)
                .build();
    }

    private record Attempted(Object value, int attempt) {
    }
}
