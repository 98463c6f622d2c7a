package uz.greenwhite.servicegateway.gateway;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Inbound contract of {@link ApiGateway}. Only method and endpoint are required.
 */
@Value
@Builder(toBuilder = true)
public class GatewayRequest {

    String method;
    String endpoint;

    /**
     * Endpoint template used as the circuit breaker key, e.g. {@code /calls/{id}}.
     * Defaults to the endpoint itself.
     */
    String route;

    Object data;

    @Singular
    Map<String, String> headers;

    /**
     * Overrides gateway.timeout-ms, milliseconds
     */
    Long timeoutMs;

    /**
     * Overrides gateway.retries
     */
    Integer retries;

    boolean skipAuth;
    boolean skipRateLimit;

    /**
     * Applied to the response body before masking
     */
    UnaryOperator<Object> transform;

    public String breakerKey() {
        return route != null ? route : endpoint;
    }

    /**
     * Header lookup ignoring case.
     */
    public Optional<String> header(String name) {
        if (headers == null) {
            return Optional.empty();
        }
        return headers.entrySet().stream()
                .filter(e -> e.getKey() != null && e.getKey().equalsIgnoreCase(name))
                .map(Map.Entry::getValue)
                .findFirst();
    }
}
