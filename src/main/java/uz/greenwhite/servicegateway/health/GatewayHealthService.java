package uz.greenwhite.servicegateway.health;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import uz.greenwhite.servicegateway.backend.DataStoreClient;
import uz.greenwhite.servicegateway.circuit.CircuitBreakerMetrics;
import uz.greenwhite.servicegateway.circuit.CircuitBreakerRegistry;
import uz.greenwhite.servicegateway.circuit.CircuitState;
import uz.greenwhite.servicegateway.config.BackendProperties;
import uz.greenwhite.servicegateway.error.ErrorHandler;
import uz.greenwhite.servicegateway.gateway.ApiGateway;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregates database, external service and circuit breaker checks into one report.
 */
@Slf4j
@Service
public class GatewayHealthService {

    static final Duration PROBE_TIMEOUT = Duration.ofSeconds(5);

    private final DataStoreClient dataStore;
    private final WebClient webClient;
    private final BackendProperties backends;
    private final ApiGateway gateway;
    private final ErrorHandler errorHandler;
    private final Clock clock;

    public GatewayHealthService(DataStoreClient dataStore,
                                WebClient webClient,
                                BackendProperties backends,
                                ApiGateway gateway,
                                ErrorHandler errorHandler,
                                Clock clock) {
        this.dataStore = dataStore;
        this.webClient = webClient;
        this.backends = backends;
        this.gateway = gateway;
        this.errorHandler = errorHandler;
        this.clock = clock;
    }

    public HealthReport healthCheck() {
        Map<String, HealthCheck> details = new LinkedHashMap<>();
        details.put("database", checkDatabase());
        details.put("external_services", checkExternalServices());
        details.put("circuit_breakers", checkCircuitBreakers());

        long passed = details.values().stream().filter(HealthCheck::healthy).count();
        String status = passed == details.size() ? HealthReport.HEALTHY
                : passed > 0 ? HealthReport.DEGRADED
                : HealthReport.UNHEALTHY;

        if (!HealthReport.HEALTHY.equals(status)) {
            log.warn("Health check {}: passed={}/{}", status, passed, details.size());
        }
        return new HealthReport(status, clock.instant(), details);
    }

    private HealthCheck checkDatabase() {
        Map<String, Object> info = new LinkedHashMap<>();
        try {
            boolean reachable = dataStore.ping();
            info.put("reachable", reachable);
            return reachable ? HealthCheck.up(info) : HealthCheck.down(info);
        } catch (Exception e) {
            log.warn("Health [database] ping failed: {}", e.getMessage());
            info.put("reachable", false);
            info.put("error", e.getMessage());
            return HealthCheck.down(info);
        }
    }

    private HealthCheck checkExternalServices() {
        Map<String, Object> info = new LinkedHashMap<>();
        boolean allUp = true;
        for (Map.Entry<String, String> target : backends.healthTargets().entrySet()) {
            boolean up = probe(target.getKey(), target.getValue());
            info.put(target.getKey(), up ? "up" : "down");
            allUp &= up;
        }
        return allUp ? HealthCheck.up(info) : HealthCheck.down(info);
    }

    private boolean probe(String service, String baseUrl) {
        try {
            Boolean ok = webClient.get()
                    .uri(stripTrailingSlash(baseUrl) + "/health")
                    .exchangeToMono(response -> response.releaseBody()
                            .thenReturn(response.statusCode().is2xxSuccessful()))
                    .timeout(PROBE_TIMEOUT)
                    .block();
            return Boolean.TRUE.equals(ok);
        } catch (Exception e) {
            log.warn("Health [{}] probe failed: {}", service, e.getMessage());
            return false;
        }
    }

    private HealthCheck checkCircuitBreakers() {
        Map<String, Object> info = new LinkedHashMap<>();
        List<String> open = new ArrayList<>();
        collect(gateway.getCircuitBreakers(), info, open);
        collect(errorHandler.getCircuitBreakers(), info, open);
        info.put("open", open);
        return open.isEmpty() ? HealthCheck.up(info) : HealthCheck.down(info);
    }

    private static void collect(CircuitBreakerRegistry registry, Map<String, Object> info, List<String> open) {
        for (CircuitBreakerMetrics metrics : registry.getAllMetrics()) {
            String name = registry.getScope() + ":" + metrics.getName();
            info.put(name, metrics.getState().name());
            if (metrics.getState() == CircuitState.OPEN) {
                open.add(name);
            }
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
