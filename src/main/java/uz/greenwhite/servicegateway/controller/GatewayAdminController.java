package uz.greenwhite.servicegateway.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import uz.greenwhite.servicegateway.circuit.CircuitBreakerMetrics;
import uz.greenwhite.servicegateway.error.ErrorHandler;
import uz.greenwhite.servicegateway.error.ErrorStats;
import uz.greenwhite.servicegateway.gateway.ApiGateway;
import uz.greenwhite.servicegateway.health.GatewayHealthService;
import uz.greenwhite.servicegateway.health.HealthReport;
import uz.greenwhite.servicegateway.orchestrator.OrchestratorStats;
import uz.greenwhite.servicegateway.orchestrator.ServiceOrchestrator;
import uz.greenwhite.servicegateway.ratelimit.RateLimitStatus;
import uz.greenwhite.servicegateway.ratelimit.RateLimiter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Operational endpoints: health, breaker state, rate-limit inspection and resets.
 */
@Slf4j
@RestController
@RequestMapping("/api/gateway")
@RequiredArgsConstructor
public class GatewayAdminController {

    private final GatewayHealthService healthService;
    private final ApiGateway gateway;
    private final ErrorHandler errorHandler;
    private final RateLimiter rateLimiter;
    private final ServiceOrchestrator orchestrator;

    /**
     * GET /api/gateway/health
     * <p>
     * 200 when healthy or degraded, 503 when unhealthy.
     */
    @GetMapping("/health")
    public ResponseEntity<HealthReport> health() {
        HealthReport report = healthService.healthCheck();
        HttpStatus status = HealthReport.UNHEALTHY.equals(report.status())
                ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.OK;
        return ResponseEntity.status(status).body(report);
    }

    /**
     * GET /api/gateway/circuit-breakers
     * <p>
     * Response:
     * <pre>
     * {
     *   "endpoints": [ { "name": "/functions/v1/send-sms", "state": "CLOSED", ... } ],
     *   "services":  [ { "name": "vapi", "state": "OPEN", ... } ]
     * }
     * </pre>
     */
    @GetMapping("/circuit-breakers")
    public ResponseEntity<Map<String, List<CircuitBreakerMetrics>>> circuitBreakers() {
        Map<String, List<CircuitBreakerMetrics>> body = new LinkedHashMap<>();
        body.put("endpoints", gateway.getCircuitBreakers().getAllMetrics());
        body.put("services", errorHandler.getCircuitBreakers().getAllMetrics());
        return ResponseEntity.ok(body);
    }

    /**
     * POST /api/gateway/circuit-breakers/{name}/reset
     * <p>
     * Resets the service breaker {@code name}.
     */
    @PostMapping("/circuit-breakers/{name}/reset")
    public ResponseEntity<Map<String, Object>> resetServiceBreaker(@PathVariable String name) {
        return resetResult(name, errorHandler.getCircuitBreakers().reset(name));
    }

    /**
     * POST /api/gateway/circuit-breakers/reset?endpoint=/functions/v1/send-sms
     * <p>
     * Endpoint breakers are keyed by path, which does not fit in a path variable.
     */
    @PostMapping("/circuit-breakers/reset")
    public ResponseEntity<Map<String, Object>> resetEndpointBreaker(@RequestParam String endpoint) {
        return resetResult(endpoint, gateway.getCircuitBreakers().reset(endpoint));
    }

    /**
     * GET /api/gateway/rate-limits/{clientId}?endpoint=/api/users
     */
    @GetMapping("/rate-limits/{clientId}")
    public ResponseEntity<RateLimitStatus> rateLimitStatus(@PathVariable String clientId,
                                                           @RequestParam String endpoint) {
        return ResponseEntity.ok(rateLimiter.getStatus(clientId, endpoint));
    }

    /**
     * DELETE /api/gateway/rate-limits/{clientId}[?endpoint=/api/users]
     * <p>
     * Without {@code endpoint} every window of the client is cleared.
     */
    @DeleteMapping("/rate-limits/{clientId}")
    public ResponseEntity<Void> resetRateLimit(@PathVariable String clientId,
                                               @RequestParam(required = false) String endpoint) {
        if (endpoint != null) {
            rateLimiter.reset(clientId, endpoint);
        } else {
            rateLimiter.reset(clientId);
        }
        log.info("Rate limit reset: client={}, endpoint={}", clientId, endpoint != null ? endpoint : "*");
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/errors/stats")
    public ResponseEntity<ErrorStats> errorStats() {
        return ResponseEntity.ok(errorHandler.getErrorStats());
    }

    @GetMapping("/orchestrator/stats")
    public ResponseEntity<OrchestratorStats> orchestratorStats() {
        return ResponseEntity.ok(orchestrator.getStats());
    }

    private static ResponseEntity<Map<String, Object>> resetResult(String name, boolean reset) {
        if (!reset) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(Map.of("status", "not_found", "name", name));
        }
        log.info("Circuit breaker [{}] reset via admin API", name);
        return ResponseEntity.ok(Map.of("status", "reset", "name", name));
    }
}
