package uz.greenwhite.servicegateway.controller;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import uz.greenwhite.servicegateway.circuit.CircuitBreakerConfig;
import uz.greenwhite.servicegateway.circuit.CircuitBreakerRegistry;
import uz.greenwhite.servicegateway.error.ErrorContext;
import uz.greenwhite.servicegateway.error.ErrorHandler;
import uz.greenwhite.servicegateway.gateway.ApiGateway;
import uz.greenwhite.servicegateway.health.GatewayHealthService;
import uz.greenwhite.servicegateway.health.HealthCheck;
import uz.greenwhite.servicegateway.health.HealthReport;
import uz.greenwhite.servicegateway.orchestrator.OrchestratorStats;
import uz.greenwhite.servicegateway.orchestrator.ServiceOrchestrator;
import uz.greenwhite.servicegateway.ratelimit.RateLimitStatus;
import uz.greenwhite.servicegateway.ratelimit.RateLimiter;
import uz.greenwhite.servicegateway.support.MutableClock;
import uz.greenwhite.servicegateway.support.TestFixtures;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class GatewayAdminControllerTest {

    private MutableClock clock;
    private GatewayHealthService healthService;
    private ApiGateway gateway;
    private ErrorHandler errorHandler;
    private RateLimiter rateLimiter;
    private ServiceOrchestrator orchestrator;
    private CircuitBreakerRegistry endpointBreakers;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        healthService = mock(GatewayHealthService.class);
        gateway = mock(ApiGateway.class);
        rateLimiter = mock(RateLimiter.class);
        orchestrator = mock(ServiceOrchestrator.class);
        errorHandler = TestFixtures.errorHandler(clock);
        endpointBreakers = new CircuitBreakerRegistry("endpoint",
                new CircuitBreakerConfig(1, Duration.ofMinutes(1), Duration.ofMinutes(1), 0), clock);
        when(gateway.getCircuitBreakers()).thenReturn(endpointBreakers);

        mockMvc = MockMvcBuilders.standaloneSetup(
                new GatewayAdminController(healthService, gateway, errorHandler, rateLimiter, orchestrator))
                .build();
    }

    @Test
    @DisplayName("GET /health answers 503 only when unhealthy")
    void health() throws Exception {
        when(healthService.healthCheck())
                .thenReturn(new HealthReport(HealthReport.DEGRADED, clock.instant(),
                        Map.of("database", HealthCheck.down(Map.of("reachable", false)))))
                .thenReturn(new HealthReport(HealthReport.UNHEALTHY, clock.instant(), Map.of()));

        mockMvc.perform(get("/api/gateway/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("degraded"))
                .andExpect(jsonPath("$.details.database.healthy").value(false));

        mockMvc.perform(get("/api/gateway/health"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value("unhealthy"));
    }

    @Test
    @DisplayName("GET /circuit-breakers lists both registries")
    void listBreakers() throws Exception {
        endpointBreakers.circuitBreaker("/functions/v1/send-sms").recordFailure("boom");
        errorHandler.getCircuitBreakers().circuitBreaker("vapi");

        mockMvc.perform(get("/api/gateway/circuit-breakers"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.endpoints[0].name").value("/functions/v1/send-sms"))
                .andExpect(jsonPath("$.endpoints[0].state").value("OPEN"))
                .andExpect(jsonPath("$.services[0].name").value("vapi"))
                .andExpect(jsonPath("$.services[0].state").value("CLOSED"));
    }

    @Test
    @DisplayName("service breaker reset closes a known breaker and 404s an unknown one")
    void resetServiceBreaker() throws Exception {
        // given
        for (int i = 0; i < 10; i++) {
            errorHandler.getCircuitBreakers().circuitBreaker("twilio").recordFailure("down");
        }
        assertThat(errorHandler.getCircuitBreakers().circuitBreaker("twilio").isOpen()).isTrue();

        // when / then
        mockMvc.perform(post("/api/gateway/circuit-breakers/twilio/reset"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("reset"))
                .andExpect(jsonPath("$.name").value("twilio"));
        assertThat(errorHandler.getCircuitBreakers().circuitBreaker("twilio").isOpen()).isFalse();

        mockMvc.perform(post("/api/gateway/circuit-breakers/fax/reset"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value("not_found"));
    }

    @Test
    @DisplayName("endpoint breakers are reset by path in a query parameter")
    void resetEndpointBreaker() throws Exception {
        endpointBreakers.circuitBreaker("/functions/v1/send-sms").recordFailure("boom");

        mockMvc.perform(post("/api/gateway/circuit-breakers/reset").param("endpoint", "/functions/v1/send-sms"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("/functions/v1/send-sms"));

        assertThat(endpointBreakers.circuitBreaker("/functions/v1/send-sms").isOpen()).isFalse();
    }

    @Test
    @DisplayName("rate limit status and reset")
    void rateLimits() throws Exception {
        when(rateLimiter.getStatus("client-1", "/api/users")).thenReturn(RateLimitStatus.builder()
                .allowed(true).count(3).limit(100).resetTime(60_000).tokens(97).build());

        mockMvc.perform(get("/api/gateway/rate-limits/client-1").param("endpoint", "/api/users"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(3))
                .andExpect(jsonPath("$.remaining").value(97));

        mockMvc.perform(delete("/api/gateway/rate-limits/client-1").param("endpoint", "/api/users"))
                .andExpect(status().isNoContent());
        verify(rateLimiter).reset("client-1", "/api/users");

        mockMvc.perform(delete("/api/gateway/rate-limits/client-1"))
                .andExpect(status().isNoContent());
        verify(rateLimiter).reset("client-1");
    }

    @Test
    @DisplayName("GET /orchestrator/stats exposes cache counters")
    void orchestratorStats() throws Exception {
        when(orchestrator.getStats()).thenReturn(new OrchestratorStats(
                Map.of("vapi", true), 4, 3, 1, 0.75, 12));

        mockMvc.perform(get("/api/gateway/orchestrator/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cacheSize").value(4))
                .andExpect(jsonPath("$.hitRate").value(0.75))
                .andExpect(jsonPath("$.services.vapi").value(true));
    }

    @Test
    @DisplayName("GET /errors/stats reflects handled errors")
    void errorStats() throws Exception {
        errorHandler.handleError(new IllegalStateException("boom"),
                ErrorContext.of("vapi", "makeCall", "c-1"));

        mockMvc.perform(get("/api/gateway/errors/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalErrors").value(1));
    }
}
