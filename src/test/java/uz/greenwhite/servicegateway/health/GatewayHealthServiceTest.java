package uz.greenwhite.servicegateway.health;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import uz.greenwhite.servicegateway.backend.DataStoreClient;
import uz.greenwhite.servicegateway.circuit.CircuitBreakerConfig;
import uz.greenwhite.servicegateway.circuit.CircuitBreakerRegistry;
import uz.greenwhite.servicegateway.config.BackendProperties;
import uz.greenwhite.servicegateway.error.ErrorHandler;
import uz.greenwhite.servicegateway.gateway.ApiGateway;
import uz.greenwhite.servicegateway.support.MutableClock;
import uz.greenwhite.servicegateway.support.TestFixtures;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class GatewayHealthServiceTest {

    private MutableClock clock;
    private DataStoreClient dataStore;
    private ApiGateway gateway;
    private ErrorHandler errorHandler;
    private BackendProperties backends;
    private Set<String> failingHosts;
    private List<String> probedUrls;
    private GatewayHealthService healthService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        dataStore = mock(DataStoreClient.class);
        gateway = mock(ApiGateway.class);
        errorHandler = TestFixtures.errorHandler(clock);
        when(gateway.getCircuitBreakers()).thenReturn(new CircuitBreakerRegistry("endpoint",
                new CircuitBreakerConfig(1, Duration.ofMinutes(1), Duration.ofMinutes(1), 0), clock));

        backends = new BackendProperties();
        backends.getVapi().setBaseUrl("http://vapi.local/");
        backends.getTwilio().setBaseUrl("http://twilio.local");

        failingHosts = new HashSet<>();
        probedUrls = new ArrayList<>();
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> {
                    probedUrls.add(request.url().toString());
                    HttpStatus status = failingHosts.contains(request.url().getHost())
                            ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.OK;
                    return Mono.just(ClientResponse.create(status).build());
                })
                .build();

        healthService = new GatewayHealthService(dataStore, webClient, backends, gateway, errorHandler, clock);
    }

    @Test
    @DisplayName("all checks passing is healthy")
    void healthy() {
        when(dataStore.ping()).thenReturn(true);

        HealthReport report = healthService.healthCheck();

        assertThat(report.status()).isEqualTo(HealthReport.HEALTHY);
        assertThat(report.timestamp()).isEqualTo(clock.instant());
        assertThat(report.details()).containsOnlyKeys("database", "external_services", "circuit_breakers");
        assertThat(probedUrls).containsExactly("http://vapi.local/health", "http://twilio.local/health");
    }

    @Test
    @DisplayName("a failing backend probe degrades the report")
    void degraded() {
        when(dataStore.ping()).thenReturn(true);
        failingHosts.add("twilio.local");

        HealthReport report = healthService.healthCheck();

        assertThat(report.status()).isEqualTo(HealthReport.DEGRADED);
        HealthCheck external = report.details().get("external_services");
        assertThat(external.healthy()).isFalse();
        assertThat(external.info()).containsEntry("vapi", "up").containsEntry("twilio", "down");
    }

    @Test
    @DisplayName("an open breaker in either registry fails the breaker check")
    void openBreaker() {
        // given
        when(dataStore.ping()).thenReturn(true);
        gateway.getCircuitBreakers().circuitBreaker("/functions/v1/send-sms").recordFailure("boom");
        errorHandler.getCircuitBreakers().circuitBreaker("vapi");

        // when
        HealthCheck breakers = healthService.healthCheck().details().get("circuit_breakers");

        // then
        assertThat(breakers.healthy()).isFalse();
        assertThat(breakers.info())
                .containsEntry("service:vapi", "CLOSED")
                .containsEntry("open", List.of("endpoint:/functions/v1/send-sms"));
    }

    @Test
    @DisplayName("nothing passing is unhealthy")
    void unhealthy() {
        when(dataStore.ping()).thenThrow(new IllegalStateException("connection refused"));
        failingHosts.add("vapi.local");
        gateway.getCircuitBreakers().circuitBreaker("/api/users").recordFailure("boom");

        HealthReport report = healthService.healthCheck();

        assertThat(report.status()).isEqualTo(HealthReport.UNHEALTHY);
        assertThat(report.isHealthy()).isFalse();
        assertThat(report.details().get("database").info()).containsEntry("reachable", false);
    }
}
