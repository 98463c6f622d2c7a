package uz.greenwhite.servicegateway.maintenance;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uz.greenwhite.servicegateway.circuit.CircuitBreakerRegistry;
import uz.greenwhite.servicegateway.error.ErrorHandler;
import uz.greenwhite.servicegateway.gateway.ApiGateway;
import uz.greenwhite.servicegateway.orchestrator.FallbackCache;
import uz.greenwhite.servicegateway.ratelimit.RateLimiter;
import uz.greenwhite.servicegateway.support.MutableClock;
import uz.greenwhite.servicegateway.support.TestFixtures;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ExpiryMaintenanceTaskTest {

    private final RateLimiter rateLimiter = mock(RateLimiter.class);
    private final FallbackCache fallbackCache = mock(FallbackCache.class);
    private final ErrorHandler errorHandler = mock(ErrorHandler.class);
    private final ApiGateway gateway = mock(ApiGateway.class);
    private final MutableClock clock = new MutableClock();
    private final CircuitBreakerRegistry endpointBreakers =
            new CircuitBreakerRegistry("endpoint", TestFixtures.breaker(3, 1000, 3).toConfig(), clock);
    private final ExpiryMaintenanceTask task =
            new ExpiryMaintenanceTask(rateLimiter, fallbackCache, errorHandler, gateway);

    @BeforeEach
    void setUp() {
        when(gateway.getCircuitBreakers()).thenReturn(endpointBreakers);
    }

    @Test
    @DisplayName("one sweep covers rate limits, the fallback cache and error counters")
    void sweepsAllStores() {
        when(rateLimiter.sweepExpired()).thenReturn(2);

        task.sweep();

        verify(rateLimiter).sweepExpired();
        verify(fallbackCache).sweepExpired();
        verify(errorHandler).sweepErrorCounters();
    }

    @Test
    @DisplayName("endpoint breakers with nothing left in their window are evicted, tripped ones stay")
    void evictsIdleEndpointBreakers() {
        // given
        endpointBreakers.circuitBreaker("/functions/v1/vapi-call/c-1").recordSuccess();
        endpointBreakers.circuitBreaker("/functions/v1/vapi-call/c-2").recordSuccess();
        for (int i = 0; i < 3; i++) {
            endpointBreakers.circuitBreaker("/functions/v1/send-sms").recordFailure("boom");
        }
        clock.advance(Duration.ofMinutes(2));

        // when
        task.sweep();

        // then
        assertThat(endpointBreakers.getAll()).hasSize(1);
        assertThat(endpointBreakers.find("/functions/v1/send-sms")).isPresent();
    }

    @Test
    @DisplayName("a failing store is logged, never propagated to the scheduler")
    void failureIsContained() {
        when(fallbackCache.sweepExpired()).thenThrow(new IllegalStateException("redis down"));

        assertThatCode(task::sweep).doesNotThrowAnyException();
    }
}
