package uz.greenwhite.servicegateway.maintenance;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import uz.greenwhite.servicegateway.error.ErrorHandler;
import uz.greenwhite.servicegateway.gateway.ApiGateway;
import uz.greenwhite.servicegateway.orchestrator.FallbackCache;
import uz.greenwhite.servicegateway.ratelimit.RateLimiter;

/**
 * Drops expired in-memory state: rate-limit windows, fallback cache values, hourly
 * error counters and idle endpoint circuit breakers. Lookups already ignore expired
 * data; this only bounds memory.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "gateway.maintenance.enabled", havingValue = "true", matchIfMissing = true)
public class ExpiryMaintenanceTask {

    private final RateLimiter rateLimiter;
    private final FallbackCache fallbackCache;
    private final ErrorHandler errorHandler;
    private final ApiGateway gateway;

    @Scheduled(fixedDelayString = "${gateway.maintenance.sweep-interval-ms:300000}",
            initialDelayString = "${gateway.maintenance.sweep-interval-ms:300000}")
    public void sweep() {
        try {
            int rateLimits = rateLimiter.sweepExpired();
            int cached = fallbackCache.sweepExpired();
            int errorKeys = errorHandler.sweepErrorCounters();
            int breakers = gateway.getCircuitBreakers().evictIdle();

            if (rateLimits + cached + errorKeys + breakers > 0) {
                log.info("Maintenance sweep: rateLimitEntries={}, cacheEntries={}, errorCounters={}, idleBreakers={}",
                        rateLimits, cached, errorKeys, breakers);
            } else {
                log.debug("Maintenance sweep: nothing expired");
            }
        } catch (Exception e) {
            log.error("Maintenance sweep failed: {}", e.getMessage(), e);
        }
    }
}
