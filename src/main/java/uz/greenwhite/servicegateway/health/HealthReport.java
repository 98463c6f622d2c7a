package uz.greenwhite.servicegateway.health;

import java.time.Instant;
import java.util.Map;

/**
 * @param status  healthy when every sub-check passed, degraded when some did, unhealthy when none did
 * @param details sub-check results keyed by check name
 */
public record HealthReport(String status, Instant timestamp, Map<String, HealthCheck> details) {

    public static final String HEALTHY = "healthy";
    public static final String DEGRADED = "degraded";
    public static final String UNHEALTHY = "unhealthy";

    public boolean isHealthy() {
        return HEALTHY.equals(status);
    }
}
