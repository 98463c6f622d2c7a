package uz.greenwhite.servicegateway.health;

import java.util.Map;

/**
 * Result of one sub-check of the health report.
 */
public record HealthCheck(boolean healthy, Map<String, Object> info) {

    public static HealthCheck up(Map<String, Object> info) {
        return new HealthCheck(true, info);
    }

    public static HealthCheck down(Map<String, Object> info) {
        return new HealthCheck(false, info);
    }
}
