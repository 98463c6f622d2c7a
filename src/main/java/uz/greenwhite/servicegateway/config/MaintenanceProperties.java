package uz.greenwhite.servicegateway.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "gateway.maintenance")
public class MaintenanceProperties {

    private boolean enabled = true;

    /**
     * Delay between sweeps of expired rate-limit entries, cache values and error counters.
     * Default: 300000 (5 minutes)
     */
    private long sweepIntervalMs = 300_000;
}
