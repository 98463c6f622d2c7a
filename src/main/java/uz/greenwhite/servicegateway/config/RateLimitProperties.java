package uz.greenwhite.servicegateway.config;

import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import uz.greenwhite.servicegateway.error.GatewayConfigurationException;

@Slf4j
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "gateway.rate-limit")
public class RateLimitProperties {

    /**
     * When false every request is admitted
     */
    private boolean enabled = true;

    /**
     * Fixed window length in milliseconds.
     * Default: 60000 (1 minute)
     */
    private long windowMs = 60_000;

    /**
     * Requests admitted per window, also the token bucket capacity.
     * Default: 100
     */
    private int maxRequests = 100;

    @PostConstruct
    public void validate() {
        if (windowMs <= 0) {
            throw new GatewayConfigurationException("gateway.rate-limit.window-ms must be > 0");
        }
        if (maxRequests <= 0) {
            throw new GatewayConfigurationException("gateway.rate-limit.max-requests must be > 0");
        }
        log.info("Rate limit config: enabled={}, window={}ms, maxRequests={}", enabled, windowMs, maxRequests);
    }
}
