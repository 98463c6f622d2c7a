package uz.greenwhite.servicegateway.config;

import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import uz.greenwhite.servicegateway.error.GatewayConfigurationException;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "gateway.cache")
public class CacheProperties {

    /**
     * Fallback cache store: memory | redis
     */
    private String store = "memory";

    /**
     * Lifetime of a last-known-good value in milliseconds.
     * Default: 300000 (5 minutes)
     */
    private long ttlMs = 300_000;

    /**
     * Key prefix used by the Redis store
     */
    private String keyPrefix = "gateway:fallback:";

    @PostConstruct
    public void validate() {
        if (!"memory".equals(store) && !"redis".equals(store)) {
            throw new GatewayConfigurationException("gateway.cache.store must be 'memory' or 'redis', got: " + store);
        }
        if (ttlMs <= 0) {
            throw new GatewayConfigurationException("gateway.cache.ttl-ms must be > 0");
        }
    }
}
