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
@ConfigurationProperties(prefix = "gateway.batch")
public class BatchProperties {

    /**
     * Default chunk size when BatchOptions does not set one
     */
    private int maxConcurrency = 5;

    /**
     * Default per-operation timeout in milliseconds
     */
    private long timeoutMs = 30_000;

    /**
     * Threads of the orchestrator executor
     */
    private int poolSize = 10;

    private int queueCapacity = 100;

    @PostConstruct
    public void validate() {
        if (maxConcurrency <= 0) {
            throw new GatewayConfigurationException("gateway.batch.max-concurrency must be > 0");
        }
        if (timeoutMs <= 0) {
            throw new GatewayConfigurationException("gateway.batch.timeout-ms must be > 0");
        }
        if (poolSize < maxConcurrency) {
            throw new GatewayConfigurationException("gateway.batch.pool-size must be >= max-concurrency");
        }
    }
}
