package uz.greenwhite.servicegateway.config;

import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import uz.greenwhite.servicegateway.error.GatewayConfigurationException;

@Slf4j
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "gateway.http")
public class HttpProperties {

    private int connectTimeoutMs = 5000;
    private int readTimeoutMs = 30_000;
    private int writeTimeoutMs = 30_000;

    /**
     * Largest response body buffered in memory
     */
    private int maxInMemorySizeMb = 16;

    @PostConstruct
    public void validate() {
        if (connectTimeoutMs <= 0) {
            throw new GatewayConfigurationException("gateway.http.connect-timeout-ms must be > 0");
        }
        if (readTimeoutMs <= 0) {
            throw new GatewayConfigurationException("gateway.http.read-timeout-ms must be > 0");
        }
        if (writeTimeoutMs <= 0) {
            throw new GatewayConfigurationException("gateway.http.write-timeout-ms must be > 0");
        }

        log.info("HTTP client config: connect={}ms, read={}ms, write={}ms",
                connectTimeoutMs, readTimeoutMs, writeTimeoutMs);
    }
}
