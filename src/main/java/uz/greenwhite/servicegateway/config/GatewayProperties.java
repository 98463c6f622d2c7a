package uz.greenwhite.servicegateway.config;

import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import uz.greenwhite.servicegateway.error.GatewayConfigurationException;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "gateway")
public class GatewayProperties {

    /**
     * Base URL every gateway endpoint is resolved against.
     * Example: https://project.supabase.co
     */
    private String baseUrl;

    /**
     * Per-request timeout in milliseconds when the request does not set one.
     * Default: 30000
     */
    private long timeoutMs = 30_000;

    /**
     * Retries after the first attempt when the request does not set them.
     * Default: 3
     */
    private int retries = 3;

    private Auth auth = new Auth();
    private Monitoring monitoring = new Monitoring();
    private Transform transform = new Transform();

    @Getter
    @Setter
    public static class Auth {

        /**
         * When false the authentication stage is skipped entirely
         */
        private boolean required = true;

        /**
         * Endpoints that never need authentication
         */
        private List<String> skipRoutes = new ArrayList<>(List.of("/health", "/metrics"));
    }

    @Getter
    @Setter
    public static class Monitoring {
        private boolean enabled = true;

        /**
         * Share of completed requests logged at INFO, 0..1
         */
        private double sampleRate = 0.1;
    }

    @Getter
    @Setter
    public static class Transform {

        /**
         * Normalize timestamps and rename fields to snake_case
         */
        private boolean normalize = false;
    }

    @PostConstruct
    public void validate() {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new GatewayConfigurationException("gateway.base-url is required");
        }
        if (timeoutMs <= 0 || timeoutMs > 300_000) {
            throw new GatewayConfigurationException("gateway.timeout-ms must be in (0, 300000]");
        }
        if (retries < 0 || retries > 5) {
            throw new GatewayConfigurationException("gateway.retries must be in [0, 5]");
        }
        if (monitoring.sampleRate < 0 || monitoring.sampleRate > 1) {
            throw new GatewayConfigurationException("gateway.monitoring.sample-rate must be in [0, 1]");
        }
        log.info("Gateway config: baseUrl={}, timeout={}ms, retries={}, authRequired={}",
                baseUrl, timeoutMs, retries, auth.required);
    }
}
