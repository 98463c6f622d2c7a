package uz.greenwhite.servicegateway.config;

import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import uz.greenwhite.servicegateway.error.GatewayConfigurationException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Connection settings of the backends reached by the orchestrator.
 *
 * Example config:
 *   gateway.backends:
 *     supabase:
 *       base-url: https://project.supabase.co
 *       api-key: ${SUPABASE_KEY}
 *     google-maps:
 *       api-key: ${GOOGLE_MAPS_API_KEY}
 */
@Slf4j
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "gateway.backends")
public class BackendProperties {

    private Backend supabase = new Backend();
    private Vapi vapi = new Vapi();
    private Backend twilio = new Backend();
    private Backend googleMaps = new Backend("https://maps.googleapis.com/maps/api");
    private N8n n8n = new N8n();

    @Getter
    @Setter
    public static class Backend {
        private boolean enabled = true;
        private String baseUrl;
        private String apiKey;
        private long timeoutMs = 30_000;

        public Backend() {
        }

        public Backend(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public boolean hasBaseUrl() {
            return baseUrl != null && !baseUrl.isBlank();
        }

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }
    }

    @Getter
    @Setter
    public static class Vapi extends Backend {
        private String assistantId;
    }

    @Getter
    @Setter
    public static class N8n extends Backend {

        /**
         * Workflow events are posted to {webhook-base-url}/{operation}
         */
        private String webhookBaseUrl;
    }

    /**
     * External backends whose {@code {baseUrl}/health} is probed by the health check,
     * keyed by service name.
     */
    public Map<String, String> healthTargets() {
        Map<String, String> targets = new LinkedHashMap<>();
        addTarget(targets, "vapi", vapi);
        addTarget(targets, "twilio", twilio);
        addTarget(targets, "n8n", n8n);
        return targets;
    }

    private static void addTarget(Map<String, String> targets, String name, Backend backend) {
        if (backend.isEnabled() && backend.hasBaseUrl()) {
            targets.put(name, backend.getBaseUrl());
        }
    }

    @PostConstruct
    public void validate() {
        if (supabase.isEnabled() && !supabase.hasBaseUrl()) {
            throw new GatewayConfigurationException("gateway.backends.supabase.base-url is required");
        }
        if (n8n.isEnabled() && (n8n.getWebhookBaseUrl() == null || n8n.getWebhookBaseUrl().isBlank())) {
            log.warn("gateway.backends.n8n.webhook-base-url not set, workflow triggers will fail");
        }
        if (googleMaps.isEnabled() && !googleMaps.hasApiKey()) {
            log.warn("gateway.backends.google-maps.api-key not set, maps operations will fail with a configuration error");
        }
    }
}
