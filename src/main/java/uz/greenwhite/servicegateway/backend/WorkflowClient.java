package uz.greenwhite.servicegateway.backend;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import uz.greenwhite.servicegateway.config.BackendProperties;
import uz.greenwhite.servicegateway.error.GatewayConfigurationException;
import uz.greenwhite.servicegateway.error.HttpStatusException;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Posts workflow events to n8n webhooks: {@code {webhook-base-url}/{event}}.
 */
@Slf4j
@Component
public class WorkflowClient {

    private final WebClient webClient;
    private final BackendProperties.N8n properties;
    private final Clock clock;

    public WorkflowClient(WebClient webClient, BackendProperties backendProperties, Clock clock) {
        this.webClient = webClient;
        this.properties = backendProperties.getN8n();
        this.clock = clock;
    }

    /**
     * @return the webhook answer, or null when it has no body
     */
    public Object trigger(String event, Object data, String correlationId, String source) {
        String baseUrl = properties.getWebhookBaseUrl();
        if (!properties.isEnabled() || baseUrl == null || baseUrl.isBlank()) {
            throw new GatewayConfigurationException("n8n webhook URL not configured (gateway.backends.n8n.webhook-base-url)");
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("correlationId", correlationId);
        metadata.put("timestamp", clock.instant().toString());
        metadata.put("source", source);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("event", event);
        payload.put("data", data);
        payload.put("metadata", metadata);

        log.info("Triggering workflow: event={}, correlationId={}", event, correlationId);

        return webClient.post()
                .uri(trimSlash(baseUrl) + "/" + event)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(payload)
                .retrieve()
                .onStatus(HttpStatusCode::isError, resp -> resp.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(body -> new HttpStatusException(resp.statusCode().value(), body)))
                .bodyToMono(Object.class)
                .block(Duration.ofMillis(properties.getTimeoutMs()));
    }

    private static String trimSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
