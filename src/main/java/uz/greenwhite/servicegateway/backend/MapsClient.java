package uz.greenwhite.servicegateway.backend;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import uz.greenwhite.servicegateway.config.BackendProperties;
import uz.greenwhite.servicegateway.error.GatewayConfigurationException;
import uz.greenwhite.servicegateway.error.HttpStatusException;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Google Maps web services, called directly with the API key.
 * The API reports most failures inside a 200 body; those are mapped to HTTP statuses.
 */
@Slf4j
@Component
public class MapsClient {

    private static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT =
            new ParameterizedTypeReference<>() {};

    private final WebClient webClient;
    private final BackendProperties.Backend properties;

    public MapsClient(WebClient webClient, BackendProperties backendProperties) {
        this.webClient = webClient;
        this.properties = backendProperties.getGoogleMaps();
    }

    public Map<String, Object> geocode(String address) {
        URI uri = baseUri("/geocode/json")
                .queryParam("address", address)
                .queryParam("key", apiKey())
                .build()
                .encode()
                .toUri();
        return call(uri, "geocode");
    }

    public Map<String, Object> distanceMatrix(List<String> origins, List<String> destinations) {
        URI uri = baseUri("/distancematrix/json")
                .queryParam("origins", String.join("|", origins))
                .queryParam("destinations", String.join("|", destinations))
                .queryParam("key", apiKey())
                .build()
                .encode()
                .toUri();
        return call(uri, "distanceMatrix");
    }

    private Map<String, Object> call(URI uri, String operation) {
        log.debug("Google Maps request: operation={}", operation);
        Map<String, Object> body = webClient.get()
                .uri(uri)
                .retrieve()
                .bodyToMono(JSON_OBJECT)
                .block(Duration.ofMillis(properties.getTimeoutMs()));

        if (body == null) {
            throw new HttpStatusException(502, "Empty response from Google Maps");
        }
        checkApiStatus(body, operation);
        return body;
    }

    static void checkApiStatus(Map<String, Object> body, String operation) {
        String status = String.valueOf(body.get("status"));
        int httpStatus = switch (status) {
            case "OK", "ZERO_RESULTS" -> 200;
            case "OVER_QUERY_LIMIT", "OVER_DAILY_LIMIT" -> 429;
            case "REQUEST_DENIED" -> 403;
            case "INVALID_REQUEST", "MAX_ELEMENTS_EXCEEDED", "MAX_DIMENSIONS_EXCEEDED", "NOT_FOUND" -> 400;
            default -> 503;
        };
        if (httpStatus != 200) {
            log.warn("Google Maps {} failed: status={}, message={}", operation, status, body.get("error_message"));
            throw new HttpStatusException(httpStatus, status);
        }
    }

    private UriComponentsBuilder baseUri(String path) {
        return UriComponentsBuilder.fromHttpUrl(properties.getBaseUrl() + path);
    }

    private String apiKey() {
        if (!properties.isEnabled() || !properties.hasApiKey()) {
            throw new GatewayConfigurationException("Google Maps API key not configured (gateway.backends.google-maps.api-key)");
        }
        return properties.getApiKey();
    }
}
