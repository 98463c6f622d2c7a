package uz.greenwhite.servicegateway.backend;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.Exceptions;
import uz.greenwhite.servicegateway.config.BackendProperties;
import uz.greenwhite.servicegateway.config.GatewayProperties;
import uz.greenwhite.servicegateway.gateway.BackendCall;
import uz.greenwhite.servicegateway.gateway.BackendTransport;

import java.util.List;

/**
 * Sends gateway calls to {@code gateway.base-url + endpoint} over the shared WebClient.
 * Non-2xx answers surface as WebClientResponseException, timeouts as TimeoutException.
 */
@Slf4j
@Component
public class WebClientBackendTransport implements BackendTransport {

    private final WebClient webClient;
    private final GatewayProperties gatewayProperties;
    private final BackendProperties.Backend dataStore;

    public WebClientBackendTransport(WebClient webClient,
                                     GatewayProperties gatewayProperties,
                                     BackendProperties backendProperties) {
        this.webClient = webClient;
        this.gatewayProperties = gatewayProperties;
        this.dataStore = backendProperties.getSupabase();
    }

    @Override
    public Object exchange(BackendCall call) throws Exception {
        String url = gatewayProperties.getBaseUrl() + call.endpoint();

        WebClient.RequestBodySpec spec = webClient
                .method(HttpMethod.valueOf(call.method()))
                .uri(url)
                .headers(h -> applyHeaders(h, call));

        WebClient.RequestHeadersSpec<?> ready = call.body() != null ? spec.bodyValue(call.body()) : spec;

        try {
            return ready.retrieve()
                    .bodyToMono(Object.class)
                    .timeout(call.timeout())
                    .block();
        } catch (RuntimeException e) {
            // block() wraps checked exceptions such as TimeoutException
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof Exception checked && cause != e) {
                throw checked;
            }
            throw e;
        }
    }

    private void applyHeaders(HttpHeaders headers, BackendCall call) {
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (dataStore.hasApiKey()) {
            headers.set("apikey", dataStore.getApiKey());
            headers.setBearerAuth(dataStore.getApiKey());
        }
        if (call.headers() != null) {
            call.headers().forEach(headers::set);
        }
        headers.set("X-Request-ID", call.requestId());
        headers.set("X-Retry-Attempt", String.valueOf(call.attempt()));
    }
}
