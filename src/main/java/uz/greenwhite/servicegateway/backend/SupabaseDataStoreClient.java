package uz.greenwhite.servicegateway.backend;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriBuilder;
import uz.greenwhite.servicegateway.config.BackendProperties;
import uz.greenwhite.servicegateway.error.RequestValidationException;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * PostgREST client for the Supabase data store ({@code /rest/v1/{table}}).
 * Filters are equality filters; non-2xx answers throw RestClientResponseException.
 */
@Slf4j
@Component
public class SupabaseDataStoreClient implements DataStoreClient {

    private static final Pattern IDENTIFIER = Pattern.compile("^[a-zA-Z_][a-zA-Z0-9_]*$");
    private static final ParameterizedTypeReference<List<Map<String, Object>>> ROWS =
            new ParameterizedTypeReference<>() {};

    private final RestClient restClient;

    public SupabaseDataStoreClient(BackendProperties properties) {
        BackendProperties.Backend supabase = properties.getSupabase();

        var factory = new JdkClientHttpRequestFactory();
        factory.setReadTimeout(Duration.ofMillis(supabase.getTimeoutMs()));

        RestClient.Builder builder = RestClient.builder()
                .baseUrl(supabase.getBaseUrl() + "/rest/v1")
                .requestFactory(factory)
                .defaultHeader("Prefer", "return=representation");
        if (supabase.hasApiKey()) {
            builder.defaultHeader("apikey", supabase.getApiKey())
                    .defaultHeader("Authorization", "Bearer " + supabase.getApiKey());
        }
        this.restClient = builder.build();
    }

    @Override
    public List<Map<String, Object>> fetch(String table, Map<String, Object> filters) {
        checkIdentifier(table);
        filters.keySet().forEach(SupabaseDataStoreClient::checkIdentifier);
        log.debug("Fetching rows: table={}, filters={}", table, filters.keySet());

        List<Map<String, Object>> rows = restClient.get()
                .uri(b -> withFilters(b.path("/{table}"), filters).build(table))
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .body(ROWS);
        return rows != null ? rows : List.of();
    }

    @Override
    public List<Map<String, Object>> insert(String table, Map<String, Object> data) {
        checkIdentifier(table);
        log.debug("Inserting row: table={}", table);

        List<Map<String, Object>> rows = restClient.post()
                .uri("/{table}", table)
                .contentType(MediaType.APPLICATION_JSON)
                .body(data)
                .retrieve()
                .body(ROWS);
        return rows != null ? rows : List.of();
    }

    @Override
    public List<Map<String, Object>> update(String table, String id, Map<String, Object> data) {
        checkIdentifier(table);
        log.debug("Updating row: table={}, id={}", table, id);

        List<Map<String, Object>> rows = restClient.patch()
                .uri(b -> b.path("/{table}").queryParam("id", "eq." + id).build(table))
                .contentType(MediaType.APPLICATION_JSON)
                .body(data)
                .retrieve()
                .body(ROWS);
        return rows != null ? rows : List.of();
    }

    @Override
    public void delete(String table, String id) {
        checkIdentifier(table);
        log.debug("Deleting row: table={}, id={}", table, id);

        restClient.delete()
                .uri(b -> b.path("/{table}").queryParam("id", "eq." + id).build(table))
                .retrieve()
                .toBodilessEntity();
    }

    @Override
    public boolean ping() {
        try {
            return restClient.get()
                    .uri("/")
                    .exchange((req, resp) -> resp.getStatusCode().value() < 500);
        } catch (Exception e) {
            log.warn("Data store ping failed: {}", e.getMessage());
            return false;
        }
    }

    private static UriBuilder withFilters(UriBuilder builder, Map<String, Object> filters) {
        filters.forEach((column, value) -> builder.queryParam(column, "eq." + value));
        return builder;
    }

    private static void checkIdentifier(String name) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new RequestValidationException(List.of("invalid identifier: " + name));
        }
    }
}
