package uz.greenwhite.servicegateway.gateway;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uz.greenwhite.servicegateway.config.GatewayProperties;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ResponseTransformerTest {

    private final GatewayProperties properties = new GatewayProperties();
    private final ResponseTransformer transformer = new ResponseTransformer(properties);

    @Test
    @DisplayName("sensitive fields are masked at any depth")
    @SuppressWarnings("unchecked")
    void masksSensitiveFields() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", "Aziz");
        body.put("apiKey", "sk_live_123456");
        body.put("password", "short");
        body.put("items", List.of(Map.of("access_token", "abcdefghij")));

        Map<String, Object> masked = (Map<String, Object>) transformer.transform(body, null);

        assertThat(masked).containsEntry("name", "Aziz")
                .containsEntry("apiKey", "sk***56")
                .containsEntry("password", "***");
        assertThat((List<Map<String, Object>>) masked.get("items"))
                .containsExactly(Map.of("access_token", "ab***ij"));
    }

    @Test
    @DisplayName("normalization renames fields and converts timestamps when enabled")
    @SuppressWarnings("unchecked")
    void normalizes() {
        properties.getTransform().setNormalize(true);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("callId", "c-1");
        body.put("created_at", "1700000000");
        body.put("endedReason", "hangup");

        Map<String, Object> normalized = (Map<String, Object>) transformer.transform(body, null);

        assertThat(normalized).containsEntry("call_id", "c-1")
                .containsEntry("created_at", "2023-11-14T22:13:20Z")
                .containsEntry("ended_reason", "hangup");
    }

    @Test
    @DisplayName("timestamps in unknown formats are left alone")
    void unparseableTimestamp() {
        assertThat(ResponseTransformer.toIsoTimestamp("yesterday")).isEqualTo("yesterday");
        assertThat(ResponseTransformer.toIsoTimestamp("2024-03-01")).isEqualTo("2024-03-01T00:00:00Z");
    }

    @Test
    @DisplayName("the caller transform runs first and a failing one leaves the data untouched")
    void customTransform() {
        assertThat(transformer.transform(Map.of("a", 1), data -> List.of(data))).isEqualTo(List.of(Map.of("a", 1)));

        Object original = Map.of("a", 1);
        assertThat(transformer.transform(original, data -> {
            throw new IllegalStateException("bad transform");
        })).isSameAs(original);
    }
}
