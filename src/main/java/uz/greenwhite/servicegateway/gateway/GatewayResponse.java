package uz.greenwhite.servicegateway.gateway;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Envelope returned by every gateway entry point. Exactly one of data and error is set.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GatewayResponse<T> {

    boolean success;
    T data;
    GatewayError error;
    GatewayMeta meta;

    /**
     * Signaling headers: X-RateLimit-Limit/Remaining/Reset, Retry-After on denial
     */
    @Singular
    Map<String, String> headers;

    public static <T> GatewayResponse<T> success(T data, GatewayMeta meta, Map<String, String> headers) {
        return GatewayResponse.<T>builder()
                .success(true)
                .data(data)
                .meta(meta)
                .headers(headers)
                .build();
    }

    public static <T> GatewayResponse<T> failure(GatewayError error, GatewayMeta meta, Map<String, String> headers) {
        return GatewayResponse.<T>builder()
                .success(false)
                .error(error)
                .meta(meta)
                .headers(headers)
                .build();
    }
}
