package uz.greenwhite.servicegateway.gateway;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GatewayMeta {

    /**
     * Fresh per call, unrelated to the orchestrator correlation id
     */
    String requestId;
    Instant timestamp;
    long duration;
    String endpoint;
    Boolean cached;

    /**
     * Zero-based attempt that produced the response, set when a retry happened
     */
    Integer retryAttempt;
}
