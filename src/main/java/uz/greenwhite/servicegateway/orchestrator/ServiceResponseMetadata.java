package uz.greenwhite.servicegateway.orchestrator;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ServiceResponseMetadata {

    String correlationId;
    long duration;
    String service;
    Boolean cached;

    /**
     * Attempts made, reported only when more than one
     */
    Integer retryAttempt;
}
