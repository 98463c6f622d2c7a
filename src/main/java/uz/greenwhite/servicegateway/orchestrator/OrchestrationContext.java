package uz.greenwhite.servicegateway.orchestrator;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.UUID;

/**
 * Created at the public API boundary; the correlation id follows the request
 * through logs, sub-calls and error reports.
 */
@Value
@Builder(toBuilder = true)
public class OrchestrationContext {

    String correlationId;
    String source;
    String operation;
    String userId;
    String clientId;
    String priority;
    Duration timeout;

    public static OrchestrationContext create(String source, String operation) {
        return OrchestrationContext.builder()
                .correlationId(UUID.randomUUID().toString())
                .source(source)
                .operation(operation)
                .build();
    }

    public OrchestrationContext withOperation(String operation) {
        return toBuilder().operation(operation).build();
    }
}
