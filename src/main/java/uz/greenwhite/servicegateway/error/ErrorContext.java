package uz.greenwhite.servicegateway.error;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.HashMap;
import java.util.Map;

@Value
@Builder(toBuilder = true)
public class ErrorContext {

    String source;
    String operation;
    String correlationId;
    String userId;

    @Singular("additional")
    Map<String, Object> additionalData;

    public static ErrorContext of(String source, String operation, String correlationId) {
        return ErrorContext.builder()
                .source(source)
                .operation(operation)
                .correlationId(correlationId)
                .build();
    }

    public ErrorContext withAdditional(Map<String, Object> extra) {
        Map<String, Object> merged = new HashMap<>(additionalData);
        merged.putAll(extra);
        return toBuilder().clearAdditionalData().additionalData(merged).build();
    }
}
