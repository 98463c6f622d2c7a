package uz.greenwhite.servicegateway.gateway;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import uz.greenwhite.servicegateway.error.ErrorCategory;
import uz.greenwhite.servicegateway.error.GatewayCallException;
import uz.greenwhite.servicegateway.error.StandardError;

import java.util.Map;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GatewayError {

    String code;
    ErrorCategory category;

    /**
     * Always the templated user message
     */
    String message;

    boolean retryable;
    Integer httpStatus;
    Map<String, Object> details;
    String stack;

    public static GatewayError from(StandardError error) {
        return GatewayError.builder()
                .code(error.getCode())
                .category(error.getCategory())
                .message(error.getUserMessage())
                .retryable(error.isRetryable())
                .httpStatus(error.getHttpStatus())
                .details(error.getDetails().isEmpty() ? null : error.getDetails())
                .stack(error.getStack())
                .build();
    }

    /**
     * For callers that unwrap a failed response back into an exception.
     */
    public GatewayCallException toException() {
        return new GatewayCallException(category, code, message, retryable, httpStatus, details);
    }
}
