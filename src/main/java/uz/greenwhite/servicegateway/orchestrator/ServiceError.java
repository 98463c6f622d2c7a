package uz.greenwhite.servicegateway.orchestrator;

import lombok.Builder;
import lombok.Value;
import uz.greenwhite.servicegateway.error.ErrorCategory;
import uz.greenwhite.servicegateway.error.StandardError;

@Value
@Builder
public class ServiceError {

    ErrorCategory category;
    String code;

    /**
     * User-facing message
     */
    String message;

    boolean retryable;

    public static ServiceError from(StandardError error) {
        return ServiceError.builder()
                .category(error.getCategory())
                .code(error.getCode())
                .message(error.getUserMessage())
                .retryable(error.isRetryable())
                .build();
    }
}
