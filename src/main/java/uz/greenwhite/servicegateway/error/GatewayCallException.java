package uz.greenwhite.servicegateway.error;

import lombok.Getter;

import java.util.Map;

/**
 * A failure the gateway pipeline has already classified, rethrown by callers
 * that unwrap a failed gateway response.
 */
@Getter
public class GatewayCallException extends RuntimeException {

    private final ErrorCategory category;
    private final String code;
    private final boolean retryable;
    private final Integer httpStatus;
    private final Map<String, Object> details;

    public GatewayCallException(ErrorCategory category, String code, String message,
                                boolean retryable, Integer httpStatus, Map<String, Object> details) {
        super(message);
        this.category = category;
        this.code = code;
        this.retryable = retryable;
        this.httpStatus = httpStatus;
        this.details = details == null ? Map.of() : details;
    }
}
