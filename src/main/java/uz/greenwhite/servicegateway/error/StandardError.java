package uz.greenwhite.servicegateway.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * The only error vocabulary above the raw-exception boundary.
 * Created once per raw failure by {@link ErrorHandler}, then passed by value.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StandardError {

    String id;
    ErrorCategory category;
    ErrorSeverity severity;
    String code;

    /**
     * Internal message, for logs only
     */
    String message;

    /**
     * Templated per category, safe to show to callers
     */
    String userMessage;

    @Singular("detail")
    Map<String, Object> details;

    Instant timestamp;
    String source;
    String correlationId;
    boolean retryable;

    /**
     * Seconds the caller should wait, when known
     */
    Long retryAfter;

    /**
     * Upstream HTTP status, when the failure came from an HTTP exchange
     */
    Integer httpStatus;

    /**
     * Populated only when stack traces are enabled
     */
    String stack;
}
