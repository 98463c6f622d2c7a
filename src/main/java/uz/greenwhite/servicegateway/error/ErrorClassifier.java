package uz.greenwhite.servicegateway.error;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import uz.greenwhite.servicegateway.circuit.CircuitBreakerOpenException;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.lang.reflect.UndeclaredThrowableException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.function.IntPredicate;

/**
 * Maps raw throwables onto the error taxonomy. Same input, same category, severity
 * and retryable flag; only id and timestamp differ between calls.
 */
class ErrorClassifier {

    static final String GENERIC_USER_MESSAGE = "Something went wrong. Please try again later.";

    private final IntPredicate retryableStatus;
    private final boolean userFriendlyMessages;
    private final boolean includeStackTrace;
    private final Clock clock;

    ErrorClassifier(IntPredicate retryableStatus, boolean userFriendlyMessages,
                    boolean includeStackTrace, Clock clock) {
        this.retryableStatus = retryableStatus;
        this.userFriendlyMessages = userFriendlyMessages;
        this.includeStackTrace = includeStackTrace;
        this.clock = clock;
    }

    StandardError classify(Throwable raw, ErrorContext context) {
        if (raw instanceof StandardErrorException se) {
            return se.getError();
        }
        Throwable error = unwrap(raw);
        if (error instanceof StandardErrorException se) {
            return se.getError();
        }

        Classification c = classifyTyped(error);
        if (c == null) {
            c = classifyByKeywords(error);
        }

        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        boolean retryable = c.retryable != null
                ? c.retryable
                : c.httpStatus != null ? retryableStatus.test(c.httpStatus) : c.category.isTransient();

        Map<String, Object> details = new LinkedHashMap<>(c.details);
        details.put("exception", error.getClass().getName());
        if (context != null && context.getOperation() != null) {
            details.put("operation", context.getOperation());
        }

        return StandardError.builder()
                .id(UUID.randomUUID().toString())
                .category(c.category)
                .severity(severityOf(c.category, message))
                .code(c.code)
                .message(message)
                .userMessage(userMessageOf(c.category))
                .details(details)
                .timestamp(clock.instant())
                .source(context != null ? context.getSource() : null)
                .correlationId(context != null ? context.getCorrelationId() : null)
                .retryable(retryable)
                .retryAfter(c.retryAfter)
                .httpStatus(c.httpStatus)
                .stack(includeStackTrace ? stackTraceOf(error) : null)
                .build();
    }

    String userMessageOf(ErrorCategory category) {
        return userFriendlyMessages ? category.getUserMessage() : GENERIC_USER_MESSAGE;
    }

    static ErrorSeverity severityOf(ErrorCategory category, String message) {
        if ((category == ErrorCategory.NETWORK_ERROR || category == ErrorCategory.TIMEOUT_ERROR)
                && message != null && message.toLowerCase(Locale.ROOT).contains("critical")) {
            return ErrorSeverity.HIGH;
        }
        return category.getBaseSeverity();
    }

    static ErrorCategory categoryOfStatus(int status) {
        if (status == 401 || status == 403) return ErrorCategory.AUTHENTICATION_ERROR;
        if (status == 429) return ErrorCategory.RATE_LIMIT_ERROR;
        if (status == 422) return ErrorCategory.VALIDATION_ERROR;
        if (status >= 400 && status < 500) return ErrorCategory.CLIENT_ERROR;
        return ErrorCategory.SERVER_ERROR;
    }

    // ==================== Typed exceptions ====================

    private Classification classifyTyped(Throwable error) {
        if (error instanceof GatewayCallException e) {
            return new Classification(e.getCategory(), e.getCode(), e.getHttpStatus(), null,
                    e.isRetryable(), e.getDetails());
        }
        if (error instanceof HttpStatusException e) {
            return ofStatus(e.getStatus());
        }
        if (error instanceof WebClientResponseException e) {
            return ofStatus(e.getStatusCode().value());
        }
        if (error instanceof RestClientResponseException e) {
            return ofStatus(e.getStatusCode().value());
        }
        if (error instanceof CircuitBreakerOpenException e) {
            return new Classification(ErrorCategory.EXTERNAL_SERVICE_ERROR, "CIRCUIT_OPEN", null, null, null,
                    Map.of("circuit", e.getCircuitName(), "nextAttemptTime", e.getNextAttemptTime()));
        }
        if (error instanceof ServiceUnavailableException e) {
            return new Classification(ErrorCategory.EXTERNAL_SERVICE_ERROR, "SERVICE_UNAVAILABLE", null, null, null,
                    Map.of("service", e.getService()));
        }
        if (error instanceof GatewayConfigurationException) {
            return simple(ErrorCategory.CONFIGURATION_ERROR, "CONFIGURATION_INVALID");
        }
        if (error instanceof RequestValidationException e) {
            return new Classification(ErrorCategory.VALIDATION_ERROR, "VALIDATION_FAILED", null, null, null,
                    Map.of("violations", e.getViolations()));
        }
        if (error instanceof ConstraintViolationException e) {
            List<String> violations = e.getConstraintViolations().stream()
                    .map(ErrorClassifier::describe)
                    .sorted()
                    .toList();
            return new Classification(ErrorCategory.VALIDATION_ERROR, "VALIDATION_FAILED", null, null, null,
                    Map.of("violations", violations));
        }
        if (error instanceof AuthenticationRequiredException e) {
            return simple(ErrorCategory.AUTHENTICATION_ERROR, e.getCode());
        }
        if (error instanceof RateLimitExceededException e) {
            return new Classification(ErrorCategory.RATE_LIMIT_ERROR, "RATE_LIMIT_EXCEEDED", 429,
                    e.getRetryAfterSeconds(), null,
                    Map.of("limit", e.getLimit(), "resetTime", e.getResetTime()));
        }
        if (error instanceof TimeoutException || error instanceof SocketTimeoutException) {
            return simple(ErrorCategory.TIMEOUT_ERROR, "TIMEOUT");
        }
        if (error instanceof ConnectException || error instanceof UnknownHostException) {
            return simple(ErrorCategory.NETWORK_ERROR, "NETWORK_UNREACHABLE");
        }
        return null;
    }

    private static Classification ofStatus(int status) {
        return new Classification(categoryOfStatus(status), "HTTP_" + status, status, null, null,
                Map.of("status", status));
    }

    private static Classification simple(ErrorCategory category, String code) {
        return new Classification(category, code, null, null, null, Map.of());
    }

    private static String describe(ConstraintViolation<?> violation) {
        return violation.getPropertyPath() + ": " + violation.getMessage();
    }

    // ==================== Keyword fallback ====================

    private static final List<Map.Entry<ErrorCategory, Set<String>>> KEYWORDS = List.of(
            Map.entry(ErrorCategory.TIMEOUT_ERROR, Set.of("timeout", "timed out")),
            Map.entry(ErrorCategory.NETWORK_ERROR, Set.of("network", "fetch", "connection")),
            Map.entry(ErrorCategory.AUTHENTICATION_ERROR, Set.of("unauthorized", "forbidden", "authentication", "token")),
            Map.entry(ErrorCategory.RATE_LIMIT_ERROR, Set.of("rate limit", "too many requests")),
            Map.entry(ErrorCategory.VALIDATION_ERROR, Set.of("validation", "invalid", "required")),
            Map.entry(ErrorCategory.DATABASE_ERROR, Set.of("database", "sql"))
    );

    private static Classification classifyByKeywords(Throwable error) {
        String text = (error.getClass().getSimpleName() + " "
                + (error.getMessage() != null ? error.getMessage() : "")).toLowerCase(Locale.ROOT);

        for (Map.Entry<ErrorCategory, Set<String>> entry : KEYWORDS) {
            if (entry.getValue().stream().anyMatch(text::contains)) {
                return simple(entry.getKey(), error.getClass().getSimpleName());
            }
        }
        return simple(ErrorCategory.SERVER_ERROR, error.getClass().getSimpleName());
    }

    // ==================== Helpers ====================

    private static Throwable unwrap(Throwable raw) {
        Throwable current = raw;
        while ((current instanceof CompletionException
                || current instanceof ExecutionException
                || current instanceof UndeclaredThrowableException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String stackTraceOf(Throwable error) {
        StringWriter writer = new StringWriter();
        error.printStackTrace(new PrintWriter(writer));
        return writer.toString();
    }

    private record Classification(ErrorCategory category, String code, Integer httpStatus,
                                  Long retryAfter, Boolean retryable, Map<String, Object> details) {
    }
}
