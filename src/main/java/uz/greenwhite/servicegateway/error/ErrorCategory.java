package uz.greenwhite.servicegateway.error;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.EnumSet;
import java.util.Set;

@Getter
@RequiredArgsConstructor
public enum ErrorCategory {

    CLIENT_ERROR(ErrorSeverity.LOW,
            "The request could not be processed. Please check it and try again."),
    SERVER_ERROR(ErrorSeverity.MEDIUM,
            "An unexpected error occurred. Please try again or contact support if the problem persists."),
    NETWORK_ERROR(ErrorSeverity.MEDIUM,
            "Unable to connect to the service. Please check your internet connection and try again."),
    TIMEOUT_ERROR(ErrorSeverity.MEDIUM,
            "The request took too long to complete. Please try again."),
    VALIDATION_ERROR(ErrorSeverity.LOW,
            "Please check your input and try again."),
    AUTHENTICATION_ERROR(ErrorSeverity.MEDIUM,
            "You are not authorized to perform this action. Please sign in and try again."),
    RATE_LIMIT_ERROR(ErrorSeverity.MEDIUM,
            "Too many requests. Please wait a moment before trying again."),
    EXTERNAL_SERVICE_ERROR(ErrorSeverity.HIGH,
            "A required service is temporarily unavailable. Please try again later."),
    DATABASE_ERROR(ErrorSeverity.HIGH,
            "Unable to save your changes. Please try again."),
    CONFIGURATION_ERROR(ErrorSeverity.CRITICAL,
            "The service is not configured correctly. Please contact support.");

    /**
     * Categories retried by default. Also the category half of the retryable rule.
     */
    public static final Set<ErrorCategory> TRANSIENT = EnumSet.of(
            NETWORK_ERROR, TIMEOUT_ERROR, SERVER_ERROR, EXTERNAL_SERVICE_ERROR);

    private final ErrorSeverity baseSeverity;
    private final String userMessage;

    public boolean isTransient() {
        return TRANSIENT.contains(this);
    }
}
