package uz.greenwhite.servicegateway.error;

/**
 * Invalid or missing configuration. Classified as {@link ErrorCategory#CONFIGURATION_ERROR}
 * and, when thrown from a properties {@code validate()}, halts context start-up.
 */
public class GatewayConfigurationException extends RuntimeException {

    public GatewayConfigurationException(String message) {
        super(message);
    }

    public GatewayConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
