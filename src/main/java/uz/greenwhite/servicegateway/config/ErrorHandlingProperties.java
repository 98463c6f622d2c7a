package uz.greenwhite.servicegateway.config;

import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import uz.greenwhite.servicegateway.error.GatewayConfigurationException;

@Slf4j
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "gateway.errors")
public class ErrorHandlingProperties {

    /**
     * Attach stack traces to standardized errors. Development only.
     */
    private boolean includeStackTrace = false;

    /**
     * Per-category user messages. When false a single generic message is used.
     */
    private boolean userFriendlyMessages = true;

    /**
     * Occurrences of one source:code per hour before a pattern warning is logged
     */
    private int patternThreshold = 10;

    /**
     * Send outbound alerts for CRITICAL errors
     */
    private boolean criticalNotifications = true;

    @PostConstruct
    public void validate() {
        if (patternThreshold <= 0) {
            throw new GatewayConfigurationException("gateway.errors.pattern-threshold must be > 0");
        }
        if (includeStackTrace) {
            log.warn("Stack traces will be attached to error responses (gateway.errors.include-stack-trace=true)");
        }
    }
}
