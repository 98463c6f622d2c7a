package uz.greenwhite.servicegateway.gateway;

import java.util.List;

/**
 * Outcome of {@link RequestValidator#validate}. {@code sanitizedData} is what gets sent.
 */
public record ValidationResult(boolean valid, List<String> errors, Object sanitizedData) {

    public static ValidationResult valid(Object sanitizedData) {
        return new ValidationResult(true, List.of(), sanitizedData);
    }

    public static ValidationResult invalid(List<String> errors) {
        return new ValidationResult(false, List.copyOf(errors), null);
    }
}
