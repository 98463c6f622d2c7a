package uz.greenwhite.servicegateway.error;

import lombok.Getter;

import java.util.List;

@Getter
public class RequestValidationException extends RuntimeException {

    private final List<String> violations;

    public RequestValidationException(List<String> violations) {
        super("Validation failed: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }
}
