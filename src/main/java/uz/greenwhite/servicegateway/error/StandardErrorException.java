package uz.greenwhite.servicegateway.error;

import lombok.Getter;

/**
 * Carries an already standardized error across call boundaries.
 * {@link ErrorHandler#standardize} passes it through unchanged.
 */
@Getter
public class StandardErrorException extends RuntimeException {

    private final StandardError error;

    public StandardErrorException(StandardError error) {
        super(error.getCode() + ": " + error.getMessage());
        this.error = error;
    }

    public StandardErrorException(StandardError error, Throwable cause) {
        super(error.getCode() + ": " + error.getMessage(), cause);
        this.error = error;
    }
}
