package uz.greenwhite.servicegateway.error;

import lombok.Getter;

/**
 * Non-2xx answer from a backend that is not already a Spring client exception.
 */
@Getter
public class HttpStatusException extends RuntimeException {

    private final int status;
    private final String responseBody;

    public HttpStatusException(int status, String responseBody) {
        super("HTTP " + status);
        this.status = status;
        this.responseBody = responseBody;
    }
}
