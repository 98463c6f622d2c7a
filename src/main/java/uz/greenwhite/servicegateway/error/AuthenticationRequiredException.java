package uz.greenwhite.servicegateway.error;

import lombok.Getter;

@Getter
public class AuthenticationRequiredException extends RuntimeException {

    private final String code;

    public AuthenticationRequiredException(String code, String message) {
        super(message);
        this.code = code;
    }
}
