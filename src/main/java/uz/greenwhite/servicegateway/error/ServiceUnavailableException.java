package uz.greenwhite.servicegateway.error;

import lombok.Getter;

@Getter
public class ServiceUnavailableException extends RuntimeException {

    private final String service;

    public ServiceUnavailableException(String service, String message) {
        super(message);
        this.service = service;
    }
}
