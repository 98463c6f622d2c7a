package uz.greenwhite.servicegateway.orchestrator;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Uniform orchestrator result. Built only through the factories, so exactly one
 * of data and error is present.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ServiceResponse<T> {

    boolean success;
    T data;
    ServiceError error;
    ServiceResponseMetadata metadata;

    public static <T> ServiceResponse<T> success(T data, ServiceResponseMetadata metadata) {
        return new ServiceResponse<>(true, data, null, metadata);
    }

    public static <T> ServiceResponse<T> failure(ServiceError error, ServiceResponseMetadata metadata) {
        return new ServiceResponse<>(false, null, error, metadata);
    }
}
