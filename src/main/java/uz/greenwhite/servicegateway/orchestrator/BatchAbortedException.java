package uz.greenwhite.servicegateway.orchestrator;

import lombok.Getter;
import uz.greenwhite.servicegateway.error.StandardError;
import uz.greenwhite.servicegateway.error.StandardErrorException;

import java.util.List;

/**
 * Thrown by a fail-fast batch. Carries the error of the failing operation and
 * the responses that had completed before the abort, in input order.
 */
@Getter
public class BatchAbortedException extends StandardErrorException {

    private final List<ServiceResponse<Object>> completed;

    public BatchAbortedException(StandardError error, List<ServiceResponse<Object>> completed) {
        super(error);
        this.completed = List.copyOf(completed);
    }
}
