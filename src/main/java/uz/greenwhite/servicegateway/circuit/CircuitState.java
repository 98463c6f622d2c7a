package uz.greenwhite.servicegateway.circuit;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
