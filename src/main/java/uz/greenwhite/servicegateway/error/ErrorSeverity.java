package uz.greenwhite.servicegateway.error;

public enum ErrorSeverity {
    LOW,       // minor, request continues normally
    MEDIUM,    // significant but recoverable
    HIGH,      // functionality affected
    CRITICAL   // system-threatening, triggers an alert
}
