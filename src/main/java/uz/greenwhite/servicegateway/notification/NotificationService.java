package uz.greenwhite.servicegateway.notification;

import uz.greenwhite.servicegateway.error.StandardError;

public interface NotificationService {

    /**
     * Send an alert for a CRITICAL error. Implementations must not throw.
     */
    void sendCriticalAlert(StandardError error);

    /**
     * Is notification service active?
     */
    boolean isEnabled();
}
