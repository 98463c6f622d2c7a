package uz.greenwhite.servicegateway.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import uz.greenwhite.servicegateway.error.StandardError;

@Slf4j
@Service
@ConditionalOnProperty(name = "gateway.telegram.enabled", havingValue = "false", matchIfMissing = true)
public class NoOpNotificationService implements NotificationService {

    public NoOpNotificationService() {
        log.info("Telegram notification DISABLED, critical alerts will only be logged");
    }

    @Override
    public void sendCriticalAlert(StandardError error) {
        log.warn("Critical alert (no notification configured): [{}] {} source={}",
                error.getCode(), error.getMessage(), error.getSource());
    }

    @Override
    public boolean isEnabled() {
        return false;
    }
}
