package uz.greenwhite.servicegateway.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import uz.greenwhite.servicegateway.error.GatewayConfigurationException;

@Data
@Configuration
@ConfigurationProperties(prefix = "gateway.telegram")
public class TelegramProperties {

    private boolean enabled = false;
    private String botToken;
    private Long chatId;
    private Integer messageThreadId;
    private int connectTimeoutMs = 5000;
    private int readTimeoutMs = 5000;

    @PostConstruct
    public void validate() {
        if (enabled && (botToken == null || botToken.isBlank() || chatId == null)) {
            throw new GatewayConfigurationException(
                    "gateway.telegram.bot-token and chat-id are required when gateway.telegram.enabled=true");
        }
    }
}
