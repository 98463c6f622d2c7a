package uz.greenwhite.servicegateway.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;
import uz.greenwhite.servicegateway.config.TelegramProperties;
import uz.greenwhite.servicegateway.error.StandardError;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.Map;

@Slf4j
@Service
@ConditionalOnProperty(name = "gateway.telegram.enabled", havingValue = "true")
public class TelegramNotificationService implements NotificationService {

    private static final String TELEGRAM_API = "https://api.telegram.org/bot%s/sendMessage";
    private static final DateTimeFormatter FORMATTER =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);

    private final TelegramProperties properties;
    private final RestTemplate restTemplate;

    public TelegramNotificationService(TelegramProperties properties) {
        this.properties = properties;
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(properties.getConnectTimeoutMs());
        factory.setReadTimeout(properties.getReadTimeoutMs());
        this.restTemplate = new RestTemplate(factory);
        log.info("Telegram notification ENABLED: chatId={}", properties.getChatId());
    }

    @Override
    public void sendCriticalAlert(StandardError error) {
        try {
            sendMessage(formatMessage(error));
            log.info("Critical alert sent to Telegram: {}", error.getId());
        } catch (Exception e) {
            log.error("Failed to send critical alert to Telegram: {} - {}", error.getId(), e.getMessage());
        }
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    String formatMessage(StandardError error) {
        StringBuilder sb = new StringBuilder();
        sb.append("🔴 <b>CRITICAL ERROR</b>\n\n");
        sb.append("━━━━━━━━━━━━━━━━━━━━━\n");
        sb.append("📌 <b>Code:</b> ").append(escapeHtml(error.getCode()));
        sb.append(" | <b>Category:</b> ").append(error.getCategory()).append("\n");

        if (error.getSource() != null) {
            sb.append("🧩 <b>Source:</b> <code>").append(escapeHtml(error.getSource())).append("</code>\n");
        }

        sb.append("❌ <b>Message:</b> ");
        sb.append(escapeHtml(truncate(error.getMessage(), 200))).append("\n");

        if (error.getCorrelationId() != null) {
            sb.append("🔗 <b>Correlation:</b> <code>").append(escapeHtml(error.getCorrelationId())).append("</code>\n");
        }
        if (error.getTimestamp() != null) {
            sb.append("🕐 <b>Time:</b> ").append(FORMATTER.format(error.getTimestamp())).append("\n");
        }

        sb.append("━━━━━━━━━━━━━━━━━━━━━");
        return sb.toString();
    }

    private void sendMessage(String text) {
        String url = String.format(TELEGRAM_API, properties.getBotToken());

        Map<String, Object> body = new HashMap<>();
        body.put("chat_id", properties.getChatId());
        body.put("text", text);
        body.put("parse_mode", "HTML");

        if (properties.getMessageThreadId() != null) {
            body.put("message_thread_id", properties.getMessageThreadId());
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        restTemplate.postForEntity(url, new HttpEntity<>(body, headers), String.class);
    }

    private String escapeHtml(String text) {
        if (text == null) return "";
        return text.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;");
    }

    private String truncate(String text, int maxLength) {
        if (text == null) return "";
        if (text.length() <= maxLength) return text;
        return text.substring(0, maxLength) + "...";
    }
}
