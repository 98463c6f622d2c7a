package uz.greenwhite.servicegateway.gateway;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uz.greenwhite.servicegateway.config.GatewayProperties;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

/**
 * Shapes backend response bodies: caller transform, sensitive-field masking and,
 * when enabled, timestamp and field-name normalization. Works on plain JSON trees
 * (maps, lists, scalars).
 */
@Slf4j
@Component
public class ResponseTransformer {

    static final String MASK = "***";

    private static final List<String> SENSITIVE_FIELDS = List.of(
            "password", "token", "secret", "key", "authorization",
            "ssn", "social_security", "credit_card", "bank_account");

    private static final List<String> TIMESTAMP_FIELDS = List.of(
            "created_at", "updated_at", "timestamp", "date", "time");

    private static final Map<String, String> FIELD_MAPPINGS = Map.ofEntries(
            Map.entry("ID", "id"),
            Map.entry("userId", "user_id"),
            Map.entry("callId", "call_id"),
            Map.entry("phoneNumber", "phone_number"),
            Map.entry("createdAt", "created_at"),
            Map.entry("updatedAt", "updated_at"),
            Map.entry("startedAt", "started_at"),
            Map.entry("endedAt", "ended_at"));

    private static final Pattern EPOCH = Pattern.compile("^\\d{10,13}$");
    private static final Pattern UPPER = Pattern.compile("([A-Z])");

    private final GatewayProperties properties;

    public ResponseTransformer(GatewayProperties properties) {
        this.properties = properties;
    }

    /**
     * Never fails: if any step throws, the untransformed data is returned.
     */
    public Object transform(Object data, UnaryOperator<Object> customTransform) {
        try {
            Object transformed = data;
            if (customTransform != null) {
                transformed = customTransform.apply(transformed);
            }
            transformed = mask(transformed);
            if (properties.getTransform().isNormalize()) {
                transformed = normalize(transformed);
            }
            return transformed;
        } catch (RuntimeException e) {
            log.error("Response transformation failed, returning original data: {}", e.getMessage());
            return data;
        }
    }

    // ==================== Masking ====================

    Object mask(Object data) {
        if (data instanceof List<?> list) {
            List<Object> result = new ArrayList<>(list.size());
            list.forEach(item -> result.add(mask(item)));
            return result;
        }
        if (data instanceof Map<?, ?> map) {
            Map<String, Object> result = new LinkedHashMap<>();
            map.forEach((k, v) -> {
                String key = String.valueOf(k);
                result.put(key, isSensitive(key) ? maskValue(v) : mask(v));
            });
            return result;
        }
        return data;
    }

    private static boolean isSensitive(String key) {
        String lower = key.toLowerCase(Locale.ROOT);
        return SENSITIVE_FIELDS.stream().anyMatch(lower::contains);
    }

    private static Object maskValue(Object value) {
        if (value instanceof String s && s.length() > 6) {
            return s.substring(0, 2) + MASK + s.substring(s.length() - 2);
        }
        return MASK;
    }

    // ==================== Normalization ====================

    Object normalize(Object data) {
        if (data instanceof List<?> list) {
            List<Object> result = new ArrayList<>(list.size());
            list.forEach(item -> result.add(normalize(item)));
            return result;
        }
        if (data instanceof Map<?, ?> map) {
            Map<String, Object> result = new LinkedHashMap<>();
            map.forEach((k, v) -> {
                String key = String.valueOf(k);
                Object value = v instanceof String s && isTimestampField(key)
                        ? toIsoTimestamp(s)
                        : normalize(v);
                result.put(standardName(key), value);
            });
            return result;
        }
        return data;
    }

    private static boolean isTimestampField(String key) {
        String lower = key.toLowerCase(Locale.ROOT);
        return TIMESTAMP_FIELDS.stream().anyMatch(lower::contains);
    }

    /**
     * ISO-8601 UTC, or the input unchanged when it does not parse.
     */
    static String toIsoTimestamp(String value) {
        if (EPOCH.matcher(value).matches()) {
            long epoch = Long.parseLong(value);
            return (value.length() <= 10 ? Instant.ofEpochSecond(epoch) : Instant.ofEpochMilli(epoch)).toString();
        }
        try {
            return OffsetDateTime.parse(value).toInstant().toString();
        } catch (DateTimeParseException ignored) {
            // not an offset date-time, try the local forms
        }
        try {
            return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC).toString();
        } catch (DateTimeParseException ignored) {
            // not a local date-time
        }
        try {
            return LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant().toString();
        } catch (DateTimeParseException e) {
            return value;
        }
    }

    static String standardName(String key) {
        String mapped = FIELD_MAPPINGS.get(key);
        if (mapped != null) {
            return mapped;
        }
        return UPPER.matcher(key).replaceAll("_$1").toLowerCase(Locale.ROOT);
    }
}
