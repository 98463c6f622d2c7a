package uz.greenwhite.servicegateway.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Runs structure, sanitization, size and security checks over a gateway request.
 * All errors are collected; a request is valid only when the list is empty.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RequestValidator {

    static final long MAX_REQUEST_BYTES = 10L * 1024 * 1024;
    static final long MAX_DATA_BYTES = 5L * 1024 * 1024;
    static final long MAX_TIMEOUT_MS = 300_000;
    static final int MAX_RETRIES = 5;

    private static final Set<String> ALLOWED_METHODS = Set.of("GET", "POST", "PUT", "DELETE", "PATCH");

    private static final Pattern ENDPOINT = Pattern.compile("^/[a-zA-Z0-9/_-]*$");

    private static final List<Pattern> DANGEROUS_PATTERNS = List.of(
            Pattern.compile("<script\\b[^<]*(?:(?!</script>)<[^<]*)*</script>", Pattern.CASE_INSENSITIVE),
            Pattern.compile("javascript:", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bon\\w+\\s*=", Pattern.CASE_INSENSITIVE),
            Pattern.compile("expression\\s*\\(", Pattern.CASE_INSENSITIVE),
            Pattern.compile("eval\\s*\\(", Pattern.CASE_INSENSITIVE),
            Pattern.compile("setTimeout\\s*\\(", Pattern.CASE_INSENSITIVE),
            Pattern.compile("setInterval\\s*\\(", Pattern.CASE_INSENSITIVE)
    );

    // NUL and control characters except \t \n \r
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");

    private final ObjectMapper objectMapper;

    public ValidationResult validate(GatewayRequest request) {
        List<String> errors = new ArrayList<>();

        if (request == null) {
            return ValidationResult.invalid(List.of("structure: request is null"));
        }

        validateStructure(request, errors);

        Object sanitized;
        try {
            sanitized = sanitize(toPlainData(request.getData()));
        } catch (IllegalArgumentException | JsonProcessingException e) {
            log.warn("Request data is not serializable: {}", e.getMessage());
            errors.add("sanitization: request data is not serializable");
            return ValidationResult.invalid(errors);
        }

        validateSize(request, sanitized, errors);
        validateSecurity(request, sanitized, errors);

        return errors.isEmpty() ? ValidationResult.valid(sanitized) : ValidationResult.invalid(errors);
    }

    // ==================== Structure ====================

    private void validateStructure(GatewayRequest request, List<String> errors) {
        String method = request.getMethod();
        if (method == null || method.isBlank()) {
            errors.add("structure: method is required");
        } else if (!ALLOWED_METHODS.contains(method.toUpperCase())) {
            errors.add("structure: invalid HTTP method " + method);
        }

        String endpoint = request.getEndpoint();
        if (endpoint == null || endpoint.isEmpty()) {
            errors.add("structure: endpoint is required");
        } else if (!ENDPOINT.matcher(endpoint).matches()) {
            errors.add("structure: invalid endpoint format");
        }

        Long timeout = request.getTimeoutMs();
        if (timeout != null && (timeout <= 0 || timeout > MAX_TIMEOUT_MS)) {
            errors.add("structure: timeout must be in (0, " + MAX_TIMEOUT_MS + "] ms");
        }

        Integer retries = request.getRetries();
        if (retries != null && (retries < 0 || retries > MAX_RETRIES)) {
            errors.add("structure: retries must be in [0, " + MAX_RETRIES + "]");
        }

        if (request.getHeaders() != null) {
            request.getHeaders().forEach((name, value) -> {
                if (value == null) {
                    errors.add("structure: header " + name + " has no value");
                }
            });
        }
    }

    // ==================== Sanitization ====================

    /**
     * POJOs become maps and lists so that every string is reachable.
     */
    private Object toPlainData(Object data) throws JsonProcessingException {
        if (data == null) {
            return null;
        }
        return objectMapper.treeToValue(objectMapper.valueToTree(data), Object.class);
    }

    Object sanitize(Object value) {
        if (value instanceof String s) {
            return sanitizeString(s);
        }
        if (value instanceof List<?> list) {
            List<Object> result = new ArrayList<>(list.size());
            for (Object item : list) {
                result.add(sanitize(item));
            }
            return result;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> result = new LinkedHashMap<>();
            map.forEach((k, v) -> result.put(sanitizeString(String.valueOf(k)), sanitize(v)));
            return result;
        }
        return value;
    }

    private static String sanitizeString(String value) {
        return CONTROL_CHARS.matcher(value).replaceAll("").trim();
    }

    // ==================== Size ====================

    private void validateSize(GatewayRequest request, Object data, List<String> errors) {
        try {
            Map<String, Object> envelope = new LinkedHashMap<>();
            envelope.put("method", request.getMethod());
            envelope.put("endpoint", request.getEndpoint());
            envelope.put("headers", request.getHeaders());
            envelope.put("data", data);

            long requestBytes = objectMapper.writeValueAsBytes(envelope).length;
            if (requestBytes > MAX_REQUEST_BYTES) {
                errors.add("size: request size " + requestBytes + " exceeds limit of " + MAX_REQUEST_BYTES + " bytes");
            }

            if (data != null) {
                long dataBytes = objectMapper.writeValueAsBytes(data).length;
                if (dataBytes > MAX_DATA_BYTES) {
                    errors.add("size: data payload size " + dataBytes + " exceeds limit of " + MAX_DATA_BYTES + " bytes");
                }
            }
        } catch (JsonProcessingException e) {
            log.warn("Size calculation failed: {}", e.getMessage());
            errors.add("size: unable to calculate request size");
        }
    }

    // ==================== Security ====================

    private void validateSecurity(GatewayRequest request, Object data, List<String> errors) {
        scanForPatterns(data, "data", errors);

        String endpoint = request.getEndpoint();
        if (endpoint != null && (endpoint.contains("..") || endpoint.contains("~"))) {
            errors.add("security: path traversal attempt detected in endpoint");
        }

        if (request.getHeaders() != null) {
            request.getHeaders().forEach((name, value) -> {
                if (value != null && (value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0)) {
                    errors.add("security: header injection attempt detected in " + name);
                }
            });
        }
    }

    private void scanForPatterns(Object value, String path, List<String> errors) {
        if (value instanceof String s) {
            if (DANGEROUS_PATTERNS.stream().anyMatch(p -> p.matcher(s).find())) {
                errors.add("security: potentially dangerous content detected at " + path);
            }
        } else if (value instanceof List<?> list) {
            for (int i = 0; i < list.size(); i++) {
                scanForPatterns(list.get(i), path + "[" + i + "]", errors);
            }
        } else if (value instanceof Map<?, ?> map) {
            map.forEach((k, v) -> scanForPatterns(v, path + "." + k, errors));
        }
    }
}
