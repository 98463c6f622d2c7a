package uz.greenwhite.servicegateway.gateway;

import java.time.Duration;
import java.util.Map;

/**
 * One attempt of a gateway request, as handed to the {@link BackendTransport}.
 *
 * @param attempt zero-based, sent as X-Retry-Attempt
 */
public record BackendCall(String method,
                          String endpoint,
                          Object body,
                          Map<String, String> headers,
                          String requestId,
                          int attempt,
                          Duration timeout) {
}
