package uz.greenwhite.servicegateway.orchestrator;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Optional;
import java.util.Set;

@Getter
@RequiredArgsConstructor
public enum ServiceName {

    SUPABASE("supabase", true, Set.of("fetchData", "insertData", "updateData", "deleteData")),
    VAPI("vapi", false, Set.of("makeCall", "getCallStatus")),
    TWILIO("twilio", false, Set.of("sendSms", "getSmsStatus")),
    GOOGLE_MAPS("google-maps", false, Set.of("geocode", "distanceMatrix")),

    /**
     * Any operation name is a workflow event
     */
    N8N("n8n", false, Set.of());

    private final String id;

    /**
     * Internal services get retries only: no circuit breaker, no fallback cache
     */
    private final boolean internal;

    private final Set<String> operations;

    public boolean supports(String operation) {
        return this == N8N
                ? operation != null && operation.matches("^[a-zA-Z0-9_-]+$")
                : operations.contains(operation);
    }

    public static Optional<ServiceName> fromId(String id) {
        return Arrays.stream(values())
                .filter(s -> s.id.equals(id))
                .findFirst();
    }
}
