package uz.greenwhite.servicegateway.gateway;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uz.greenwhite.servicegateway.config.GatewayProperties;
import uz.greenwhite.servicegateway.error.AuthenticationRequiredException;

import java.util.Set;

/**
 * CSRF gate for state-changing requests. Only presence of the token is checked;
 * verifying its value belongs to the session layer in front of the gateway.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RequestAuthenticator {

    public static final String CSRF_HEADER = "X-CSRF-Token";

    private static final Set<String> MUTATING_METHODS = Set.of("POST", "PUT", "DELETE", "PATCH");

    private final GatewayProperties properties;

    /**
     * @throws AuthenticationRequiredException when a mutating request has no CSRF token
     */
    public void authenticate(GatewayRequest request, String requestId) {
        if (request.isSkipAuth() || !properties.getAuth().isRequired()) {
            return;
        }
        if (properties.getAuth().getSkipRoutes().contains(request.getEndpoint())) {
            return;
        }

        if (MUTATING_METHODS.contains(request.getMethod().toUpperCase())) {
            boolean hasToken = request.header(CSRF_HEADER)
                    .filter(token -> !token.isBlank())
                    .isPresent();
            if (!hasToken) {
                log.warn("Missing CSRF token: requestId={}, endpoint={}", requestId, request.getEndpoint());
                throw new AuthenticationRequiredException("CSRF_TOKEN_REQUIRED", "CSRF token required");
            }
        }

        log.debug("Request authenticated: requestId={}, endpoint={}", requestId, request.getEndpoint());
    }
}
