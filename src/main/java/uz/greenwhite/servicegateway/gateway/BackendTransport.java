package uz.greenwhite.servicegateway.gateway;

/**
 * Performs the HTTP exchange behind {@link ApiGateway}. Implementations throw on
 * non-2xx answers, timeouts and connection failures; the gateway classifies them.
 */
public interface BackendTransport {

    /**
     * @return the decoded JSON body (maps, lists, scalars), or null when empty
     */
    Object exchange(BackendCall call) throws Exception;
}
