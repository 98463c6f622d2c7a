package uz.greenwhite.servicegateway.orchestrator;

import java.util.Optional;

/**
 * Last-known-good values of external calls, read when a backend is unavailable.
 */
public interface FallbackCache {

    /**
     * @return the value stored under {@code key} if it has not expired
     */
    Optional<Object> get(String key);

    /**
     * Store with the configured time to live, replacing any previous value.
     */
    void put(String key, Object value);

    int size();

    /**
     * Drop expired values. Stores that expire on their own return 0.
     */
    int sweepExpired();

    void clear();
}
