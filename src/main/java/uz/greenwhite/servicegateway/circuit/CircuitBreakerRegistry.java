package uz.greenwhite.servicegateway.circuit;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One circuit breaker per key, created lazily with the registry's default config.
 * Each owner (gateway per endpoint, error handler per operation) holds its own registry.
 */
@Slf4j
public class CircuitBreakerRegistry {

    @Getter
    private final String scope;
    @Getter
    private final CircuitBreakerConfig defaultConfig;
    private final Clock clock;
    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();

    public CircuitBreakerRegistry(String scope, CircuitBreakerConfig defaultConfig, Clock clock) {
        this.scope = scope;
        this.defaultConfig = defaultConfig;
        this.clock = clock;
    }

    public CircuitBreaker circuitBreaker(String key) {
        return breakers.computeIfAbsent(key, k -> {
            log.debug("Circuit breaker created: scope={}, key={}", scope, k);
            return new CircuitBreaker(k, defaultConfig, clock);
        });
    }

    public Optional<CircuitBreaker> find(String key) {
        return Optional.ofNullable(breakers.get(key));
    }

    public Collection<CircuitBreaker> getAll() {
        return Collections.unmodifiableCollection(breakers.values());
    }

    public List<CircuitBreakerMetrics> getAllMetrics() {
        return breakers.values().stream()
                .map(CircuitBreaker::getMetrics)
                .sorted(Comparator.comparing(CircuitBreakerMetrics::getName))
                .toList();
    }

    public boolean reset(String key) {
        CircuitBreaker breaker = breakers.get(key);
        if (breaker == null) {
            return false;
        }
        breaker.reset();
        return true;
    }

    public void resetAll() {
        breakers.values().forEach(CircuitBreaker::reset);
    }

    /**
     * Drops breakers that are CLOSED with an empty monitoring window.
     *
     * @return number of breakers removed
     */
    public int evictIdle() {
        int before = breakers.size();
        breakers.values().removeIf(CircuitBreaker::isIdle);
        int removed = before - breakers.size();
        if (removed > 0) {
            log.debug("Circuit breakers evicted: scope={}, count={}", scope, removed);
        }
        return removed;
    }
}
