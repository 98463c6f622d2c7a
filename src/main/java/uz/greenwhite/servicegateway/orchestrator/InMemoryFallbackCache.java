package uz.greenwhite.servicegateway.orchestrator;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import uz.greenwhite.servicegateway.config.CacheProperties;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Component
@ConditionalOnProperty(name = "gateway.cache.store", havingValue = "memory", matchIfMissing = true)
public class InMemoryFallbackCache implements FallbackCache {

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final long ttlMs;
    private final Clock clock;

    public InMemoryFallbackCache(CacheProperties properties, Clock clock) {
        this.ttlMs = properties.getTtlMs();
        this.clock = clock;
    }

    @Override
    public Optional<Object> get(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (clock.millis() >= entry.expiresAt()) {
            entries.remove(key, entry);
            log.debug("Fallback cache entry expired: {}", key);
            return Optional.empty();
        }
        return Optional.ofNullable(entry.value());
    }

    @Override
    public void put(String key, Object value) {
        entries.put(key, new Entry(value, clock.millis() + ttlMs));
    }

    @Override
    public int size() {
        return entries.size();
    }

    @Override
    public int sweepExpired() {
        long now = clock.millis();
        int before = entries.size();
        entries.values().removeIf(e -> now >= e.expiresAt());
        return before - entries.size();
    }

    @Override
    public void clear() {
        entries.clear();
    }

    private record Entry(Object value, long expiresAt) {
    }
}
