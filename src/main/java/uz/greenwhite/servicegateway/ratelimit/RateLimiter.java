package uz.greenwhite.servicegateway.ratelimit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uz.greenwhite.servicegateway.config.RateLimitProperties;

import java.time.Clock;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Admits or denies requests per {@code client:endpoint} key.
 * A request passes only if both the token bucket (burst) and the fixed window (sustained) allow it.
 * Never blocks: a denial is returned to the caller, which rejects or queues.
 */
@Slf4j
@Component
public class RateLimiter {

    private final RateLimitProperties properties;
    private final Clock clock;
    private final Map<String, RateLimitEntry> store = new ConcurrentHashMap<>();

    public RateLimiter(RateLimitProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public boolean isAllowed(String clientKey, String endpoint) {
        if (!properties.isEnabled()) {
            return true;
        }

        String key = key(clientKey, endpoint);
        long now = clock.millis();
        RateLimitEntry entry = store.computeIfAbsent(key, k -> newEntry(now));

        RateLimitEntry.Decision decision = entry.tryAcquire(now);
        switch (decision) {
            case DENIED_BURST -> log.warn("Rate limit exceeded (burst protection): client={}, endpoint={}",
                    clientKey, endpoint);
            case DENIED_WINDOW -> log.warn("Rate limit exceeded (window limit): client={}, endpoint={}, limit={}, window={}ms",
                    clientKey, endpoint, properties.getMaxRequests(), properties.getWindowMs());
            case ALLOWED -> log.debug("Rate limit check passed: client={}, endpoint={}", clientKey, endpoint);
        }
        return decision.isAllowed();
    }

    /**
     * Read-only view. Refills the bucket to report a fresh token count but never consumes.
     */
    public RateLimitStatus getStatus(String clientKey, String endpoint) {
        long now = clock.millis();
        RateLimitEntry entry = store.get(key(clientKey, endpoint));

        if (entry == null) {
            return RateLimitStatus.builder()
                    .allowed(true)
                    .count(0)
                    .limit(properties.getMaxRequests())
                    .resetTime(now + properties.getWindowMs())
                    .tokens(properties.getMaxRequests())
                    .build();
        }
        return entry.snapshot(now);
    }

    public void reset(String clientKey, String endpoint) {
        store.remove(key(clientKey, endpoint));
        log.info("Rate limit reset for endpoint: client={}, endpoint={}", clientKey, endpoint);
    }

    public void reset(String clientKey) {
        String prefix = clientKey + ":";
        int before = store.size();
        store.keySet().removeIf(key -> key.startsWith(prefix));
        log.info("Rate limits reset for client: {} (removed {})", clientKey, before - store.size());
    }

    /**
     * Drop entries whose window has ended. Called by the maintenance task.
     */
    public int sweepExpired() {
        long now = clock.millis();
        int before = store.size();
        store.entrySet().removeIf(e -> e.getValue().isExpired(now));
        int cleaned = before - store.size();
        if (cleaned > 0) {
            log.debug("Rate limiter cleanup completed: removed {}", cleaned);
        }
        return cleaned;
    }

    public RateLimiterStats getStats() {
        Map<String, Long> endpointCounts = new HashMap<>();
        Set<String> clients = new HashSet<>();

        store.forEach((key, entry) -> {
            int separator = key.indexOf(":/");
            String client = separator >= 0 ? key.substring(0, separator) : key;
            String endpoint = separator >= 0 ? key.substring(separator + 1) : "";
            clients.add(client);
            endpointCounts.merge(endpoint, (long) entry.currentCount(), Long::sum);
        });

        List<RateLimiterStats.EndpointUsage> top = endpointCounts.entrySet().stream()
                .map(e -> new RateLimiterStats.EndpointUsage(e.getKey(), e.getValue()))
                .sorted(Comparator.comparingLong(RateLimiterStats.EndpointUsage::requests).reversed())
                .limit(10)
                .toList();

        return new RateLimiterStats(store.size(), clients.size(), top);
    }

    public boolean isEnabled() {
        return properties.isEnabled();
    }

    public int getLimit() {
        return properties.getMaxRequests();
    }

    public void clear() {
        store.clear();
    }

    private RateLimitEntry newEntry(long now) {
        return new RateLimitEntry(properties.getMaxRequests(), properties.getWindowMs(), now);
    }

    private static String key(String clientKey, String endpoint) {
        return clientKey + ":" + endpoint;
    }
}
