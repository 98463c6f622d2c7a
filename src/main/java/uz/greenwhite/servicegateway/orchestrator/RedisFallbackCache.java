package uz.greenwhite.servicegateway.orchestrator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;
import uz.greenwhite.servicegateway.config.CacheProperties;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

/**
 * Fallback values as JSON strings in Redis. Expiry is left to Redis itself,
 * so values survive a restart and are shared between instances.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "gateway.cache.store", havingValue = "redis")
public class RedisFallbackCache implements FallbackCache {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final String keyPrefix;
    private final Duration ttl;

    public RedisFallbackCache(StringRedisTemplate redisTemplate, ObjectMapper objectMapper, CacheProperties properties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.keyPrefix = properties.getKeyPrefix();
        this.ttl = Duration.ofMillis(properties.getTtlMs());
        log.info("Fallback cache store: redis, prefix={}, ttl={}", keyPrefix, ttl);
    }

    @Override
    public Optional<Object> get(String key) {
        try {
            String json = redisTemplate.opsForValue().get(keyPrefix + key);
            if (json == null) {
                return Optional.empty();
            }
            return Optional.ofNullable(objectMapper.readValue(json, Object.class));
        } catch (JsonProcessingException e) {
            log.warn("Failed to read fallback value from Redis: {} - {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void put(String key, Object value) {
        try {
            redisTemplate.opsForValue().set(keyPrefix + key, objectMapper.writeValueAsString(value), ttl);
        } catch (JsonProcessingException e) {
            log.error("Failed to save fallback value to Redis: {} - {}", key, e.getMessage());
        }
    }

    @Override
    public int size() {
        Set<String> keys = redisTemplate.keys(keyPrefix + "*");
        return keys != null ? keys.size() : 0;
    }

    @Override
    public int sweepExpired() {
        return 0;
    }

    @Override
    public void clear() {
        Set<String> keys = redisTemplate.keys(keyPrefix + "*");
        if (keys != null && !keys.isEmpty()) {
            redisTemplate.delete(keys);
        }
    }
}
