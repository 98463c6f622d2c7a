package uz.greenwhite.servicegateway.orchestrator;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import uz.greenwhite.servicegateway.config.CacheProperties;

import java.time.Duration;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisFallbackCacheTest {

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private RedisFallbackCache cache;

    @BeforeEach
    void setUp() {
        cache = new RedisFallbackCache(redisTemplate, new ObjectMapper(), new CacheProperties());
    }

    @Test
    @DisplayName("values are stored as JSON under the prefix with the configured lifetime")
    void put() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);

        cache.put("n8n:lead_created:{}", Map.of("accepted", true));

        verify(valueOperations).set("gateway:fallback:n8n:lead_created:{}", "{\"accepted\":true}",
                Duration.ofMinutes(5));
    }

    @Test
    @DisplayName("stored JSON is read back as plain maps")
    void get() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("gateway:fallback:k")).thenReturn("{\"lat\":41.3}");

        assertThat(cache.get("k")).contains(Map.of("lat", 41.3));
    }

    @Test
    @DisplayName("a missing or unreadable value is a cache miss")
    void miss() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("gateway:fallback:gone")).thenReturn(null);
        when(valueOperations.get("gateway:fallback:broken")).thenReturn("{not json");

        assertThat(cache.get("gone")).isEmpty();
        assertThat(cache.get("broken")).isEmpty();
    }

    @Test
    @DisplayName("clear deletes only prefixed keys and skips the call when there are none")
    void clear() {
        when(redisTemplate.keys("gateway:fallback:*"))
                .thenReturn(Set.of("gateway:fallback:a", "gateway:fallback:b"))
                .thenReturn(Set.of());

        cache.clear();
        cache.clear();

        verify(redisTemplate).delete(Set.of("gateway:fallback:a", "gateway:fallback:b"));
        verify(redisTemplate, never()).delete(Set.<String>of());
        assertThat(cache.sweepExpired()).isZero();
    }
}
