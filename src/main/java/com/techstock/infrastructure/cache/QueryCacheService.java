package com.techstock.infrastructure.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Redis cache for pre-aggregated catalog figures.
 *
 * Values are stored as JSON strings under keys prefixed with
 * {@value #KEY_PREFIX}. Every operation sits behind the {@code redis}
 * circuit breaker; a miss, a read error or an open breaker all look like a
 * cache miss to the caller, who then reads the database.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueryCacheService {

    static final String KEY_PREFIX = "techstock:";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    @CircuitBreaker(name = "redis", fallbackMethod = "getFallback")
    public <T> Optional<T> get(String key, Class<T> type) {
        String cached = redisTemplate.opsForValue().get(key);
        if (cached == null) {
            log.debug("Cache miss for key: {}", key);
            return Optional.empty();
        }
        try {
            T value = objectMapper.readValue(cached, type);
            log.debug("Cache hit for key: {}", key);
            return Optional.of(value);
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable cache entry {}: {}", key, e.getOriginalMessage());
            redisTemplate.delete(key);
            return Optional.empty();
        }
    }

    @CircuitBreaker(name = "redis", fallbackMethod = "putFallback")
    public void put(String key, Object value, long ttlSeconds) {
        try {
            String json = objectMapper.writeValueAsString(value);
            redisTemplate.opsForValue().set(key, json, ttlSeconds, TimeUnit.SECONDS);
            log.debug("Cached {} (TTL: {}s)", key, ttlSeconds);
        } catch (JsonProcessingException e) {
            log.warn("Value for {} is not serializable, not caching: {}", key, e.getOriginalMessage());
        }
    }

    @CircuitBreaker(name = "redis", fallbackMethod = "evictFallback")
    public void evict(String... keys) {
        Long removed = redisTemplate.delete(Arrays.asList(keys));
        log.debug("Evicted {} of {} cache keys", removed, keys.length);
    }

    /**
     * Builds {@code techstock:<namespace>:<part>:<part>...}; null parts are
     * written as {@code -}.
     */
    public String key(String namespace, Object... parts) {
        StringBuilder key = new StringBuilder(KEY_PREFIX).append(namespace);
        for (Object part : parts) {
            key.append(':').append(part != null ? part : "-");
        }
        return key.toString();
    }

    // Fallbacks (circuit breaker open or Redis unreachable)

    private <T> Optional<T> getFallback(String key, Class<T> type, Exception e) {
        log.warn("Redis unavailable ({}), reading {} from database", e.getMessage(), key);
        return Optional.empty();
    }

    private void putFallback(String key, Object value, long ttlSeconds, Exception e) {
        log.warn("Redis unavailable ({}), skipping cache write for {}", e.getMessage(), key);
    }

    private void evictFallback(String[] keys, Exception e) {
        log.warn("Redis unavailable ({}), could not evict {} keys", e.getMessage(), keys.length);
    }
}
