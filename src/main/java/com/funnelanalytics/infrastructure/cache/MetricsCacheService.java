package com.funnelanalytics.infrastructure.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.funnelanalytics.domain.model.MaterializedMetricsResponse;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Redis cache of materialized metric reads, one entry per funnel and period
 * plus one "all" entry per funnel for unfiltered reads.
 *
 * Redis errors propagate to the "redis" circuit breaker, whose fallbacks turn
 * them into a miss or a skipped write. Only an unreadable payload is handled
 * here: the entry is dropped and reported as a miss.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MetricsCacheService {

    static final String KEY_PREFIX = "funnel:metrics";
    static final String ALL_PERIODS = "all";

    private final RedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;

    @CircuitBreaker(name = "redis", fallbackMethod = "getFallback")
    public Optional<MaterializedMetricsResponse> get(UUID funnelId, String period) {
        String key = cacheKey(funnelId, period);
        String cached = redisTemplate.opsForValue().get(key);
        if (cached == null) {
            log.debug("Metrics cache miss: {}", key);
            return Optional.empty();
        }

        try {
            MaterializedMetricsResponse response = objectMapper.readValue(cached, MaterializedMetricsResponse.class);
            log.debug("Metrics cache hit: {}", key);
            return Optional.of(response);
        } catch (JsonProcessingException e) {
            log.warn("Dropping unreadable metrics cache entry {}: {}", key, e.getOriginalMessage());
            redisTemplate.delete(key);
            return Optional.empty();
        }
    }

    @CircuitBreaker(name = "redis", fallbackMethod = "putFallback")
    public void put(MaterializedMetricsResponse response, long ttlSeconds) {
        String key = cacheKey(response.getFunnelId(), response.getPeriod());
        String json;
        try {
            json = objectMapper.writeValueAsString(response);
        } catch (JsonProcessingException e) {
            log.warn("Metrics for {} not cacheable: {}", key, e.getOriginalMessage());
            return;
        }
        redisTemplate.opsForValue().set(key, json, ttlSeconds, TimeUnit.SECONDS);
        log.debug("Cached metrics {} (TTL: {}s)", key, ttlSeconds);
    }

    /**
     * Drops the entry of one period together with the funnel's "all" entry.
     */
    @CircuitBreaker(name = "redis", fallbackMethod = "invalidateFallback")
    public void invalidatePeriod(UUID funnelId, String period) {
        List<String> keys = List.of(cacheKey(funnelId, period), cacheKey(funnelId, null));
        redisTemplate.delete(keys);
        log.debug("Invalidated metrics cache {}", keys);
    }

    static String cacheKey(UUID funnelId, String period) {
        return KEY_PREFIX + ":" + funnelId + ":" + (period != null ? period : ALL_PERIODS);
    }

    Optional<MaterializedMetricsResponse> getFallback(UUID funnelId, String period, Exception e) {
        log.warn("Metrics cache unavailable, reading store for funnel {}: {}", funnelId, e.getMessage());
        return Optional.empty();
    }

    void putFallback(MaterializedMetricsResponse response, long ttlSeconds, Exception e) {
        log.warn("Metrics cache unavailable, skipping write for funnel {}: {}", response.getFunnelId(), e.getMessage());
    }

    void invalidateFallback(UUID funnelId, String period, Exception e) {
        // stale entries expire with their TTL
        log.warn("Metrics cache unavailable, could not invalidate funnel {} period {}: {}",
                funnelId, period, e.getMessage());
    }
}
