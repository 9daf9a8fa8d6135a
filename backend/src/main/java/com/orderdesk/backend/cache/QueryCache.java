package com.orderdesk.backend.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Read-through JSON cache for list pages, single records and statistics.
 * <p>
 * A failing read counts as a miss. A failing write or invalidation is logged
 * and the caller carries on, so a cache outage never fails a request whose
 * database work already completed.
 */
@Slf4j
@Component
public class QueryCache {

    private final CacheStore cacheStore;
    private final ObjectMapper objectMapper;
    private final Duration defaultTtl;
    private final Duration statsTtl;

    public QueryCache(CacheStore cacheStore,
                      ObjectMapper objectMapper,
                      @Value("${app.cache.ttl-seconds:300}") long ttlSeconds,
                      @Value("${app.cache.stats-ttl-seconds:1800}") long statsTtlSeconds) {
        this.cacheStore = cacheStore;
        this.objectMapper = objectMapper;
        this.defaultTtl = Duration.ofSeconds(ttlSeconds);
        this.statsTtl = Duration.ofSeconds(statsTtlSeconds);
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    public Duration getStatsTtl() {
        return statsTtl;
    }

    public <T> Optional<T> get(String key, TypeReference<T> type) {
        try {
            Optional<String> cachedValue = cacheStore.get(key);
            if (cachedValue.isEmpty()) {
                log.debug("Cache miss: {}", key);
                return Optional.empty();
            }
            log.debug("Cache hit: {}", key);
            return Optional.of(objectMapper.readValue(cachedValue.get(), type));
        } catch (DataAccessException e) {
            log.warn("Cache read failed for {}, falling back to database: {}", key, e.getMessage());
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse cached value for {}, re-fetching.", key);
        }
        return Optional.empty();
    }

    public void put(String key, Object value) {
        put(key, value, defaultTtl);
    }

    public void put(String key, Object value, Duration ttl) {
        if (value == null) {
            return;
        }
        try {
            cacheStore.set(key, objectMapper.writeValueAsString(value), ttl);
        } catch (DataAccessException e) {
            log.error("Cache write failed for {}: {}", key, e.getMessage());
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize value for cache key {}", key, e);
        }
    }

    public <T> T getOrLoad(String key, TypeReference<T> type, Supplier<T> loader) {
        return getOrLoad(key, type, defaultTtl, loader);
    }

    public <T> T getOrLoad(String key, TypeReference<T> type, Duration ttl, Supplier<T> loader) {
        Optional<T> cached = get(key, type);
        if (cached.isPresent()) {
            return cached.get();
        }
        T loaded = loader.get();
        put(key, loaded, ttl);
        return loaded;
    }

    /**
     * Drops every list, detail and statistics key belonging to the given regions.
     */
    public void invalidate(CacheRegion... regions) {
        for (CacheRegion region : regions) {
            for (String pattern : region.patterns()) {
                try {
                    Set<String> keys = cacheStore.keys(pattern);
                    if (!keys.isEmpty()) {
                        long removed = cacheStore.delete(keys);
                        log.debug("Invalidated {} keys matching {}", removed, pattern);
                    }
                } catch (DataAccessException e) {
                    log.error("Cache invalidation failed for {}: {}", pattern, e.getMessage());
                }
            }
        }
    }

    public String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Filter cannot be serialized: " + value, e);
        }
    }
}
