package com.orderdesk.backend.cache;

import java.time.Duration;
import java.util.Collection;
import java.util.Optional;
import java.util.Set;

/**
 * Minimal key/value contract shared by the query cache, the revoked-token
 * ledger and the one-time code store. Values are strings; callers own the
 * serialization.
 */
public interface CacheStore {

    Optional<String> get(String key);

    void set(String key, String value, Duration ttl);

    /**
     * @param pattern glob-style pattern, e.g. {@code orders:*}
     */
    Set<String> keys(String pattern);

    long delete(Collection<String> keys);

    /**
     * @return remaining lifetime, or empty when the key is missing or never expires
     */
    Optional<Duration> ttl(String key);
}
