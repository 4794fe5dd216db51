package com.phillippitts.ttsbatch.service.cache;

import com.phillippitts.ttsbatch.exception.CacheUnavailableException;

import java.time.Duration;

/**
 * Key-value store for synthesized audio with TTL-bounded writes.
 *
 * <p>The store is an optimization, never a correctness dependency. Reads report backend
 * failure through {@link CacheLookup#unavailable}; writes throw
 * {@link CacheUnavailableException}. Neither may block longer than the configured
 * backend timeout.
 */
public interface CacheStore {

    /**
     * Looks up a key.
     *
     * @param key derived cache key
     * @return hit, miss, or unavailable; never throws for backend failures
     */
    CacheLookup get(String key);

    /**
     * Stores bytes under a key with a time-to-live.
     *
     * @throws CacheUnavailableException if the backend cannot accept the write
     */
    void put(String key, byte[] value, Duration ttl);

    /**
     * Returns false when caching is switched off and every call is a no-op.
     */
    default boolean isEnabled() {
        return true;
    }
}
