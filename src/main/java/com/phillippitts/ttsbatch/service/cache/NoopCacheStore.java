package com.phillippitts.ttsbatch.service.cache;

import java.time.Duration;

/**
 * Cache store used when {@code tts.cache.enabled=false}: every read misses, writes are dropped.
 */
public final class NoopCacheStore implements CacheStore {

    @Override
    public CacheLookup get(String key) {
        return CacheLookup.miss();
    }

    @Override
    public void put(String key, byte[] value, Duration ttl) {
        // caching disabled
    }

    @Override
    public boolean isEnabled() {
        return false;
    }
}
