package com.phillippitts.ttsbatch.service.cache;

import com.phillippitts.ttsbatch.exception.CacheUnavailableException;
import com.phillippitts.ttsbatch.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;

import java.time.Duration;
import java.util.Objects;

/**
 * Redis-backed {@link CacheStore} using {@code GET} and {@code SET ... EX} (atomic set with
 * expiry) through Spring Data Redis.
 *
 * <p>Every Spring {@link DataAccessException} (connection refused, command timeout, serialization)
 * and any other runtime failure from the client is translated into
 * {@link CacheUnavailableException}. The per-command timeout comes from
 * {@code spring.data.redis.timeout}.
 */
public class RedisCacheStore implements CacheStore {

    private static final Logger LOG = LogManager.getLogger(RedisCacheStore.class);

    private final RedisTemplate<String, byte[]> redis;

    public RedisCacheStore(RedisTemplate<String, byte[]> redis) {
        this.redis = Objects.requireNonNull(redis, "redis");
    }

    @Override
    public CacheLookup get(String key) {
        try {
            byte[] value = redis.opsForValue().get(key);
            if (value == null || value.length == 0) {
                LOG.debug("Cache MISS key={}", key);
                return CacheLookup.miss();
            }
            LOG.debug("Cache HIT key={} bytes={}", key, value.length);
            return CacheLookup.hit(value);
        } catch (RuntimeException e) {
            if (!(e instanceof DataAccessException)) {
                LOG.debug("Unexpected cache client failure on get key={}: {}",
                        LogSanitizer.truncate(key, 80), e.toString());
            }
            return CacheLookup.unavailable(new CacheUnavailableException("get", e));
        }
    }

    @Override
    public void put(String key, byte[] value, Duration ttl) {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(ttl, "ttl");
        try {
            redis.opsForValue().set(key, value, ttl);
            LOG.debug("Cached {} bytes key={} ttl={}s", value.length, key, ttl.toSeconds());
        } catch (RuntimeException e) {
            throw new CacheUnavailableException("put", e);
        }
    }
}
