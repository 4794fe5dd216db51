package com.phillippitts.ttsbatch.config;

import com.phillippitts.ttsbatch.config.properties.CacheProperties;
import com.phillippitts.ttsbatch.service.cache.CacheStore;
import com.phillippitts.ttsbatch.service.cache.NoopCacheStore;
import com.phillippitts.ttsbatch.service.cache.RedisCacheStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Wires the audio {@link CacheStore}.
 *
 * <p>With {@code tts.cache.enabled=false}, or when no Redis connection factory is available,
 * the service runs without a cache and every response reports {@code X-Cache: DISABLED}.
 */
@Configuration
public class CacheConfig {

    private static final Logger LOG = LogManager.getLogger(CacheConfig.class);

    @Bean
    public CacheStore cacheStore(CacheProperties props,
                                 ObjectProvider<RedisConnectionFactory> connectionFactory) {
        if (!props.isEnabled()) {
            LOG.info("Audio cache disabled (tts.cache.enabled=false)");
            return new NoopCacheStore();
        }
        RedisConnectionFactory factory = connectionFactory.getIfAvailable();
        if (factory == null) {
            LOG.warn("No Redis connection factory available; audio cache disabled");
            return new NoopCacheStore();
        }
        LOG.info("Audio cache enabled: ttl={} keyPrefix={}", props.getTtl(), props.getKeyPrefix());
        return new RedisCacheStore(audioRedisTemplate(factory));
    }

    static RedisTemplate<String, byte[]> audioRedisTemplate(RedisConnectionFactory factory) {
        RedisTemplate<String, byte[]> template = new RedisTemplate<>();
        template.setConnectionFactory(factory);
        template.setKeySerializer(StringRedisSerializer.UTF_8);
        template.setValueSerializer(RedisSerializer.byteArray());
        template.setEnableDefaultSerializer(false);
        template.afterPropertiesSet();
        return template;
    }
}
