package com.phillippitts.ttsbatch.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Audio cache settings. Connection parameters live under {@code spring.data.redis.*}.
 *
 * <p>Example application.properties:
 * <pre>
 * tts.cache.enabled=true
 * tts.cache.ttl=7d
 * tts.cache.key-prefix=tts:
 * spring.data.redis.host=localhost
 * spring.data.redis.timeout=500ms
 * </pre>
 */
@ConfigurationProperties(prefix = "tts.cache")
@Validated
public class CacheProperties {

    private boolean enabled = true;

    @NotNull(message = "Cache TTL must be set")
    private Duration ttl = Duration.ofDays(7);

    @NotBlank(message = "Cache key prefix must not be blank")
    private String keyPrefix = "tts:";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Duration getTtl() {
        return ttl;
    }

    public void setTtl(Duration ttl) {
        this.ttl = ttl;
    }

    public String getKeyPrefix() {
        return keyPrefix;
    }

    public void setKeyPrefix(String keyPrefix) {
        this.keyPrefix = keyPrefix;
    }
}
