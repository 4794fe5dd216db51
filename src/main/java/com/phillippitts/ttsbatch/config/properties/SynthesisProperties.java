package com.phillippitts.ttsbatch.config.properties;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Request validation bounds and engine concurrency for synthesis.
 *
 * <p>Example application.properties:
 * <pre>
 * tts.synthesis.max-text-length=2000
 * tts.synthesis.max-sample-rate=48000
 * tts.synthesis.coalesce-requests=false
 * tts.synthesis.max-concurrent=2
 * tts.synthesis.acquire-timeout-ms=5000
 * </pre>
 *
 * <p>Note: Bean created via {@code @EnableConfigurationProperties} on the application class.
 */
@ConfigurationProperties(prefix = "tts.synthesis")
@Validated
public class SynthesisProperties {

    /** Maximum accepted text length in characters. */
    @Positive(message = "Maximum text length must be positive")
    private int maxTextLength = 2000;

    /** Highest target sample rate a caller may request, in Hz. */
    @Positive(message = "Maximum sample rate must be positive")
    private int maxSampleRate = 48_000;

    /** Share one synthesis between identical concurrent cache misses. */
    private boolean coalesceRequests = false;

    /** Concurrent engine invocations allowed (CPU bound). */
    @Positive(message = "Max concurrent syntheses must be positive")
    private int maxConcurrent = 2;

    /** How long a request waits for an engine slot before failing. */
    @PositiveOrZero(message = "Acquire timeout must not be negative")
    private long acquireTimeoutMs = 5000;

    public int getMaxTextLength() {
        return maxTextLength;
    }

    public void setMaxTextLength(int maxTextLength) {
        this.maxTextLength = maxTextLength;
    }

    public int getMaxSampleRate() {
        return maxSampleRate;
    }

    public void setMaxSampleRate(int maxSampleRate) {
        this.maxSampleRate = maxSampleRate;
    }

    public boolean isCoalesceRequests() {
        return coalesceRequests;
    }

    public void setCoalesceRequests(boolean coalesceRequests) {
        this.coalesceRequests = coalesceRequests;
    }

    public int getMaxConcurrent() {
        return maxConcurrent;
    }

    public void setMaxConcurrent(int maxConcurrent) {
        this.maxConcurrent = maxConcurrent;
    }

    public long getAcquireTimeoutMs() {
        return acquireTimeoutMs;
    }

    public void setAcquireTimeoutMs(long acquireTimeoutMs) {
        this.acquireTimeoutMs = acquireTimeoutMs;
    }
}
