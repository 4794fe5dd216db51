package com.phillippitts.ttsbatch.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation for synthesis requests, the audio cache and model acquisition.
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class SynthesisMetrics {

    private static final String METRIC_PREFIX = "tts";

    private final MeterRegistry registry;

    public SynthesisMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records end-to-end request latency.
     *
     * @param modelId resolved model id
     * @param cacheStatus HIT, MISS, ERROR or DISABLED
     * @param durationNanos duration in nanoseconds
     */
    public void recordRequestLatency(String modelId, String cacheStatus, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".request.latency")
                .description("Time taken to serve a synthesis request")
                .tag("model", modelId)
                .tag("cache", cacheStatus)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Records time spent in the engine for one cache miss.
     */
    public void recordSynthesisLatency(String modelId, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".synthesis.latency")
                .description("Time taken by the engine to synthesize audio")
                .tag("model", modelId)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementCacheLookup(String outcome) {
        Counter.builder(METRIC_PREFIX + ".cache.lookup")
                .description("Cache lookups by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void incrementCacheWriteFailure() {
        Counter.builder(METRIC_PREFIX + ".cache.write.failure")
                .description("Cache writes that failed and were skipped")
                .register(registry)
                .increment();
    }

    public void incrementResampled(int sourceRate, int targetRate) {
        Counter.builder(METRIC_PREFIX + ".resample")
                .description("Responses converted from the native sample rate")
                .tag("from", String.valueOf(sourceRate))
                .tag("to", String.valueOf(targetRate))
                .register(registry)
                .increment();
    }

    /**
     * Increments the failure counter.
     *
     * @param reason failure category (invalid_request, model_unavailable, synthesis_error, ...)
     */
    public void incrementFailure(String reason) {
        Counter.builder(METRIC_PREFIX + ".request.failure")
                .description("Number of failed synthesis requests")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * Records a model acquisition outcome.
     */
    public void recordModelLoad(String modelId, boolean success, long durationMs) {
        Timer.builder(METRIC_PREFIX + ".model.load")
                .description("Time taken to acquire a voice model")
                .tag("model", modelId)
                .tag("outcome", success ? "ready" : "failed")
                .register(registry)
                .record(Math.max(0, durationMs), TimeUnit.MILLISECONDS);
    }
}
