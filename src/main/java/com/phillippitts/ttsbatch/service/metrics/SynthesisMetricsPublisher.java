package com.phillippitts.ttsbatch.service.metrics;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

/**
 * Null-safe facade over {@link SynthesisMetrics} used by the orchestrator and listeners.
 *
 * <p><b>Null Safety:</b> all methods are no-ops when constructed without metrics, allowing
 * components to run without a meter registry in unit tests.
 *
 * @see SynthesisMetrics
 */
@Component
public final class SynthesisMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(SynthesisMetricsPublisher.class);

    /**
     * Singleton no-op instance for tests and manual wiring.
     */
    public static final SynthesisMetricsPublisher NOOP = new SynthesisMetricsPublisher(null);

    private final SynthesisMetrics metrics;

    /**
     * @param metrics metrics tracking service (nullable for test mode)
     */
    public SynthesisMetricsPublisher(SynthesisMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("SynthesisMetricsPublisher created without metrics (test mode)");
        }
    }

    /**
     * Records a completed request.
     *
     * @param modelId resolved model id
     * @param cacheStatus cache outcome name
     * @param totalNanos end-to-end duration
     * @param synthesisNanos engine time, or 0 on a cache hit
     */
    public void recordSuccess(String modelId, String cacheStatus, long totalNanos, long synthesisNanos) {
        if (metrics == null) {
            return;
        }
        metrics.recordRequestLatency(modelId, cacheStatus, totalNanos);
        if (synthesisNanos > 0) {
            metrics.recordSynthesisLatency(modelId, synthesisNanos);
        }
    }

    public void recordFailure(String errorCategory) {
        if (metrics == null) {
            return;
        }
        metrics.incrementFailure(errorCategory);
    }

    public void recordCacheLookup(String outcome) {
        if (metrics == null) {
            return;
        }
        metrics.incrementCacheLookup(outcome);
    }

    public void recordCacheWriteFailure() {
        if (metrics == null) {
            return;
        }
        metrics.incrementCacheWriteFailure();
    }

    public void recordResampled(int sourceRate, int targetRate) {
        if (metrics == null) {
            return;
        }
        metrics.incrementResampled(sourceRate, targetRate);
    }

    public void recordModelLoad(String modelId, boolean success, long durationMs) {
        if (metrics == null) {
            return;
        }
        metrics.recordModelLoad(modelId, success, durationMs);
    }

    /**
     * @return true if metrics are available, false if running in test mode
     */
    public boolean isEnabled() {
        return metrics != null;
    }
}
