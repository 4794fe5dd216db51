package com.phillippitts.ttsbatch.service.events;

import com.phillippitts.ttsbatch.service.metrics.SynthesisMetricsPublisher;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Logs and counts voice model lifecycle transitions. Failure logs are throttled per model so a
 * client hammering an unavailable id does not flood the log.
 */
@Component
class ModelEventsListener {
    private static final Logger LOG = LogManager.getLogger(ModelEventsListener.class);

    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private final SynthesisMetricsPublisher metrics;

    ModelEventsListener(SynthesisMetricsPublisher metrics) {
        this.metrics = metrics;
    }

    @EventListener
    void onModelLifecycle(ModelLifecycleEvent e) {
        switch (e.state()) {
            case READY -> {
                LOG.info("Model {} ready in {} ms", e.modelId(), e.durationMs());
                metrics.recordModelLoad(e.modelId(), true, e.durationMs());
            }
            case FAILED -> {
                metrics.recordModelLoad(e.modelId(), false, e.durationMs());
                if (shouldLog("model-failed-" + e.modelId())) {
                    LOG.warn("Model {} failed after {} ms: {}", e.modelId(), e.durationMs(), e.message());
                }
            }
            default -> LOG.debug("Model {} -> {}", e.modelId(), e.state());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
