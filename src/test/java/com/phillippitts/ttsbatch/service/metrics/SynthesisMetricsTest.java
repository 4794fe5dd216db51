package com.phillippitts.ttsbatch.service.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class SynthesisMetricsTest {

    private MeterRegistry registry;
    private SynthesisMetricsPublisher publisher;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        publisher = new SynthesisMetricsPublisher(new SynthesisMetrics(registry));
    }

    @Test
    void shouldRecordRequestAndEngineLatencyOnMiss() {
        publisher.recordSuccess("en_US-amy-low", "MISS", TimeUnit.MILLISECONDS.toNanos(120),
                TimeUnit.MILLISECONDS.toNanos(100));

        Timer request = registry.find("tts.request.latency").tags("model", "en_US-amy-low", "cache", "MISS").timer();
        Timer synthesis = registry.find("tts.synthesis.latency").tag("model", "en_US-amy-low").timer();
        assertThat(request).isNotNull();
        assertThat(request.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(120);
        assertThat(synthesis).isNotNull();
        assertThat(synthesis.count()).isEqualTo(1);
    }

    @Test
    void shouldSkipEngineLatencyOnHit() {
        publisher.recordSuccess("en_US-amy-low", "HIT", 1000, 0);

        assertThat(registry.find("tts.synthesis.latency").timer()).isNull();
        assertThat(registry.find("tts.request.latency").tag("cache", "HIT").timer()).isNotNull();
    }

    @Test
    void shouldCountLookupsFailuresAndResampling() {
        publisher.recordCacheLookup("hit");
        publisher.recordCacheLookup("hit");
        publisher.recordCacheLookup("error");
        publisher.recordCacheWriteFailure();
        publisher.recordFailure("synthesis_error");
        publisher.recordResampled(22050, 16000);

        assertThat(registry.get("tts.cache.lookup").tag("outcome", "hit").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("tts.cache.lookup").tag("outcome", "error").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("tts.cache.write.failure").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("tts.request.failure").tag("reason", "synthesis_error").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("tts.resample").tags("from", "22050", "to", "16000").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void shouldTagModelLoadOutcome() {
        publisher.recordModelLoad("en_US-amy-low", true, 250);
        publisher.recordModelLoad("en_GB-nobody-low", false, -1);

        assertThat(registry.get("tts.model.load").tag("outcome", "ready").timer().count()).isEqualTo(1);
        assertThat(registry.get("tts.model.load").tags("model", "en_GB-nobody-low", "outcome", "failed").timer()
                .totalTime(TimeUnit.MILLISECONDS)).isZero();
    }

    @Test
    void noopPublisherIgnoresEverything() {
        SynthesisMetricsPublisher noop = SynthesisMetricsPublisher.NOOP;

        noop.recordSuccess("m", "MISS", 1, 1);
        noop.recordFailure("x");
        noop.recordCacheLookup("hit");
        noop.recordModelLoad("m", true, 1);

        assertThat(noop.isEnabled()).isFalse();
        assertThat(publisher.isEnabled()).isTrue();
    }
}
