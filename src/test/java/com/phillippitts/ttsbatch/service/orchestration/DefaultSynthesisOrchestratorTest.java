package com.phillippitts.ttsbatch.service.orchestration;

import com.phillippitts.ttsbatch.config.properties.CacheProperties;
import com.phillippitts.ttsbatch.config.properties.ModelProperties;
import com.phillippitts.ttsbatch.config.properties.SynthesisProperties;
import com.phillippitts.ttsbatch.domain.CacheStatus;
import com.phillippitts.ttsbatch.domain.SynthesisRequest;
import com.phillippitts.ttsbatch.domain.SynthesisResult;
import com.phillippitts.ttsbatch.exception.InvalidRequestException;
import com.phillippitts.ttsbatch.exception.ModelUnavailableException;
import com.phillippitts.ttsbatch.exception.SynthesisException;
import com.phillippitts.ttsbatch.service.audio.PolyphaseSampleRateConverter;
import com.phillippitts.ttsbatch.service.cache.CacheKeyDeriver;
import com.phillippitts.ttsbatch.service.cache.CacheLookup;
import com.phillippitts.ttsbatch.service.cache.CacheStore;
import com.phillippitts.ttsbatch.service.cache.NoopCacheStore;
import com.phillippitts.ttsbatch.service.metrics.SynthesisMetrics;
import com.phillippitts.ttsbatch.service.metrics.SynthesisMetricsPublisher;
import com.phillippitts.ttsbatch.service.model.DefaultModelRegistry;
import com.phillippitts.ttsbatch.service.model.ModelFiles;
import com.phillippitts.ttsbatch.service.model.ModelRegistry;
import com.phillippitts.ttsbatch.testutil.FakeModelSource;
import com.phillippitts.ttsbatch.testutil.FakeSynthesisEngine;
import com.phillippitts.ttsbatch.testutil.InMemoryCacheStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

class DefaultSynthesisOrchestratorTest {

    private static final String AMY = "en_US-amy-low";
    private static final int NATIVE_RATE = 22050;

    @TempDir
    Path tempDir;

    private SynthesisProperties synthesisProps;
    private ModelProperties modelProps;
    private CacheProperties cacheProps;
    private FakeSynthesisEngine engine;
    private FakeModelSource source;
    private ModelRegistry registry;
    private InMemoryCacheStore cache;
    private SimpleMeterRegistry meters;

    @BeforeEach
    void setUp() {
        synthesisProps = new SynthesisProperties();
        modelProps = new ModelProperties();
        modelProps.setDefaultModel(AMY);
        cacheProps = new CacheProperties();
        engine = new FakeSynthesisEngine(NATIVE_RATE);
        source = new FakeModelSource(NATIVE_RATE, AMY);
        registry = new DefaultModelRegistry(modelProps,
                new ModelFiles(tempDir.resolve("assets"), tempDir.resolve("fallback")), source, engine, null);
        cache = new InMemoryCacheStore();
        meters = new SimpleMeterRegistry();
    }

    private DefaultSynthesisOrchestrator orchestrator(ModelRegistry models, CacheStore store) {
        return new DefaultSynthesisOrchestrator(synthesisProps, modelProps, cacheProps, models, engine,
                new PolyphaseSampleRateConverter(), new CacheKeyDeriver("tts:"), store,
                new SynthesisMetricsPublisher(new SynthesisMetrics(meters)));
    }

    private DefaultSynthesisOrchestrator orchestrator() {
        return orchestrator(registry, cache);
    }

    private double counter(String name, String tag, String value) {
        Counter c = meters.find(name).tag(tag, value).counter();
        return c == null ? 0 : c.count();
    }

    @Test
    void secondIdenticalRequestIsServedFromCache() {
        DefaultSynthesisOrchestrator orchestrator = orchestrator();

        SynthesisResult first = orchestrator.synthesize(SynthesisRequest.of("Hello there"));
        SynthesisResult second = orchestrator.synthesize(SynthesisRequest.of("Hello there"));

        assertThat(first.cacheStatus()).isEqualTo(CacheStatus.MISS);
        assertThat(first.modelId()).isEqualTo(AMY);
        assertThat(first.sampleRate()).isEqualTo(NATIVE_RATE);
        assertThat(first.resampled()).isFalse();
        assertThat(second.cacheStatus()).isEqualTo(CacheStatus.HIT);
        assertThat(second.payload()).isEqualTo(first.payload());
        assertThat(second.synthesisMs()).isZero();
        assertThat(engine.synthesizeCalls()).isEqualTo(1);
        assertThat(cache.entries()).hasSize(1);
        assertThat(cache.entries().keySet()).allSatisfy(k -> assertThat(k).startsWith("tts:"));
        assertThat(counter("tts.cache.lookup", "outcome", "hit")).isEqualTo(1.0);
    }

    @Test
    void cacheKeyIncludesTextVerbatim() {
        DefaultSynthesisOrchestrator orchestrator = orchestrator();

        orchestrator.synthesize(SynthesisRequest.of("Hello"));
        SynthesisResult other = orchestrator.synthesize(SynthesisRequest.of("hello"));

        assertThat(other.cacheStatus()).isEqualTo(CacheStatus.MISS);
        assertThat(engine.synthesizeCalls()).isEqualTo(2);
    }

    @Test
    void cacheOutageStillProducesAudioAndSkipsWriteBack() {
        cache.goDown();

        SynthesisResult result = orchestrator().synthesize(SynthesisRequest.of("Hello there"));

        assertThat(result.cacheStatus()).isEqualTo(CacheStatus.ERROR);
        assertThat(result.payload().sampleCount()).isEqualTo(11 * FakeSynthesisEngine.SAMPLES_PER_CHAR);
        assertThat(cache.puts()).isZero();
        assertThat(counter("tts.cache.lookup", "outcome", "error")).isEqualTo(1.0);
    }

    @Test
    void cacheClientThrowingIsTreatedAsOutage() {
        CacheStore throwing = new CacheStore() {
            @Override
            public CacheLookup get(String key) {
                throw new IllegalStateException("pool exhausted");
            }

            @Override
            public void put(String key, byte[] value, Duration ttl) {
                throw new IllegalStateException("pool exhausted");
            }
        };

        SynthesisResult result = orchestrator(registry, throwing).synthesize(SynthesisRequest.of("Hi"));

        assertThat(result.cacheStatus()).isEqualTo(CacheStatus.ERROR);
    }

    @Test
    void failedWriteBackIsIgnored() {
        cache.failWrites();

        SynthesisResult result = orchestrator().synthesize(SynthesisRequest.of("Hello there"));

        assertThat(result.cacheStatus()).isEqualTo(CacheStatus.MISS);
        assertThat(cache.puts()).isEqualTo(1);
        assertThat(meters.get("tts.cache.write.failure").counter().count()).isEqualTo(1.0);
    }

    @Test
    void disabledCacheIsReportedAndNeverTouched() {
        SynthesisResult result = orchestrator(registry, new NoopCacheStore()).synthesize(SynthesisRequest.of("Hi"));

        assertThat(result.cacheStatus()).isEqualTo(CacheStatus.DISABLED);
        assertThat(counter("tts.cache.lookup", "outcome", "disabled")).isEqualTo(1.0);
    }

    @Test
    void resamplesToRequestedRate() {
        SynthesisResult result = orchestrator().synthesize(SynthesisRequest.of("Hello", AMY, 16000));

        int nativeSamples = 5 * FakeSynthesisEngine.SAMPLES_PER_CHAR;
        long expected = Math.round(nativeSamples * 16000.0 / NATIVE_RATE);
        assertThat(result.resampled()).isTrue();
        assertThat(result.sampleRate()).isEqualTo(16000);
        assertThat((long) result.payload().sampleCount()).isBetween(expected - 1, expected + 1);
        assertThat(meters.get("tts.resample").tags("from", "22050", "to", "16000").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void resampledAudioIsCachedUnderTargetRate() {
        DefaultSynthesisOrchestrator orchestrator = orchestrator();
        SynthesisResult first = orchestrator.synthesize(SynthesisRequest.of("Hello", AMY, 16000));

        SynthesisResult second = orchestrator.synthesize(SynthesisRequest.of("Hello", AMY, 16000));
        SynthesisResult nativeRate = orchestrator.synthesize(SynthesisRequest.of("Hello", AMY, null));

        assertThat(second.cacheStatus()).isEqualTo(CacheStatus.HIT);
        assertThat(second.resampled()).isFalse();
        assertThat(second.resampleMs()).isZero();
        assertThat(second.payload()).isEqualTo(first.payload());
        assertThat(nativeRate.cacheStatus()).isEqualTo(CacheStatus.MISS);
        assertThat(nativeRate.sampleRate()).isEqualTo(NATIVE_RATE);
    }

    @Test
    void requestedNativeRateSkipsResampling() {
        SynthesisResult result = orchestrator().synthesize(SynthesisRequest.of("Hello", AMY, NATIVE_RATE));

        assertThat(result.resampled()).isFalse();
        assertThat(result.resampleMs()).isZero();
        assertThat(meters.find("tts.resample").counter()).isNull();
    }

    @Test
    void blankModelFallsBackToDefault() {
        SynthesisResult result = orchestrator().synthesize(SynthesisRequest.of("Hi", "  ", null));

        assertThat(result.modelId()).isEqualTo(AMY);
    }

    @Test
    void invalidInputIsRejectedBeforeAnyWork() {
        ModelRegistry untouched = mock(ModelRegistry.class);
        DefaultSynthesisOrchestrator orchestrator = orchestrator(untouched, cache);

        assertThatThrownBy(() -> orchestrator.synthesize(SynthesisRequest.of("")))
                .isInstanceOfSatisfying(InvalidRequestException.class,
                        e -> assertThat(e.getField()).isEqualTo("text"));
        assertThatThrownBy(() -> orchestrator.synthesize(SynthesisRequest.of(null)))
                .isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> orchestrator.synthesize(SynthesisRequest.of("x".repeat(2001))))
                .hasMessageContaining("exceeds maximum of 2000");
        assertThatThrownBy(() -> orchestrator.synthesize(SynthesisRequest.of("Hi", AMY, 0)))
                .isInstanceOfSatisfying(InvalidRequestException.class,
                        e -> assertThat(e.getField()).isEqualTo("sampleRate"));
        assertThatThrownBy(() -> orchestrator.synthesize(SynthesisRequest.of("Hi", AMY, 96000)))
                .isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> orchestrator.synthesize(SynthesisRequest.of("Hi", "../etc", null)))
                .isInstanceOfSatisfying(InvalidRequestException.class,
                        e -> assertThat(e.getField()).isEqualTo("model"));

        verifyNoInteractions(untouched);
        assertThat(engine.synthesizeCalls()).isZero();
        assertThat(cache.gets()).isZero();
        assertThat(counter("tts.request.failure", "reason", "invalid_request")).isEqualTo(6.0);
    }

    @Test
    void maxLengthTextIsAccepted() {
        synthesisProps.setMaxTextLength(10);

        SynthesisResult result = orchestrator().synthesize(SynthesisRequest.of("x".repeat(10)));

        assertThat(result.payload().sampleCount()).isEqualTo(10 * FakeSynthesisEngine.SAMPLES_PER_CHAR);
    }

    @Test
    void unknownModelPropagatesAndIsCounted() {
        assertThatThrownBy(() -> orchestrator().synthesize(SynthesisRequest.of("Hi", "en_GB-nobody-low", 16000)))
                .isInstanceOfSatisfying(ModelUnavailableException.class,
                        e -> assertThat(e.getReason()).isEqualTo(ModelUnavailableException.Reason.NOT_FOUND));
        assertThat(counter("tts.request.failure", "reason", "model_not_found")).isEqualTo(1.0);
        assertThat(engine.synthesizeCalls()).isZero();
    }

    @Test
    void unexpectedEngineErrorBecomesSynthesisException() {
        engine.failWith(new IllegalStateException("onnx runtime crashed"));

        assertThatThrownBy(() -> orchestrator().synthesize(SynthesisRequest.of("Hi")))
                .isInstanceOf(SynthesisException.class)
                .hasMessageContaining("onnx runtime crashed")
                .hasCauseInstanceOf(IllegalStateException.class);
        assertThat(cache.puts()).isZero();
        assertThat(counter("tts.request.failure", "reason", "synthesis_error")).isEqualTo(1.0);
    }

    @Test
    void engineFailureIsNotCached() {
        DefaultSynthesisOrchestrator orchestrator = orchestrator();
        engine.failWithSynthesisError();
        assertThatThrownBy(() -> orchestrator.synthesize(SynthesisRequest.of("Hi")))
                .isInstanceOf(SynthesisException.class);

        engine.failWith(null);
        assertThat(orchestrator.synthesize(SynthesisRequest.of("Hi")).cacheStatus()).isEqualTo(CacheStatus.MISS);
    }

    @Test
    void concurrentIdenticalMissesShareOneSynthesisWhenCoalescing() throws Exception {
        synthesisProps.setCoalesceRequests(true);
        DefaultSynthesisOrchestrator orchestrator = orchestrator();
        registry.resolve(AMY);
        CountDownLatch release = engine.hold();
        int callers = 5;

        ExecutorService pool = Executors.newFixedThreadPool(callers);
        try {
            List<Future<SynthesisResult>> results = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                results.add(pool.submit(() -> orchestrator.synthesize(SynthesisRequest.of("Same words", AMY, 16000))));
            }
            await().atMost(Duration.ofSeconds(5)).until(() -> cache.gets() == callers);
            Thread.sleep(200);
            release.countDown();

            for (Future<SynthesisResult> f : results) {
                SynthesisResult r = f.get(5, TimeUnit.SECONDS);
                assertThat(r.cacheStatus()).isEqualTo(CacheStatus.MISS);
                assertThat(r.sampleRate()).isEqualTo(16000);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(engine.synthesizeCalls()).isEqualTo(1);
        assertThat(cache.puts()).isEqualTo(1);
    }
}
