package com.phillippitts.ttsbatch.service.orchestration;

import com.phillippitts.ttsbatch.config.properties.CacheProperties;
import com.phillippitts.ttsbatch.config.properties.ModelProperties;
import com.phillippitts.ttsbatch.config.properties.SynthesisProperties;
import com.phillippitts.ttsbatch.domain.AudioPayload;
import com.phillippitts.ttsbatch.domain.CacheStatus;
import com.phillippitts.ttsbatch.domain.SynthesisRequest;
import com.phillippitts.ttsbatch.domain.SynthesisResult;
import com.phillippitts.ttsbatch.domain.VoiceModel;
import com.phillippitts.ttsbatch.exception.CacheUnavailableException;
import com.phillippitts.ttsbatch.exception.InvalidRequestException;
import com.phillippitts.ttsbatch.exception.ModelUnavailableException;
import com.phillippitts.ttsbatch.exception.SynthesisException;
import com.phillippitts.ttsbatch.service.audio.SampleRateConverter;
import com.phillippitts.ttsbatch.service.cache.CacheKeyDeriver;
import com.phillippitts.ttsbatch.service.cache.CacheLookup;
import com.phillippitts.ttsbatch.service.cache.CacheStore;
import com.phillippitts.ttsbatch.service.metrics.SynthesisMetricsPublisher;
import com.phillippitts.ttsbatch.service.model.ModelFiles;
import com.phillippitts.ttsbatch.service.model.ModelRegistry;
import com.phillippitts.ttsbatch.service.synthesis.SynthesisEngine;
import com.phillippitts.ttsbatch.util.LogSanitizer;
import com.phillippitts.ttsbatch.util.SingleFlight;
import com.phillippitts.ttsbatch.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Cache-aside synthesis pipeline.
 *
 * <p><b>Flow:</b>
 * <ol>
 *   <li>Validate text, model id and sample rate; apply the default model</li>
 *   <li>Pick the output rate: requested, or the model's native rate</li>
 *   <li>Derive the cache key and look it up; a hit is returned as stored</li>
 *   <li>On a miss or cache error: resolve the model, synthesize, resample if needed</li>
 *   <li>Write the audio back to the cache, best effort</li>
 * </ol>
 *
 * <p>A request without a sample rate resolves its model before the cache lookup, since the native
 * rate is part of the key. With {@code tts.synthesis.coalesce-requests=true}, concurrent misses for
 * the same key share one synthesis.
 *
 * <p><b>Thread Safety:</b> stateless apart from the in-flight map; safe for concurrent requests.
 */
@Service
public class DefaultSynthesisOrchestrator implements SynthesisOrchestrator {

    private static final Logger LOG = LogManager.getLogger(DefaultSynthesisOrchestrator.class);

    private final SynthesisProperties synthesisProps;
    private final ModelProperties modelProps;
    private final ModelRegistry registry;
    private final SynthesisEngine engine;
    private final SampleRateConverter converter;
    private final CacheKeyDeriver keyDeriver;
    private final CacheStore cache;
    private final Duration cacheTtl;
    private final SynthesisMetricsPublisher metrics;
    private final SingleFlight<String, Rendered> inFlight = new SingleFlight<>();

    /**
     * Freshly synthesized audio at the target rate, before it is wrapped for a caller.
     */
    private record Rendered(byte[] pcm, boolean resampled, long synthesisNanos, long resampleNanos) {}

    public DefaultSynthesisOrchestrator(SynthesisProperties synthesisProps,
                                        ModelProperties modelProps,
                                        CacheProperties cacheProps,
                                        ModelRegistry registry,
                                        SynthesisEngine engine,
                                        SampleRateConverter converter,
                                        CacheKeyDeriver keyDeriver,
                                        CacheStore cache,
                                        SynthesisMetricsPublisher metrics) {
        this.synthesisProps = Objects.requireNonNull(synthesisProps, "synthesisProps");
        this.modelProps = Objects.requireNonNull(modelProps, "modelProps");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.converter = Objects.requireNonNull(converter, "converter");
        this.keyDeriver = Objects.requireNonNull(keyDeriver, "keyDeriver");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.cacheTtl = Objects.requireNonNull(cacheProps, "cacheProps").getTtl();
        this.metrics = metrics == null ? SynthesisMetricsPublisher.NOOP : metrics;
    }

    @Override
    public SynthesisResult synthesize(SynthesisRequest request) {
        long start = System.nanoTime();
        try {
            return doSynthesize(request, start);
        } catch (InvalidRequestException e) {
            metrics.recordFailure("invalid_request");
            throw e;
        } catch (ModelUnavailableException e) {
            metrics.recordFailure("model_" + e.getReason().name().toLowerCase(Locale.ROOT));
            throw e;
        } catch (SynthesisException e) {
            metrics.recordFailure("synthesis_error");
            throw e;
        }
    }

    private SynthesisResult doSynthesize(SynthesisRequest request, long start) {
        Objects.requireNonNull(request, "request");
        String text = validateText(request.text());
        String modelId = effectiveModelId(request.modelId());
        Integer requestedRate = validateSampleRate(request.targetSampleRate());

        VoiceModel model = null;
        int targetRate;
        if (requestedRate != null) {
            targetRate = requestedRate;
        } else {
            model = registry.resolve(modelId);
            targetRate = model.nativeSampleRate();
        }

        String key = keyDeriver.derive(modelId, text, targetRate);
        CacheLookup lookup = lookup(key);
        CacheStatus status = statusOf(lookup);
        if (status == CacheStatus.HIT) {
            return cachedResult(lookup.payload(), key, modelId, targetRate, start);
        }

        VoiceModel resolved = model != null ? model : registry.resolve(modelId);
        boolean writeBack = status == CacheStatus.MISS;
        Rendered rendered = synthesisProps.isCoalesceRequests()
                ? inFlight.execute(key, () -> render(resolved, text, targetRate, key, writeBack))
                : render(resolved, text, targetRate, key, writeBack);

        long totalNanos = System.nanoTime() - start;
        metrics.recordSuccess(modelId, status.name(), totalNanos, rendered.synthesisNanos());
        LOG.info("Synthesis complete: model={}, nativeRate={}Hz, rate={}Hz, cache={}, resampled={}, bytes={}, "
                        + "synthesisMs={}, resampleMs={}, totalMs={}",
                modelId, resolved.nativeSampleRate(), targetRate, status, rendered.resampled(), rendered.pcm().length,
                TimeUtils.nanosToMillis(rendered.synthesisNanos()), TimeUtils.nanosToMillis(rendered.resampleNanos()),
                TimeUtils.nanosToMillis(totalNanos));
        return new SynthesisResult(new AudioPayload(rendered.pcm(), targetRate), modelId, status,
                rendered.resampled(), TimeUtils.nanosToMillis(rendered.synthesisNanos()),
                TimeUtils.nanosToMillis(rendered.resampleNanos()), TimeUtils.nanosToMillis(totalNanos));
    }

    /**
     * Looks up {@code key}; returns null when the cache is disabled.
     */
    private CacheLookup lookup(String key) {
        if (!cache.isEnabled()) {
            metrics.recordCacheLookup("disabled");
            return null;
        }
        CacheLookup lookup;
        try {
            lookup = cache.get(key);
        } catch (RuntimeException e) {
            lookup = CacheLookup.unavailable(new CacheUnavailableException("get", e));
        }
        switch (lookup.outcome()) {
            case HIT -> metrics.recordCacheLookup("hit");
            case UNAVAILABLE -> {
                metrics.recordCacheLookup("error");
                LOG.warn("Cache unavailable, synthesizing without cache: {}", describe(lookup.error()));
            }
            default -> metrics.recordCacheLookup("miss");
        }
        return lookup;
    }

    private static CacheStatus statusOf(CacheLookup lookup) {
        if (lookup == null) {
            return CacheStatus.DISABLED;
        }
        return switch (lookup.outcome()) {
            case HIT -> CacheStatus.HIT;
            case UNAVAILABLE -> CacheStatus.ERROR;
            case MISS -> CacheStatus.MISS;
        };
    }

    private SynthesisResult cachedResult(byte[] pcm, String key, String modelId, int targetRate, long start) {
        long totalNanos = System.nanoTime() - start;
        metrics.recordSuccess(modelId, CacheStatus.HIT.name(), totalNanos, 0);
        LOG.info("Cache hit: model={}, rate={}Hz, bytes={}, totalMs={}",
                modelId, targetRate, pcm.length, TimeUtils.nanosToMillis(totalNanos));
        LOG.debug("Cache hit key={}", key);
        return new SynthesisResult(new AudioPayload(pcm, targetRate), modelId, CacheStatus.HIT, false, 0, 0,
                TimeUtils.nanosToMillis(totalNanos));
    }

    private Rendered render(VoiceModel model, String text, int targetRate, String key, boolean writeBack) {
        LOG.debug("Synthesizing with model={}: '{}'", model.id(), LogSanitizer.preview(text));
        long synthStart = System.nanoTime();
        byte[] pcm;
        try {
            pcm = engine.synthesize(model.handle(), text);
        } catch (SynthesisException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SynthesisException(engine.getEngineName() + " synthesis failed: " + e.getMessage(),
                    engine.getEngineName(), e);
        }
        long synthesisNanos = System.nanoTime() - synthStart;

        boolean resampled = targetRate != model.nativeSampleRate();
        long resampleNanos = 0;
        if (resampled) {
            long resampleStart = System.nanoTime();
            pcm = converter.convert(pcm, model.nativeSampleRate(), targetRate);
            resampleNanos = System.nanoTime() - resampleStart;
            metrics.recordResampled(model.nativeSampleRate(), targetRate);
        }
        if (writeBack) {
            store(key, pcm);
        }
        return new Rendered(pcm, resampled, synthesisNanos, resampleNanos);
    }

    private void store(String key, byte[] pcm) {
        try {
            cache.put(key, pcm, cacheTtl);
        } catch (CacheUnavailableException e) {
            metrics.recordCacheWriteFailure();
            LOG.warn("Cache write skipped: {}", describe(e));
        } catch (RuntimeException e) {
            metrics.recordCacheWriteFailure();
            LOG.warn("Cache write skipped: {}", e.toString());
        }
    }

    private String validateText(String text) {
        if (text == null || text.isEmpty()) {
            throw new InvalidRequestException("text", "must not be empty");
        }
        if (text.length() > synthesisProps.getMaxTextLength()) {
            throw new InvalidRequestException("text",
                    "length " + text.length() + " exceeds maximum of " + synthesisProps.getMaxTextLength());
        }
        return text;
    }

    private String effectiveModelId(String modelId) {
        String id = (modelId == null || modelId.isBlank()) ? modelProps.getDefaultModel() : modelId;
        return ModelFiles.requireValidId(id);
    }

    private Integer validateSampleRate(Integer rate) {
        if (rate == null) {
            return null;
        }
        if (rate <= 0) {
            throw new InvalidRequestException("sampleRate", "must be positive");
        }
        if (rate > synthesisProps.getMaxSampleRate()) {
            throw new InvalidRequestException("sampleRate",
                    rate + " exceeds maximum of " + synthesisProps.getMaxSampleRate());
        }
        return rate;
    }

    private static String describe(CacheUnavailableException e) {
        if (e == null) {
            return "unknown cache error";
        }
        Throwable cause = e.getCause();
        return cause == null ? e.getMessage() : e.getMessage() + " (" + cause.getClass().getSimpleName() + ")";
    }
}
