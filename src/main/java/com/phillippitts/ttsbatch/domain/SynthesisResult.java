package com.phillippitts.ttsbatch.domain;

import java.util.Objects;

/**
 * Outcome of a successful synthesis request: the audio plus how it was produced.
 *
 * @param payload audio at the requested sample rate
 * @param modelId effective model id (default applied)
 * @param cacheStatus cache participation
 * @param resampled true if the sample rate converter ran
 * @param synthesisMs time spent in the engine (0 on cache hit)
 * @param resampleMs time spent converting the sample rate (0 when not resampled)
 * @param totalMs end-to-end handling time
 */
public record SynthesisResult(
        AudioPayload payload,
        String modelId,
        CacheStatus cacheStatus,
        boolean resampled,
        long synthesisMs,
        long resampleMs,
        long totalMs
) {
    public SynthesisResult {
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(modelId, "modelId");
        Objects.requireNonNull(cacheStatus, "cacheStatus");
    }

    public int sampleRate() {
        return payload.sampleRate();
    }
}
