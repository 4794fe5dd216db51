package com.phillippitts.ttsbatch.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of one voice model's registry state.
 *
 * <p>The registry publishes a new instance on every transition; readers never observe a
 * partially updated record.
 *
 * @param id logical model id
 * @param nativeSampleRate engine output rate in Hz (0 until READY)
 * @param state lifecycle state
 * @param handle engine resource, non-null only when READY
 * @param failureReason last failure message, non-null only when FAILED
 * @param updatedAt time of the transition that produced this snapshot
 */
public record VoiceModel(
        String id,
        int nativeSampleRate,
        ModelState state,
        VoiceHandle handle,
        String failureReason,
        Instant updatedAt
) {
    public VoiceModel {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(state, "state");
        if (state == ModelState.READY && handle == null) {
            throw new IllegalArgumentException("READY model requires a handle");
        }
        if (updatedAt == null) {
            updatedAt = Instant.now();
        }
    }

    public static VoiceModel unresolved(String id) {
        return new VoiceModel(id, 0, ModelState.UNRESOLVED, null, null, Instant.now());
    }

    public VoiceModel resolving() {
        return new VoiceModel(id, 0, ModelState.RESOLVING, null, null, Instant.now());
    }

    public VoiceModel ready(VoiceHandle voiceHandle) {
        return new VoiceModel(id, voiceHandle.sampleRate(), ModelState.READY, voiceHandle, null, Instant.now());
    }

    public VoiceModel failed(String reason) {
        return new VoiceModel(id, 0, ModelState.FAILED, null, reason, Instant.now());
    }

    public boolean isReady() {
        return state == ModelState.READY;
    }
}
