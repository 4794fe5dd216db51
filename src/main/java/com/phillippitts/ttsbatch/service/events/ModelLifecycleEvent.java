package com.phillippitts.ttsbatch.service.events;

import com.phillippitts.ttsbatch.domain.ModelState;

import java.time.Instant;

/**
 * Published whenever a voice model changes state in the registry.
 *
 * <p>PII note: carries model ids and technical diagnostics only, never request text.
 *
 * @param modelId model whose state changed
 * @param state new state
 * @param at transition time
 * @param message short description (failure reason for {@link ModelState#FAILED})
 * @param durationMs acquisition time for terminal states, {@code -1} otherwise
 * @param cause failure cause (null unless {@code FAILED})
 */
public record ModelLifecycleEvent(
        String modelId,
        ModelState state,
        Instant at,
        String message,
        long durationMs,
        Throwable cause
) {
    public ModelLifecycleEvent {
        if (at == null) {
            at = Instant.now();
        }
    }

    public static ModelLifecycleEvent resolving(String modelId) {
        return new ModelLifecycleEvent(modelId, ModelState.RESOLVING, null, "acquisition started", -1, null);
    }

    public static ModelLifecycleEvent ready(String modelId, long durationMs) {
        return new ModelLifecycleEvent(modelId, ModelState.READY, null, "ready", durationMs, null);
    }

    public static ModelLifecycleEvent failed(String modelId, long durationMs, Throwable cause) {
        String message = cause == null ? "failed" : cause.getMessage();
        return new ModelLifecycleEvent(modelId, ModelState.FAILED, null, message, durationMs, cause);
    }
}
