package com.phillippitts.ttsbatch.domain;

/**
 * Immutable synthesis request as received from the transport layer.
 *
 * <p>{@code modelId} and {@code targetSampleRate} are optional (null means "use the default
 * model" and "use the model's native rate"). Content validation (empty text, length and rate
 * bounds) is performed by the orchestrator, not here.
 *
 * @param text text to synthesize, used verbatim
 * @param modelId voice model identifier, or null for the configured default
 * @param targetSampleRate requested output rate in Hz, or null for the native rate
 */
public record SynthesisRequest(String text, String modelId, Integer targetSampleRate) {

    public static SynthesisRequest of(String text) {
        return new SynthesisRequest(text, null, null);
    }

    public static SynthesisRequest of(String text, String modelId, Integer targetSampleRate) {
        return new SynthesisRequest(text, modelId, targetSampleRate);
    }
}
