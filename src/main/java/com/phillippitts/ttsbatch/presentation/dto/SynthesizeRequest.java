package com.phillippitts.ttsbatch.presentation.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.phillippitts.ttsbatch.domain.SynthesisRequest;

/**
 * JSON body of {@code POST /synthesize}.
 *
 * <pre>
 * {"text": "Hello world", "model": "en_US-kathleen-low", "sampleRate": 16000}
 * </pre>
 *
 * <p>{@code sample_rate} is accepted as an alias of {@code sampleRate}. Only {@code text} is
 * required; validation happens in the orchestrator so every entry point shares it.
 */
public record SynthesizeRequest(
        String text,
        String model,
        @JsonAlias("sample_rate") Integer sampleRate
) {
    public SynthesisRequest toDomain() {
        return SynthesisRequest.of(text, model, sampleRate);
    }
}
