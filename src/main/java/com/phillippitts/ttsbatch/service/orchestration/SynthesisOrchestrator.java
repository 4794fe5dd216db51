package com.phillippitts.ttsbatch.service.orchestration;

import com.phillippitts.ttsbatch.domain.SynthesisRequest;
import com.phillippitts.ttsbatch.domain.SynthesisResult;
import com.phillippitts.ttsbatch.exception.InvalidRequestException;
import com.phillippitts.ttsbatch.exception.ModelUnavailableException;
import com.phillippitts.ttsbatch.exception.SynthesisException;

/**
 * Turns a synthesis request into audio, serving from the cache when possible.
 *
 * <p>Cache failures never surface from this interface; the request is synthesized instead.
 *
 * @since 1.0
 */
public interface SynthesisOrchestrator {

    /**
     * Handles one request end to end.
     *
     * @param request request as received, defaults not yet applied
     * @return audio plus provenance (cache status, resampling, timings)
     * @throws InvalidRequestException if text, model id or sample rate are invalid
     * @throws ModelUnavailableException if the voice model cannot be resolved
     * @throws SynthesisException if the engine fails
     */
    SynthesisResult synthesize(SynthesisRequest request);
}
