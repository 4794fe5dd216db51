package com.phillippitts.ttsbatch.service.synthesis;

import com.phillippitts.ttsbatch.domain.VoiceHandle;
import com.phillippitts.ttsbatch.exception.SynthesisException;
import com.phillippitts.ttsbatch.service.model.ModelArtifact;

/**
 * Text-to-speech engine abstraction.
 *
 * <p>Implementations turn text into mono signed 16-bit little-endian PCM at the voice's native
 * sample rate. They must be safe for concurrent use across voices and requests.
 *
 * @since 1.0
 */
public interface SynthesisEngine {

    /**
     * Prepares a voice from its on-disk artifact.
     *
     * @param artifact published model files
     * @return handle used for subsequent {@link #synthesize} calls
     * @throws SynthesisException if the artifact cannot be loaded
     */
    VoiceHandle load(ModelArtifact artifact);

    /**
     * Synthesizes {@code text} with {@code voice}.
     *
     * @param voice handle returned by {@link #load}
     * @param text non-empty text, used verbatim
     * @return raw PCM at {@code voice.sampleRate()}
     * @throws SynthesisException on engine failure
     */
    byte[] synthesize(VoiceHandle voice, String text);

    /**
     * Returns the engine identifier (e.g., "piper").
     */
    String getEngineName();

    /**
     * Returns true if the engine is able to accept work.
     */
    boolean isHealthy();
}
