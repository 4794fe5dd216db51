package com.phillippitts.ttsbatch.service.synthesis;

import com.phillippitts.ttsbatch.domain.VoiceHandle;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Loaded Piper voice: the validated model files plus the rate they produce.
 */
record PiperVoice(String modelId, int sampleRate, Path modelFile, Path configFile) implements VoiceHandle {

    PiperVoice {
        Objects.requireNonNull(modelId, "modelId");
        Objects.requireNonNull(modelFile, "modelFile");
        Objects.requireNonNull(configFile, "configFile");
    }
}
