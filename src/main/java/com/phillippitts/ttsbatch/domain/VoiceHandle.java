package com.phillippitts.ttsbatch.domain;

/**
 * Engine-specific resource for a loaded voice. Opaque to everything except the engine
 * that produced it.
 */
public interface VoiceHandle {

    /** Logical model id this handle was loaded for. */
    String modelId();

    /** Rate in Hz at which the engine produces audio for this voice. */
    int sampleRate();
}
