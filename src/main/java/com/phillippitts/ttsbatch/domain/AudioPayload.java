package com.phillippitts.ttsbatch.domain;

import java.util.Arrays;
import java.util.Objects;

/**
 * Headerless audio: signed 16-bit little-endian PCM, mono.
 *
 * <p>The sample rate is not encoded in the bytes; it is carried alongside as contract.
 *
 * @param pcm raw PCM bytes (even length)
 * @param sampleRate sample rate of {@code pcm} in Hz
 */
public record AudioPayload(byte[] pcm, int sampleRate) {

    /** Bytes per mono 16-bit frame. */
    public static final int BYTES_PER_SAMPLE = 2;

    public AudioPayload {
        Objects.requireNonNull(pcm, "pcm");
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be positive");
        }
    }

    public int size() {
        return pcm.length;
    }

    public int sampleCount() {
        return pcm.length / BYTES_PER_SAMPLE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AudioPayload other)) {
            return false;
        }
        return sampleRate == other.sampleRate && Arrays.equals(pcm, other.pcm);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(pcm) + sampleRate;
    }

    @Override
    public String toString() {
        return "AudioPayload[bytes=" + pcm.length + ", sampleRate=" + sampleRate + "]";
    }
}
