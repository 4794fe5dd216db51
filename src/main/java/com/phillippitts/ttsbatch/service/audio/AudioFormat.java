package com.phillippitts.ttsbatch.service.audio;

/**
 * Single source of truth for the service's audio wire format.
 * Always: 16-bit signed PCM, mono, little-endian, no header. The sample rate varies per request.
 */
public final class AudioFormat {

    /** Bits per sample. */
    public static final int BITS_PER_SAMPLE = 16;
    /** Number of channels (mono). */
    public static final int CHANNELS = 1;
    /** Bytes per PCM frame (sample for all channels). */
    public static final int BLOCK_ALIGN = (BITS_PER_SAMPLE / 8) * CHANNELS; // 2 bytes

    /** Media type for responses; parameters describe the layout since the body has no header. */
    public static final String MEDIA_TYPE = "audio/x-raw";
    public static final String MEDIA_FORMAT = "S16LE";

    private AudioFormat() {}

    /**
     * Returns the number of whole samples in a PCM buffer.
     */
    public static int sampleCount(byte[] pcm) {
        return pcm.length / BLOCK_ALIGN;
    }

    /**
     * Decodes little-endian 16-bit samples.
     */
    public static short[] toSamples(byte[] pcm) {
        short[] samples = new short[sampleCount(pcm)];
        for (int i = 0; i < samples.length; i++) {
            int lo = pcm[2 * i] & 0xFF;
            int hi = pcm[2 * i + 1];
            samples[i] = (short) ((hi << 8) | lo);
        }
        return samples;
    }

    /**
     * Encodes samples as little-endian 16-bit PCM.
     */
    public static byte[] toBytes(short[] samples) {
        byte[] out = new byte[samples.length * BLOCK_ALIGN];
        for (int i = 0; i < samples.length; i++) {
            out[2 * i] = (byte) (samples[i] & 0xFF);
            out[2 * i + 1] = (byte) ((samples[i] >> 8) & 0xFF);
        }
        return out;
    }
}
