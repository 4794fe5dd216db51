package com.phillippitts.ttsbatch.service.audio;

/**
 * Resamples mono 16-bit little-endian PCM between sample rates.
 *
 * <p>Implementations must preserve duration: the output holds
 * {@code inputSamples * targetRate / sourceRate} samples, within one sample of rounding.
 * Rates are validated by the caller; implementations may throw
 * {@link IllegalArgumentException} for non-positive rates.
 */
public interface SampleRateConverter {

    /**
     * Converts {@code pcm} from {@code sourceRate} to {@code targetRate}.
     *
     * @param pcm PCM16LE mono samples at {@code sourceRate}
     * @param sourceRate input rate in Hz
     * @param targetRate output rate in Hz
     * @return PCM16LE mono samples at {@code targetRate}; {@code pcm} itself when the rates match
     */
    byte[] convert(byte[] pcm, int sourceRate, int targetRate);
}
