package com.phillippitts.ttsbatch.service.audio;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rational-ratio resampler: upsample by L, low-pass filter, downsample by M, computed in
 * polyphase form so only the filter taps that touch real input samples are evaluated.
 *
 * <p>The anti-aliasing filter is a Kaiser-windowed sinc (beta 5.0) with cutoff at the lower of
 * the two Nyquist frequencies and {@value #HALF_LENGTH_FACTOR} zero crossings per side.
 * The filter delay is compensated, so output sample {@code k} is time-aligned with input time
 * {@code k * M / L}. Output length is {@code ceil(n * L / M)}.
 *
 * <p>Coefficients are cached per (L, M) pair in a small LRU map. Filters longer than
 * {@value #MAX_CACHED_TAPS} taps (rates nearly coprime with the native rate) are designed per call
 * and never retained; retained coefficients are bounded at about 8 MiB.
 *
 * <p><b>Thread Safety:</b> stateless apart from the synchronized coefficient cache.
 */
@Component
public class PolyphaseSampleRateConverter implements SampleRateConverter {

    private static final Logger LOG = LogManager.getLogger(PolyphaseSampleRateConverter.class);

    static final int HALF_LENGTH_FACTOR = 10;
    private static final double KAISER_BETA = 5.0;

    static final int MAX_CACHED_FILTERS = 16;
    static final int MAX_CACHED_TAPS = 65_536;

    private final Map<Long, double[]> filters = Collections.synchronizedMap(
            new LinkedHashMap<Long, double[]>(MAX_CACHED_FILTERS, 0.75f, true) {
                @Override
                protected boolean removeEldestEntry(Map.Entry<Long, double[]> eldest) {
                    return size() > MAX_CACHED_FILTERS;
                }
            });

    @Override
    public byte[] convert(byte[] pcm, int sourceRate, int targetRate) {
        if (pcm == null) {
            throw new IllegalArgumentException("pcm must not be null");
        }
        if (sourceRate <= 0 || targetRate <= 0) {
            throw new IllegalArgumentException("Invalid sample rates: " + sourceRate + " -> " + targetRate);
        }
        if (sourceRate == targetRate || pcm.length < AudioFormat.BLOCK_ALIGN) {
            return pcm;
        }

        int gcd = gcd(sourceRate, targetRate);
        int up = targetRate / gcd;
        int down = sourceRate / gcd;
        double[] h = filter(up, down);

        short[] in = AudioFormat.toSamples(pcm);
        short[] out = resample(in, up, down, h);
        LOG.debug("Resampled {} -> {} samples ({} Hz -> {} Hz, L={}, M={}, taps={})",
                in.length, out.length, sourceRate, targetRate, up, down, h.length);
        return AudioFormat.toBytes(out);
    }

    private double[] filter(int up, int down) {
        if (tapCount(up, down) > MAX_CACHED_TAPS) {
            return designFilter(up, down);
        }
        return filters.computeIfAbsent(((long) up << 32) | down, k -> designFilter(up, down));
    }

    // Visible for tests
    int cachedFilterCount() {
        return filters.size();
    }

    static long tapCount(int up, int down) {
        return 2L * HALF_LENGTH_FACTOR * Math.max(up, down) + 1;
    }

    private static short[] resample(short[] x, int up, int down, double[] h) {
        int n = x.length;
        int taps = h.length;
        int delay = (taps - 1) / 2;
        int outLength = (int) (((long) n * up + down - 1) / down);
        short[] y = new short[outLength];

        for (int k = 0; k < outLength; k++) {
            // position in the upsampled stream, shifted by the filter delay
            long t = (long) k * down + delay;
            long jMax = Math.min(n - 1L, t / up);
            long jMin = Math.max(0L, ceilDiv(t - (taps - 1), up));
            double acc = 0.0;
            for (long j = jMin; j <= jMax; j++) {
                acc += x[(int) j] * h[(int) (t - j * up)];
            }
            y[k] = clamp(acc);
        }
        return y;
    }

    /**
     * Windowed-sinc low-pass for the upsampled rate, normalized to unity DC gain and scaled by
     * {@code up} to restore the energy lost by zero-stuffing.
     */
    static double[] designFilter(int up, int down) {
        int maxRate = Math.max(up, down);
        int halfLength = HALF_LENGTH_FACTOR * maxRate;
        int taps = (int) tapCount(up, down);
        double cutoff = 1.0 / maxRate;
        double i0Beta = besselI0(KAISER_BETA);

        double[] h = new double[taps];
        double sum = 0.0;
        for (int i = 0; i < taps; i++) {
            double m = i - halfLength;
            double ratio = (2.0 * i / (taps - 1)) - 1.0;
            double window = besselI0(KAISER_BETA * Math.sqrt(Math.max(0.0, 1.0 - ratio * ratio))) / i0Beta;
            h[i] = cutoff * sinc(cutoff * m) * window;
            sum += h[i];
        }
        double scale = up / sum;
        for (int i = 0; i < taps; i++) {
            h[i] *= scale;
        }
        return h;
    }

    private static double sinc(double x) {
        if (x == 0.0) {
            return 1.0;
        }
        double px = Math.PI * x;
        return Math.sin(px) / px;
    }

    // Zeroth-order modified Bessel function of the first kind (power series).
    private static double besselI0(double x) {
        double sum = 1.0;
        double term = 1.0;
        double halfX = x / 2.0;
        for (int k = 1; k < 50; k++) {
            term *= (halfX / k) * (halfX / k);
            sum += term;
            if (term < sum * 1e-12) {
                break;
            }
        }
        return sum;
    }

    private static short clamp(double v) {
        long r = Math.round(v);
        if (r > Short.MAX_VALUE) {
            return Short.MAX_VALUE;
        }
        if (r < Short.MIN_VALUE) {
            return Short.MIN_VALUE;
        }
        return (short) r;
    }

    private static long ceilDiv(long a, long b) {
        return -Math.floorDiv(-a, b);
    }

    private static int gcd(int a, int b) {
        while (b != 0) {
            int t = a % b;
            a = b;
            b = t;
        }
        return a;
    }
}
