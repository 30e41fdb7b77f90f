/*
 * Spectra — Radix-2 Fourier Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectra.core.engine;

import ai.evacortex.spectra.core.exceptions.InvalidLengthException;
import ai.evacortex.spectra.core.math.Complex;
import ai.evacortex.spectra.core.math.PowerOfTwo;

import java.util.Objects;

/**
 * Bit-reversal radix-2 transform on split real/imaginary buffers. The inverse is scaled by 1/n
 * once, after the last butterfly pass.
 */
public final class IterativeKernel implements FourierKernel {

    public static final int DEFAULT_CACHE_SIZE = 32;

    private final TwiddleCache twiddles;

    public IterativeKernel() {
        this(new TwiddleCache(DEFAULT_CACHE_SIZE));
    }

    public IterativeKernel(TwiddleCache twiddles) {
        this.twiddles = Objects.requireNonNull(twiddles, "twiddles must not be null");
    }

    @Override
    public Complex[] transform(Complex[] sequence, boolean inverse) {
        Objects.requireNonNull(sequence, "sequence must not be null");
        int n = sequence.length;
        if (!PowerOfTwo.isPowerOfTwo(n)) {
            throw new InvalidLengthException(n);
        }

        double[] re = new double[n];
        double[] im = new double[n];
        for (int i = 0; i < n; i++) {
            re[i] = sequence[i].real;
            im[i] = sequence[i].imag;
        }

        transformInPlace(re, im, inverse);

        Complex[] out = new Complex[n];
        for (int i = 0; i < n; i++) {
            out[i] = new Complex(re[i], im[i]);
        }
        return out;
    }

    /**
     * Transforms the split real/imaginary buffers in place. Both arrays must have the same
     * power-of-two length.
     */
    public void transformInPlace(double[] re, double[] im, boolean inverse) {
        int n = re.length;
        if (im.length != n) {
            throw new IllegalArgumentException("Mismatched buffers: " + n + " vs " + im.length);
        }
        if (!PowerOfTwo.isPowerOfTwo(n)) {
            throw new InvalidLengthException(n);
        }
        if (n == 1) return;

        bitReverse(re, im);

        TwiddleCache.Twiddles tw = twiddles.get(n);
        double[] cos = tw.cos();
        double[] sin = tw.sin();
        double sign = inverse ? -1.0 : 1.0;

        for (int len = 2; len <= n; len <<= 1) {
            int half = len >>> 1;
            int stride = n / len;
            for (int start = 0; start < n; start += len) {
                for (int k = 0; k < half; k++) {
                    double wr = cos[k * stride];
                    double wi = sign * sin[k * stride];

                    int p = start + k;
                    int q = p + half;
                    double tr = wr * re[q] - wi * im[q];
                    double ti = wr * im[q] + wi * re[q];

                    re[q] = re[p] - tr;
                    im[q] = im[p] - ti;
                    re[p] += tr;
                    im[p] += ti;
                }
            }
        }

        if (inverse) {
            double scale = 1.0 / n;
            for (int i = 0; i < n; i++) {
                re[i] *= scale;
                im[i] *= scale;
            }
        }
    }

    private static void bitReverse(double[] re, double[] im) {
        int n = re.length;
        for (int i = 1, j = 0; i < n; i++) {
            int bit = n >>> 1;
            for (; (j & bit) != 0; bit >>>= 1) {
                j ^= bit;
            }
            j ^= bit;
            if (i < j) {
                double t = re[i]; re[i] = re[j]; re[j] = t;
                t = im[i]; im[i] = im[j]; im[j] = t;
            }
        }
    }
}
