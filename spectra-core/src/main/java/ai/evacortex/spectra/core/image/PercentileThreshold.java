/*
 * Spectra — Radix-2 Fourier Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectra.core.image;

import ai.evacortex.spectra.core.exceptions.InvalidRateException;
import ai.evacortex.spectra.core.math.Complex;

import java.util.Arrays;

/**
 * Magnitude-percentile quantization of a 2D spectrum.
 *
 * <p>The threshold is the {@code rate}-th percentile of all magnitudes, interpolated linearly
 * between the two closest ranks. Every entry whose magnitude is strictly below the threshold is
 * replaced by zero, so rate 0 keeps everything and rate 100 keeps only the entries tied for the
 * largest magnitude.</p>
 */
public final class PercentileThreshold {

    private PercentileThreshold() {}

    public static void checkRate(int rate) {
        if (rate < 0 || rate > 100) {
            throw new InvalidRateException(rate);
        }
    }

    public static double percentile(double[] values, int rate) {
        checkRate(rate);
        if (values.length == 0) {
            throw new IllegalArgumentException("percentile of an empty set");
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);

        double h = (sorted.length - 1) * (rate / 100.0);
        int lo = (int) Math.floor(h);
        int hi = Math.min(lo + 1, sorted.length - 1);
        double frac = h - lo;
        return sorted[lo] + frac * (sorted[hi] - sorted[lo]);
    }

    public static double[] magnitudes(Complex[][] spectrum) {
        int rows = spectrum.length;
        int cols = rows == 0 ? 0 : spectrum[0].length;
        double[] out = new double[rows * cols];
        int k = 0;
        for (Complex[] row : spectrum) {
            for (Complex v : row) {
                out[k++] = v.abs();
            }
        }
        return out;
    }

    /**
     * Zeroes the small-magnitude entries of {@code spectrum} in place.
     *
     * @return the threshold that was applied
     */
    public static double apply(Complex[][] spectrum, int rate) {
        double[] mags = magnitudes(spectrum);
        double threshold = percentile(mags, rate);

        int k = 0;
        for (Complex[] row : spectrum) {
            for (int c = 0; c < row.length; c++) {
                if (mags[k++] < threshold) {
                    row[c] = Complex.ZERO;
                }
            }
        }
        return threshold;
    }
}
