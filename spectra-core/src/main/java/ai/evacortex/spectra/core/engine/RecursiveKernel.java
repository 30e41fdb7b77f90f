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
 * Direct recursive radix-2 transform. The inverse halves every output at each recursion level,
 * which compounds to 1/n over log2(n) levels.
 */
public final class RecursiveKernel implements FourierKernel {

    @Override
    public Complex[] transform(Complex[] sequence, boolean inverse) {
        Objects.requireNonNull(sequence, "sequence must not be null");
        if (!PowerOfTwo.isPowerOfTwo(sequence.length)) {
            throw new InvalidLengthException(sequence.length);
        }
        return fft(sequence, inverse);
    }

    private static Complex[] fft(Complex[] a, boolean inverse) {
        int n = a.length;
        if (n == 1) {
            return new Complex[]{a[0]};
        }

        int half = n >>> 1;
        Complex[] evens = new Complex[half];
        Complex[] odds = new Complex[half];
        for (int i = 0; i < half; i++) {
            evens[i] = a[2 * i];
            odds[i] = a[2 * i + 1];
        }

        Complex[] evenFft = fft(evens, inverse);
        Complex[] oddFft = fft(odds, inverse);

        double sign = inverse ? 1.0 : -1.0;
        double mult = inverse ? 0.5 : 1.0;

        Complex[] out = new Complex[n];
        for (int i = 0; i < half; i++) {
            Complex omega = Complex.unit(sign * 2.0 * Math.PI * i / n);
            Complex t = omega.multiply(oddFft[i]);
            out[i] = evenFft[i].add(t).scale(mult);
            out[i + half] = evenFft[i].subtract(t).scale(mult);
        }
        return out;
    }
}
