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

/**
 * {@code FourierKernel} defines the interface for computing the Discrete Fourier Transform of a
 * complex sequence whose length is a power of two.
 *
 * <p>The forward transform of a sequence x of length n is:</p>
 * <pre>
 *     X[k] = Σ_{j=0}^{n-1} x[j] · e^{-2πi·jk/n}
 * </pre>
 *
 * <p>and the inverse transform is:</p>
 * <pre>
 *     x[j] = (1/n) · Σ_{k=0}^{n-1} X[k] · e^{+2πi·jk/n}
 * </pre>
 *
 * <p>so that {@code transform(transform(x, false), true)} recovers {@code x} up to floating-point
 * rounding. Implementations decompose the sequence radix-2 (Cooley–Tukey): the even- and
 * odd-indexed halves are transformed independently and recombined with the butterfly</p>
 * <pre>
 *     out[i]       = even[i] + ω^i · odd[i]
 *     out[i + n/2] = even[i] - ω^i · odd[i]
 * </pre>
 *
 * <p>Implementations must be deterministic and free of side effects: the input array is never
 * modified and a freshly allocated array is returned on every call. They never pad; callers
 * size their buffers with {@link ai.evacortex.spectra.core.math.PowerOfTwo#ceiling(int)}.</p>
 *
 * @see RecursiveKernel
 * @see IterativeKernel
 * @see FourierEngine
 */
public interface FourierKernel {

    /**
     * Computes the forward or inverse DFT of {@code sequence}.
     *
     * @param sequence input of length 2^k, k &ge; 0; left untouched
     * @param inverse {@code true} for the inverse transform (scaled by 1/n)
     * @return a new array with the transformed sequence, same length as the input
     * @throws InvalidLengthException if the length is not a power of two
     * @throws NullPointerException if {@code sequence} is {@code null}
     */
    Complex[] transform(Complex[] sequence, boolean inverse);

    default Complex[] forward(Complex[] sequence) {
        return transform(sequence, false);
    }

    default Complex[] inverse(Complex[] spectrum) {
        return transform(spectrum, true);
    }

    /**
     * Forward transform of a real-valued sequence.
     */
    default Complex[] forward(double[] sequence) {
        return transform(Complex.fromReal(sequence), false);
    }
}
