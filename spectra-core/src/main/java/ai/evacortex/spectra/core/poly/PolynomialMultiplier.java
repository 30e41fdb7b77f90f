/*
 * Spectra — Radix-2 Fourier Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectra.core.poly;

import ai.evacortex.spectra.core.engine.FourierEngine;
import ai.evacortex.spectra.core.engine.FourierKernel;
import ai.evacortex.spectra.core.math.Complex;
import ai.evacortex.spectra.core.math.PowerOfTwo;

import java.util.Objects;

/**
 * Multiplies polynomials given as coefficient arrays in ascending order of power
 * (index i multiplies X^i).
 *
 * <p>The product coefficients are the convolution of the operands. By the convolution theorem</p>
 * <pre>
 *     a * b = F⁻¹( F(a) · F(b) )
 * </pre>
 * <p>where · is the element-wise product. Both operands are zero-padded to
 * {@code m = ceiling(2 · max(len(a), len(b)))} so that the circular convolution computed by the
 * transform does not wrap around.</p>
 */
public class PolynomialMultiplier {

    private final FourierKernel kernel;

    public PolynomialMultiplier() {
        this(FourierEngine.backend());
    }

    public PolynomialMultiplier(FourierKernel kernel) {
        this.kernel = Objects.requireNonNull(kernel, "kernel must not be null");
    }

    /**
     * @return product coefficients, length {@link #paddedLength(int, int)}; entries at indices
     *         {@code >= len(a) + len(b) - 1} are numerically zero
     */
    public double[] multiply(double[] a, double[] b) {
        Objects.requireNonNull(a, "a must not be null");
        Objects.requireNonNull(b, "b must not be null");

        int m = paddedLength(a.length, b.length);

        Complex[] ftA = kernel.forward(pad(a, m));
        Complex[] ftB = kernel.forward(pad(b, m));

        Complex[] product = new Complex[m];
        for (int i = 0; i < m; i++) {
            product[i] = ftA[i].multiply(ftB[i]);
        }

        return Complex.realParts(kernel.inverse(product));
    }

    /**
     * Direct O(len(a)·len(b)) convolution. Used as a reference for {@link #multiply}; the result
     * has the same length.
     */
    public static double[] bruteForceMultiply(double[] a, double[] b) {
        Objects.requireNonNull(a, "a must not be null");
        Objects.requireNonNull(b, "b must not be null");

        double[] c = new double[paddedLength(a.length, b.length)];
        for (int i = 0; i < a.length; i++) {
            if (a[i] == 0.0) continue;
            for (int j = 0; j < b.length; j++) {
                c[i + j] += a[i] * b[j];
            }
        }
        return c;
    }

    public static int paddedLength(int lenA, int lenB) {
        return PowerOfTwo.ceiling(2 * Math.max(lenA, lenB));
    }

    private static double[] pad(double[] coefficients, int m) {
        double[] out = new double[m];
        System.arraycopy(coefficients, 0, out, 0, coefficients.length);
        return out;
    }
}
