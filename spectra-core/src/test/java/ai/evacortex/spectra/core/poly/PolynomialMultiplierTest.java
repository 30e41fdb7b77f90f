/*
 * Spectra — Radix-2 Fourier Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectra.core.poly;

import ai.evacortex.spectra.core.SpectraTestUtils;
import ai.evacortex.spectra.core.engine.FourierKernel;
import ai.evacortex.spectra.core.engine.IterativeKernel;
import ai.evacortex.spectra.core.engine.RecursiveKernel;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.Arrays;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class PolynomialMultiplierTest {

    private static final double EPS = 1e-6;

    static Stream<FourierKernel> kernels() {
        return Stream.of(new RecursiveKernel(), new IterativeKernel());
    }

    @ParameterizedTest
    @MethodSource("kernels")
    void trivialProduct(FourierKernel kernel) {
        double[] result = new PolynomialMultiplier(kernel).multiply(new double[]{1, 1}, new double[]{1, 1});
        assertEquals(4, result.length);
        assertArrayEquals(new double[]{1, 2, 1, 0}, result, EPS);
    }

    @ParameterizedTest
    @MethodSource("kernels")
    void basicProduct_matchesBruteForce(FourierKernel kernel) {
        double[] a = {4, 1, -4, 1, 1};
        double[] b = {4, 5, 0, -2};
        double[] fast = new PolynomialMultiplier(kernel).multiply(a, b);
        double[] slow = PolynomialMultiplier.bruteForceMultiply(a, b);

        assertEquals(16, fast.length);
        assertArrayEquals(slow, fast, EPS);
        assertArrayEquals(new double[]{16, 24, -11, -24, 7, 13, -2, -2},
                Arrays.copyOf(fast, 8), EPS);
    }

    @ParameterizedTest
    @MethodSource("kernels")
    void randomProduct_matchesBruteForce(FourierKernel kernel) {
        double[] a = SpectraTestUtils.randomCoefficients(500, 42);
        double[] b = SpectraTestUtils.randomCoefficients(377, 43);
        double[] fast = new PolynomialMultiplier(kernel).multiply(a, b);
        double[] slow = PolynomialMultiplier.bruteForceMultiply(a, b);

        assertEquals(slow.length, fast.length);
        for (int i = 0; i < fast.length; i++) {
            assertEquals(slow[i], fast[i], EPS, "coefficient " + i);
        }
    }

    @Test
    void largeProduct_constantTermIsAccurate() {
        double[] a = SpectraTestUtils.randomCoefficients(50_000, 42);
        double[] b = SpectraTestUtils.randomCoefficients(50_000, 4242);
        double[] result = new PolynomialMultiplier(new IterativeKernel()).multiply(a, b);

        assertEquals(131_072, result.length);
        assertEquals(a[0] * b[0], result[0], 1e-6, "error in constant term");
        double lead = a[a.length - 1] * b[b.length - 1];
        assertEquals(lead, result[a.length + b.length - 2], 1e-6, "error in leading term");
    }

    @Test
    void lengthInvariants_holdAndTailIsZero() {
        double[] a = SpectraTestUtils.randomCoefficients(37, 1);
        double[] b = SpectraTestUtils.randomCoefficients(5, 2);
        double[] result = new PolynomialMultiplier().multiply(a, b);

        assertEquals(PolynomialMultiplier.paddedLength(37, 5), result.length);
        assertTrue(result.length >= a.length + b.length - 1);
        for (int i = a.length + b.length - 1; i < result.length; i++) {
            assertEquals(0.0, result[i], EPS, "tail coefficient " + i);
        }
    }

    @Test
    void emptyOperand_yieldsZeroPolynomial() {
        PolynomialMultiplier multiplier = new PolynomialMultiplier();
        double[] result = multiplier.multiply(new double[0], new double[]{1, 2});
        assertEquals(4, result.length);
        assertArrayEquals(new double[4], result, EPS);

        double[] bothEmpty = multiplier.multiply(new double[0], new double[0]);
        assertEquals(1, bothEmpty.length);
        assertEquals(0.0, bothEmpty[0], EPS);
    }

    @Test
    void operandsAreNotModified() {
        double[] a = {1, 2, 3};
        double[] b = {4, 5};
        new PolynomialMultiplier().multiply(a, b);
        assertArrayEquals(new double[]{1, 2, 3}, a);
        assertArrayEquals(new double[]{4, 5}, b);
    }

    @Test
    void bruteForce_knownProduct() {
        assertArrayEquals(new double[]{1, 2, 1, 0},
                PolynomialMultiplier.bruteForceMultiply(new double[]{1, 1}, new double[]{1, 1}), 0.0);
    }

    @Test
    void nullArguments_throwNpe() {
        PolynomialMultiplier multiplier = new PolynomialMultiplier();
        assertThrows(NullPointerException.class, () -> multiplier.multiply(null, new double[]{1}));
        assertThrows(NullPointerException.class, () -> multiplier.multiply(new double[]{1}, null));
        assertThrows(NullPointerException.class, () -> PolynomialMultiplier.bruteForceMultiply(null, null));
    }
}
