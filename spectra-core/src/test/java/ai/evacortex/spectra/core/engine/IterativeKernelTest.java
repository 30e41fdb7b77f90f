/*
 * Spectra — Radix-2 Fourier Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectra.core.engine;

import ai.evacortex.spectra.core.SpectraTestUtils;
import ai.evacortex.spectra.core.exceptions.InvalidLengthException;
import ai.evacortex.spectra.core.math.Complex;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Modifier;

import static ai.evacortex.spectra.core.SpectraTestUtils.assertComplexArrayEquals;
import static org.junit.jupiter.api.Assertions.*;

class IterativeKernelTest {

    @Test
    void agreesWithRecursiveKernel() {
        FourierKernel recursive = new RecursiveKernel();
        FourierKernel iterative = new IterativeKernel();
        for (int n = 1; n <= 2048; n <<= 1) {
            Complex[] x = SpectraTestUtils.randomSequence(n, 1000 + n);
            assertComplexArrayEquals(recursive.transform(x, false), iterative.transform(x, false), 1e-9);
            assertComplexArrayEquals(recursive.transform(x, true), iterative.transform(x, true), 1e-9);
        }
    }

    @Test
    void transformInPlace_rejectsMismatchedBuffers() {
        IterativeKernel kernel = new IterativeKernel();
        assertThrows(IllegalArgumentException.class,
                () -> kernel.transformInPlace(new double[4], new double[8], false));
        assertThrows(InvalidLengthException.class,
                () -> kernel.transformInPlace(new double[6], new double[6], false));
    }

    @Test
    void twiddleCache_isBounded() {
        TwiddleCache cache = new TwiddleCache(2);
        IterativeKernel kernel = new IterativeKernel(cache);
        for (int n = 2; n <= 1024; n <<= 1) {
            kernel.transform(SpectraTestUtils.randomSequence(n, n), false);
        }
        assertTrue(cache.size() <= 2, "cache must respect its maximum size, was " + cache.size());
    }

    @Test
    void twiddleCache_valuesAreForwardRoots() {
        TwiddleCache.Twiddles tw = new TwiddleCache(1).get(8);
        assertEquals(4, tw.cos().length);
        assertEquals(1.0, tw.cos()[0], 1e-15);
        assertEquals(0.0, tw.sin()[0], 1e-15);
        assertEquals(0.0, tw.cos()[2], 1e-15);
        assertEquals(-1.0, tw.sin()[2], 1e-15);
    }

    @Test
    void twiddleTables_areNotReachableOutsideTheEngine() throws NoSuchMethodException {
        assertFalse(Modifier.isPublic(TwiddleCache.class.getDeclaredMethod("get", int.class).getModifiers()));
        assertFalse(Modifier.isPublic(TwiddleCache.Twiddles.class.getModifiers()));
    }

    @Test
    void sharedCache_givesStableResultsAcrossTransforms() {
        TwiddleCache cache = new TwiddleCache(4);
        FourierKernel first = new IterativeKernel(cache);
        FourierKernel second = new IterativeKernel(cache);
        Complex[] impulse = {Complex.ZERO, new Complex(1, 0), Complex.ZERO, Complex.ZERO};
        Complex[] expected = {new Complex(1, 0), new Complex(0, -1), new Complex(-1, 0), new Complex(0, 1)};
        for (int i = 0; i < 3; i++) {
            assertComplexArrayEquals(expected, first.transform(impulse, false), 1e-12);
            assertComplexArrayEquals(expected, second.transform(impulse, false), 1e-12);
        }
    }

    @Test
    void twiddleCache_rejectsInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new TwiddleCache(0));
        assertThrows(IllegalArgumentException.class, () -> new TwiddleCache(1).get(12));
    }
}
