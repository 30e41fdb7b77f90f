/*
 * Spectra — Radix-2 Fourier Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectra.core.math;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ComplexTest {

    @Test
    void multiply_followsComplexRules() {
        Complex a = new Complex(1, 2);
        Complex b = new Complex(3, -1);
        assertEquals(new Complex(5, 5), a.multiply(b));
    }

    @Test
    void unit_liesOnUnitCircle() {
        Complex w = Complex.unit(Math.PI / 2);
        assertEquals(0.0, w.real, 1e-15);
        assertEquals(1.0, w.imag, 1e-15);
        assertEquals(1.0, Complex.unit(1.234).abs(), 1e-15);
    }

    @Test
    void realConversions() {
        double[] values = {1.5, -2.0, 0.0};
        Complex[] c = Complex.fromReal(values);
        assertEquals(0.0, c[1].imag);
        assertArrayEquals(values, Complex.realParts(c));
    }

    @Test
    void isZero_acceptsNegativeZero() {
        assertTrue(Complex.ZERO.isZero());
        assertTrue(new Complex(-0.0, 0.0).isZero());
        assertFalse(new Complex(0.0, 1e-300).isZero());
    }
}
