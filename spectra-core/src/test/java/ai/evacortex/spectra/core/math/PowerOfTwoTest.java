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

class PowerOfTwoTest {

    @Test
    void ceiling_knownValues() {
        assertEquals(1, PowerOfTwo.ceiling(1));
        assertEquals(2, PowerOfTwo.ceiling(2));
        assertEquals(4, PowerOfTwo.ceiling(3));
        assertEquals(1024, PowerOfTwo.ceiling(1024));
        assertEquals(2048, PowerOfTwo.ceiling(1025));
    }

    @Test
    void ceiling_ofZeroIsOne() {
        assertEquals(1, PowerOfTwo.ceiling(0));
    }

    @Test
    void ceiling_rejectsNegativeAndOverflow() {
        assertThrows(IllegalArgumentException.class, () -> PowerOfTwo.ceiling(-1));
        assertThrows(IllegalArgumentException.class, () -> PowerOfTwo.ceiling(PowerOfTwo.MAX + 1));
        assertEquals(PowerOfTwo.MAX, PowerOfTwo.ceiling(PowerOfTwo.MAX));
    }

    @Test
    void isPowerOfTwo() {
        assertTrue(PowerOfTwo.isPowerOfTwo(1));
        assertTrue(PowerOfTwo.isPowerOfTwo(64));
        assertFalse(PowerOfTwo.isPowerOfTwo(0));
        assertFalse(PowerOfTwo.isPowerOfTwo(-4));
        assertFalse(PowerOfTwo.isPowerOfTwo(12));
    }

    @Test
    void log2() {
        assertEquals(0, PowerOfTwo.log2(1));
        assertEquals(10, PowerOfTwo.log2(1024));
        assertThrows(IllegalArgumentException.class, () -> PowerOfTwo.log2(6));
    }
}
