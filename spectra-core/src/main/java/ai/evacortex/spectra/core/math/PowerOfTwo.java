/*
 * Spectra — Radix-2 Fourier Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectra.core.math;

/**
 * Power-of-two helpers used to size transform buffers.
 */
public final class PowerOfTwo {

    public static final int MAX = 1 << 30;

    private PowerOfTwo() {}

    public static boolean isPowerOfTwo(int n) {
        return n > 0 && (n & (n - 1)) == 0;
    }

    /**
     * Smallest power of two that is not smaller than {@code n}. {@code ceiling(0)} is 1.
     *
     * @throws IllegalArgumentException if {@code n} is negative or above {@link #MAX}
     */
    public static int ceiling(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("n must be non-negative: " + n);
        }
        if (n > MAX) {
            throw new IllegalArgumentException("No int power of two >= " + n);
        }
        if (n <= 1) return 1;
        return Integer.highestOneBit(n - 1) << 1;
    }

    public static int log2(int n) {
        if (!isPowerOfTwo(n)) {
            throw new IllegalArgumentException("Not a power of two: " + n);
        }
        return Integer.numberOfTrailingZeros(n);
    }
}
