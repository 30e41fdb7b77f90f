/*
 * Spectra — Radix-2 Fourier Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectra.core;

import ai.evacortex.spectra.core.image.ImageGrid;
import ai.evacortex.spectra.core.math.Complex;

import java.util.Random;

/**
 * Utility class for creating synthetic sequences and images for testing.
 */
public class SpectraTestUtils {

    public static Complex[] randomSequence(int length, long seed) {
        Random random = new Random(seed);
        Complex[] out = new Complex[length];
        for (int i = 0; i < length; i++) {
            out[i] = new Complex(random.nextDouble() * 2 - 1, random.nextDouble() * 2 - 1);
        }
        return out;
    }

    public static double[] randomCoefficients(int length, long seed) {
        Random random = new Random(seed);
        double[] out = new double[length];
        for (int i = 0; i < length; i++) {
            out[i] = random.nextDouble();
        }
        return out;
    }

    /**
     * Reference O(n²) DFT with the forward sign convention e^{-2πi·jk/n}.
     */
    public static Complex[] naiveDft(Complex[] x) {
        int n = x.length;
        Complex[] out = new Complex[n];
        for (int k = 0; k < n; k++) {
            double re = 0.0;
            double im = 0.0;
            for (int j = 0; j < n; j++) {
                double theta = -2.0 * Math.PI * ((long) j * k % n) / n;
                double c = Math.cos(theta);
                double s = Math.sin(theta);
                re += x[j].real * c - x[j].imag * s;
                im += x[j].real * s + x[j].imag * c;
            }
            out[k] = new Complex(re, im);
        }
        return out;
    }

    /**
     * Smooth test image: red ramps along columns, green along rows, blue is a soft diagonal.
     */
    public static ImageGrid gradientImage(int height, int width) {
        int[][][] px = new int[height][width][ImageGrid.CHANNELS];
        for (int r = 0; r < height; r++) {
            for (int c = 0; c < width; c++) {
                px[r][c][0] = width == 1 ? 0 : c * 255 / (width - 1);
                px[r][c][1] = height == 1 ? 0 : r * 255 / (height - 1);
                px[r][c][2] = (r + c) * 255 / Math.max(1, height + width - 2);
            }
        }
        return new ImageGrid(px);
    }

    public static ImageGrid randomImage(int height, int width, long seed) {
        Random random = new Random(seed);
        int[][][] px = new int[height][width][ImageGrid.CHANNELS];
        for (int r = 0; r < height; r++) {
            for (int c = 0; c < width; c++) {
                for (int ch = 0; ch < ImageGrid.CHANNELS; ch++) {
                    px[r][c][ch] = random.nextInt(256);
                }
            }
        }
        return new ImageGrid(px);
    }

    public static ImageGrid uniformImage(int height, int width, int r, int g, int b) {
        int[][][] px = new int[height][width][];
        for (int i = 0; i < height; i++) {
            for (int j = 0; j < width; j++) {
                px[i][j] = new int[]{r, g, b};
            }
        }
        return new ImageGrid(px);
    }

    public static void assertComplexEquals(Complex expected, Complex actual, double eps, String message) {
        if (Math.abs(expected.real - actual.real) > eps || Math.abs(expected.imag - actual.imag) > eps) {
            throw new AssertionError(message + ": expected " + expected + " but was " + actual);
        }
    }

    public static void assertComplexArrayEquals(Complex[] expected, Complex[] actual, double eps) {
        if (expected.length != actual.length) {
            throw new AssertionError("length mismatch: " + expected.length + " vs " + actual.length);
        }
        for (int i = 0; i < expected.length; i++) {
            assertComplexEquals(expected[i], actual[i], eps, "index " + i);
        }
    }
}
