/*
 * Spectra — Radix-2 Fourier Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectra.core.image;

import ai.evacortex.spectra.core.engine.FourierKernel;
import ai.evacortex.spectra.core.math.Complex;

/**
 * Row/column 2D transforms built from a 1D {@link FourierKernel}.
 */
final class Spectra2D {

    private Spectra2D() {}

    /**
     * Zero-pads {@code grid} to {@code rows x cols}, then transforms every row and every column.
     */
    static Complex[][] forward(FourierKernel kernel, double[][] grid, int rows, int cols) {
        Complex[][] out = new Complex[rows][];
        Complex[] padded = new Complex[cols];
        for (int r = 0; r < rows; r++) {
            double[] src = r < grid.length ? grid[r] : null;
            for (int c = 0; c < cols; c++) {
                padded[c] = (src != null && c < src.length) ? Complex.ofReal(src[c]) : Complex.ZERO;
            }
            out[r] = kernel.forward(padded);
        }

        Complex[] column = new Complex[rows];
        for (int c = 0; c < cols; c++) {
            for (int r = 0; r < rows; r++) {
                column[r] = out[r][c];
            }
            Complex[] transformed = kernel.forward(column);
            for (int r = 0; r < rows; r++) {
                out[r][c] = transformed[r];
            }
        }
        return out;
    }

    /**
     * Inverse-transforms every column keeping the first {@code height} rows, then every remaining
     * row keeping the first {@code width} columns. Returns the real parts.
     */
    static double[][] inverse(FourierKernel kernel, Complex[][] spectrum, int height, int width) {
        int rows = spectrum.length;
        int cols = spectrum[0].length;

        Complex[][] truncated = new Complex[height][cols];
        Complex[] column = new Complex[rows];
        for (int c = 0; c < cols; c++) {
            for (int r = 0; r < rows; r++) {
                column[r] = spectrum[r][c];
            }
            Complex[] restored = kernel.inverse(column);
            for (int r = 0; r < height; r++) {
                truncated[r][c] = restored[r];
            }
        }

        double[][] out = new double[height][width];
        for (int r = 0; r < height; r++) {
            Complex[] restored = kernel.inverse(truncated[r]);
            for (int c = 0; c < width; c++) {
                out[r][c] = restored[c].real;
            }
        }
        return out;
    }
}
