/*
 * Spectra — Radix-2 Fourier Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectra.core.image;

import ai.evacortex.spectra.core.exceptions.InvalidImageException;
import ai.evacortex.spectra.core.math.Complex;
import ai.evacortex.spectra.core.math.PowerOfTwo;

import java.util.Objects;

/**
 * Thresholded frequency-domain form of an RGB image, produced by {@link ImageCodec#encode}.
 *
 * <p>{@code height} and {@code width} are the original dimensions, restored on decode;
 * {@code fftHeight} and {@code fftWidth} are the padded power-of-two dimensions of each
 * channel spectrum.</p>
 */
public record CompressedImage(int height,
                              int width,
                              int fftHeight,
                              int fftWidth,
                              Complex[][] red,
                              Complex[][] green,
                              Complex[][] blue) {

    public static final int MAX_DIMENSION = 1 << 15;

    public CompressedImage {
        if (height <= 0 || width <= 0) {
            throw new InvalidImageException("dimensions must be positive: " + height + "x" + width);
        }
        if (!PowerOfTwo.isPowerOfTwo(fftHeight) || !PowerOfTwo.isPowerOfTwo(fftWidth)) {
            throw new InvalidImageException("padded dimensions must be powers of two: " + fftHeight + "x" + fftWidth);
        }
        if (fftHeight < height || fftWidth < width) {
            throw new InvalidImageException("padded dimensions " + fftHeight + "x" + fftWidth
                    + " smaller than " + height + "x" + width);
        }
        if (fftHeight > MAX_DIMENSION || fftWidth > MAX_DIMENSION) {
            throw new InvalidImageException("padded dimensions exceed " + MAX_DIMENSION + ": " + fftHeight + "x" + fftWidth);
        }
        checkShape("red", red, fftHeight, fftWidth);
        checkShape("green", green, fftHeight, fftWidth);
        checkShape("blue", blue, fftHeight, fftWidth);
        red = copy(red);
        green = copy(green);
        blue = copy(blue);
    }

    @Override
    public Complex[][] red() {
        return copy(red);
    }

    @Override
    public Complex[][] green() {
        return copy(green);
    }

    @Override
    public Complex[][] blue() {
        return copy(blue);
    }

    /**
     * Copy of one channel spectrum, 0 = red, 1 = green, 2 = blue.
     */
    public Complex[][] channel(int channel) {
        return copy(spectrum(channel));
    }

    /**
     * Live spectrum for read-only use inside the codec.
     */
    Complex[][] spectrum(int channel) {
        return switch (channel) {
            case 0 -> red;
            case 1 -> green;
            case 2 -> blue;
            default -> throw new IndexOutOfBoundsException("channel " + channel);
        };
    }

    public long nonZeroCount() {
        long count = 0;
        for (int ch = 0; ch < ImageGrid.CHANNELS; ch++) {
            for (Complex[] row : spectrum(ch)) {
                for (Complex v : row) {
                    if (!v.isZero()) count++;
                }
            }
        }
        return count;
    }

    /**
     * Fraction of spectral coefficients that survived thresholding, in [0, 1].
     */
    public double retainedRatio() {
        double total = (double) ImageGrid.CHANNELS * fftHeight * fftWidth;
        return nonZeroCount() / total;
    }

    private static Complex[][] copy(Complex[][] spectrum) {
        Complex[][] out = new Complex[spectrum.length][];
        for (int r = 0; r < spectrum.length; r++) {
            out[r] = spectrum[r].clone();
        }
        return out;
    }

    private static void checkShape(String name, Complex[][] spectrum, int rows, int cols) {
        Objects.requireNonNull(spectrum, name + " spectrum must not be null");
        if (spectrum.length != rows) {
            throw new InvalidImageException(name + " spectrum has " + spectrum.length + " rows, expected " + rows);
        }
        for (Complex[] row : spectrum) {
            if (row == null || row.length != cols) {
                throw new InvalidImageException(name + " spectrum row width differs from " + cols);
            }
            for (Complex v : row) {
                if (v == null) {
                    throw new InvalidImageException(name + " spectrum contains null entries");
                }
            }
        }
    }
}
