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

import java.util.Objects;

/**
 * RGB image as 8-bit samples indexed by {@code [row][column][channel]}, channel 0 = red,
 * 1 = green, 2 = blue.
 */
public record ImageGrid(int[][][] samples) {

    public static final int CHANNELS = 3;
    public static final int MAX_SAMPLE = 255;

    public ImageGrid {
        Objects.requireNonNull(samples, "samples must not be null");
        if (samples.length == 0) {
            throw new InvalidImageException("image has zero height");
        }
        int width = samples[0] == null ? 0 : samples[0].length;
        if (width == 0) {
            throw new InvalidImageException("image has zero width");
        }
        for (int r = 0; r < samples.length; r++) {
            int[][] row = samples[r];
            if (row == null || row.length != width) {
                throw new InvalidImageException("row " + r + " does not have width " + width);
            }
            for (int c = 0; c < width; c++) {
                int[] px = row[c];
                if (px == null || px.length != CHANNELS) {
                    throw new InvalidImageException("pixel (" + r + ", " + c + ") must have " + CHANNELS + " channels");
                }
                for (int ch = 0; ch < CHANNELS; ch++) {
                    if (px[ch] < 0 || px[ch] > MAX_SAMPLE) {
                        throw new InvalidImageException("sample out of range at (" + r + ", " + c + ", " + ch + "): " + px[ch]);
                    }
                }
            }
        }
        samples = deepCopy(samples);
    }

    /**
     * Copy of the samples; the grid itself cannot be modified.
     */
    @Override
    public int[][][] samples() {
        return deepCopy(samples);
    }

    public int height() {
        return samples.length;
    }

    public int width() {
        return samples[0].length;
    }

    public int sample(int row, int column, int channel) {
        return samples[row][column][channel];
    }

    /**
     * Copy of one channel as a real-valued grid.
     */
    public double[][] channel(int channel) {
        Objects.checkIndex(channel, CHANNELS);
        int h = height();
        int w = width();
        double[][] out = new double[h][w];
        for (int r = 0; r < h; r++) {
            for (int c = 0; c < w; c++) {
                out[r][c] = samples[r][c][channel];
            }
        }
        return out;
    }

    public static ImageGrid fromChannels(int[][] red, int[][] green, int[][] blue) {
        Objects.requireNonNull(red, "red must not be null");
        Objects.requireNonNull(green, "green must not be null");
        Objects.requireNonNull(blue, "blue must not be null");
        if (red.length != green.length || red.length != blue.length) {
            throw new InvalidImageException("channel heights differ");
        }
        int h = red.length;
        int w = h == 0 ? 0 : red[0].length;
        int[][][] out = new int[h][w][CHANNELS];
        for (int r = 0; r < h; r++) {
            if (red[r].length != w || green[r].length != w || blue[r].length != w) {
                throw new InvalidImageException("channel widths differ at row " + r);
            }
            for (int c = 0; c < w; c++) {
                out[r][c][0] = red[r][c];
                out[r][c][1] = green[r][c];
                out[r][c][2] = blue[r][c];
            }
        }
        return new ImageGrid(out);
    }

    /**
     * Builds an image from {@code 0xRRGGBB} pixels in row-major order, the layout returned by
     * {@code BufferedImage.getRGB(0, 0, w, h, null, 0, w)}. Alpha bits are ignored.
     */
    public static ImageGrid fromPackedRgb(int[] rgb, int width, int height) {
        Objects.requireNonNull(rgb, "rgb must not be null");
        if (width <= 0 || height <= 0) {
            throw new InvalidImageException("dimensions must be positive: " + width + "x" + height);
        }
        long pixels = (long) width * height;
        if (rgb.length != pixels) {
            throw new InvalidImageException("expected " + pixels + " pixels, got " + rgb.length);
        }
        int[][][] out = new int[height][width][CHANNELS];
        for (int r = 0; r < height; r++) {
            for (int c = 0; c < width; c++) {
                int p = rgb[r * width + c];
                out[r][c][0] = (p >> 16) & 0xFF;
                out[r][c][1] = (p >> 8) & 0xFF;
                out[r][c][2] = p & 0xFF;
            }
        }
        return new ImageGrid(out);
    }

    private static int[][][] deepCopy(int[][][] src) {
        int[][][] out = new int[src.length][][];
        for (int r = 0; r < src.length; r++) {
            out[r] = new int[src[r].length][];
            for (int c = 0; c < src[r].length; c++) {
                out[r][c] = src[r][c].clone();
            }
        }
        return out;
    }

    public int[] toPackedRgb() {
        int h = height();
        int w = width();
        int[] out = new int[h * w];
        for (int r = 0; r < h; r++) {
            for (int c = 0; c < w; c++) {
                int[] px = samples[r][c];
                out[r * w + c] = (px[0] << 16) | (px[1] << 8) | px[2];
            }
        }
        return out;
    }
}
