/*
 * Spectra — Radix-2 Fourier Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectra.core.image;

import ai.evacortex.spectra.core.engine.FourierEngine;
import ai.evacortex.spectra.core.engine.FourierKernel;
import ai.evacortex.spectra.core.exceptions.InvalidImageException;
import ai.evacortex.spectra.core.math.Complex;
import ai.evacortex.spectra.core.math.PowerOfTwo;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.IntFunction;

/**
 * Lossy image compression by 2D spectral thresholding.
 *
 * <h3>Encoding</h3>
 * Each RGB channel is zero-padded to power-of-two dimensions, transformed row-wise then
 * column-wise, and the smallest-magnitude {@code compressionRate} percent of its coefficients
 * are zeroed (see {@link PercentileThreshold}).
 *
 * <h3>Decoding</h3>
 * Each spectrum is inverse-transformed column-wise and truncated to the original height, then
 * row-wise and truncated to the original width. Real parts are rounded and clamped to [0, 255].
 *
 * <h3>Threading</h3>
 * Channels are independent. With {@code parallelChannels} the codec owns a three-thread pool
 * and must be closed; otherwise everything runs on the caller thread.
 *
 * @see CompressedImage
 * @see ImageGrid
 */
public class ImageCodec implements Closeable {

    public static final int DEFAULT_COMPRESSION_RATE = 80;

    private final FourierKernel kernel;
    private final int defaultRate;
    private final ExecutorService executor;

    public ImageCodec() {
        this(FourierEngine.backend(), DEFAULT_COMPRESSION_RATE, false);
    }

    public ImageCodec(FourierKernel kernel) {
        this(kernel, DEFAULT_COMPRESSION_RATE, false);
    }

    public ImageCodec(FourierKernel kernel, int defaultRate, boolean parallelChannels) {
        PercentileThreshold.checkRate(defaultRate);
        this.kernel = Objects.requireNonNull(kernel, "kernel must not be null");
        this.defaultRate = defaultRate;
        this.executor = parallelChannels ? Executors.newFixedThreadPool(ImageGrid.CHANNELS) : null;
    }

    public CompressedImage encode(ImageGrid image) {
        return encode(image, defaultRate);
    }

    public CompressedImage encode(ImageGrid image, int compressionRate) {
        Objects.requireNonNull(image, "image must not be null");
        PercentileThreshold.checkRate(compressionRate);

        int height = image.height();
        int width = image.width();
        int fftHeight = PowerOfTwo.ceiling(height);
        int fftWidth = PowerOfTwo.ceiling(width);
        if (fftHeight > CompressedImage.MAX_DIMENSION || fftWidth > CompressedImage.MAX_DIMENSION) {
            throw new InvalidImageException("padded dimensions exceed " + CompressedImage.MAX_DIMENSION
                    + ": " + fftHeight + "x" + fftWidth);
        }

        List<Complex[][]> spectra = perChannel(ch -> {
            Complex[][] spectrum = Spectra2D.forward(kernel, image.channel(ch), fftHeight, fftWidth);
            PercentileThreshold.apply(spectrum, compressionRate);
            return spectrum;
        });

        return new CompressedImage(height, width, fftHeight, fftWidth,
                spectra.get(0), spectra.get(1), spectra.get(2));
    }

    public ImageGrid decode(CompressedImage compressed) {
        Objects.requireNonNull(compressed, "compressed must not be null");

        int height = compressed.height();
        int width = compressed.width();

        List<double[][]> channels = perChannel(ch ->
                Spectra2D.inverse(kernel, compressed.spectrum(ch), height, width));

        int[][][] samples = new int[height][width][ImageGrid.CHANNELS];
        for (int ch = 0; ch < ImageGrid.CHANNELS; ch++) {
            double[][] values = channels.get(ch);
            for (int r = 0; r < height; r++) {
                for (int c = 0; c < width; c++) {
                    samples[r][c][ch] = toSample(values[r][c]);
                }
            }
        }
        return new ImageGrid(samples);
    }

    public int defaultRate() {
        return defaultRate;
    }

    static int toSample(double value) {
        long rounded = Math.round(value);
        if (rounded < 0) return 0;
        if (rounded > ImageGrid.MAX_SAMPLE) return ImageGrid.MAX_SAMPLE;
        return (int) rounded;
    }

    private <T> List<T> perChannel(IntFunction<T> task) {
        List<T> results = new ArrayList<>(ImageGrid.CHANNELS);
        if (executor == null) {
            for (int ch = 0; ch < ImageGrid.CHANNELS; ch++) {
                results.add(task.apply(ch));
            }
            return results;
        }

        List<Future<T>> futures = new ArrayList<>(ImageGrid.CHANNELS);
        for (int ch = 0; ch < ImageGrid.CHANNELS; ch++) {
            final int channel = ch;
            futures.add(executor.submit(() -> task.apply(channel)));
        }
        try {
            for (Future<T> f : futures) {
                results.add(f.get());
            }
        } catch (InterruptedException e) {
            futures.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while processing channels", e);
        } catch (ExecutionException e) {
            futures.forEach(f -> f.cancel(true));
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw new IllegalStateException("Channel processing failed", cause);
        }
        return results;
    }

    @Override
    public void close() {
        if (executor == null) return;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                System.err.println("[WARN] channel executor did not terminate, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
