/*
 * Spectra — Radix-2 Fourier Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectra.core;

import ai.evacortex.spectra.core.config.SpectraConfig;
import ai.evacortex.spectra.core.engine.FourierKernel;
import ai.evacortex.spectra.core.image.ImageCodec;
import ai.evacortex.spectra.core.poly.PolynomialMultiplier;
import ai.evacortex.spectra.core.trace.PrintStreamTracer;
import ai.evacortex.spectra.core.trace.TracingKernel;

import java.io.Closeable;
import java.util.Objects;

/**
 * Wires a kernel, a polynomial multiplier and an image codec from one {@link SpectraConfig}.
 */
public final class Spectra implements Closeable {

    private final SpectraConfig config;
    private final FourierKernel kernel;
    private final PolynomialMultiplier multiplier;
    private final ImageCodec codec;

    private Spectra(SpectraConfig config) {
        this.config = config;
        FourierKernel base = config.kernel().create(config.twiddleCacheSize());
        this.kernel = config.trace() ? new TracingKernel(base, new PrintStreamTracer()) : base;
        this.multiplier = new PolynomialMultiplier(kernel);
        this.codec = new ImageCodec(kernel, config.defaultCompressionRate(), config.parallelChannels());
    }

    public static Spectra create() {
        return create(SpectraConfig.loadDefault());
    }

    public static Spectra create(SpectraConfig config) {
        return new Spectra(Objects.requireNonNull(config, "config must not be null"));
    }

    public SpectraConfig config()             { return config; }
    public FourierKernel kernel()             { return kernel; }
    public PolynomialMultiplier multiplier()  { return multiplier; }
    public ImageCodec codec()                 { return codec; }

    @Override
    public void close() {
        codec.close();
    }
}
