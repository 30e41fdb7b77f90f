/*
 * Spectra — Radix-2 Fourier Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectra.core.trace;

import ai.evacortex.spectra.core.engine.FourierKernel;
import ai.evacortex.spectra.core.math.Complex;

import java.util.Objects;

/**
 * Decorator reporting the duration of every call on the wrapped kernel.
 * Failed calls are not traced.
 */
public final class TracingKernel implements FourierKernel {

    private final FourierKernel delegate;
    private final TransformTracer tracer;

    public TracingKernel(FourierKernel delegate, TransformTracer tracer) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
    }

    @Override
    public Complex[] transform(Complex[] sequence, boolean inverse) {
        long start = System.nanoTime();
        Complex[] result = delegate.transform(sequence, inverse);
        tracer.trace(inverse ? "inverse" : "forward", sequence.length, System.nanoTime() - start);
        return result;
    }

    public FourierKernel delegate() {
        return delegate;
    }
}
