/*
 * Spectra — Radix-2 Fourier Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectra.core.engine;

import ai.evacortex.spectra.core.math.Complex;

import java.util.Objects;

public class FourierEngine {

    private static volatile FourierKernel backend = new RecursiveKernel();

    private FourierEngine() {}

    public static void setBackend(FourierKernel kernel) {
        backend = Objects.requireNonNull(kernel, "kernel must not be null");
    }

    public static FourierKernel backend() {
        return backend;
    }

    public static Complex[] transform(Complex[] sequence, boolean inverse) {
        return backend.transform(sequence, inverse);
    }
}
