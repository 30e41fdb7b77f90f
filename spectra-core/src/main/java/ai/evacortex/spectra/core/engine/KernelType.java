/*
 * Spectra — Radix-2 Fourier Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectra.core.engine;

public enum KernelType {
    RECURSIVE,
    ITERATIVE;

    public FourierKernel create(int twiddleCacheSize) {
        return switch (this) {
            case RECURSIVE -> new RecursiveKernel();
            case ITERATIVE -> new IterativeKernel(new TwiddleCache(twiddleCacheSize));
        };
    }
}
