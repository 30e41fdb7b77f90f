/*
 * Spectra — Radix-2 Fourier Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectra.core.trace;

public class NoOpTracer implements TransformTracer {
    @Override
    public void trace(String operation, int size, long elapsedNanos) {
        // no-op
    }
}
