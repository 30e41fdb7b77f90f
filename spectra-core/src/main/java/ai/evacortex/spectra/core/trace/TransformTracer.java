/*
 * Spectra — Radix-2 Fourier Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectra.core.trace;

/**
 * Receives timing information for completed transform calls.
 */
public interface TransformTracer {

    /**
     * @param operation    name of the traced operation, e.g. {@code "forward"}
     * @param size         length of the input sequence
     * @param elapsedNanos wall-clock duration of the call
     */
    void trace(String operation, int size, long elapsedNanos);
}
