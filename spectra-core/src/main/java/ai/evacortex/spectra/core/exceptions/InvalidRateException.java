/*
 * Spectra — Radix-2 Fourier Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectra.core.exceptions;

public class InvalidRateException extends RuntimeException {

    private final int rate;

    public InvalidRateException(int rate) {
        super("Invalid compression rate: " + rate + " (expected 0..100)");
        this.rate = rate;
    }

    public int rate() {
        return rate;
    }
}
