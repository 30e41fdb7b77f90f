/*
 * Spectra — Radix-2 Fourier Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectra.core.exceptions;

public class InvalidLengthException extends RuntimeException {

    private final int length;

    public InvalidLengthException(int length) {
        super("Invalid transform length: " + length + " is not a power of two");
        this.length = length;
    }

    public int length() {
        return length;
    }
}
