/*
 * Spectra — Radix-2 Fourier Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectra.core.exceptions;

public class InvalidImageException extends RuntimeException {
    public InvalidImageException(String message) {
        super("Invalid image: " + message);
    }

    public InvalidImageException(String message, Throwable cause) {
        super("Invalid image: " + message, cause);
    }
}
