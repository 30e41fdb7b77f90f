/*
 * Spectra — Radix-2 Fourier Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectra.core.trace;

import java.io.PrintStream;
import java.util.Locale;
import java.util.Objects;

public class PrintStreamTracer implements TransformTracer {

    private final PrintStream out;

    public PrintStreamTracer() {
        this(System.err);
    }

    public PrintStreamTracer(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public void trace(String operation, int size, long elapsedNanos) {
        out.printf(Locale.ROOT, "[TRACE] %s n=%d %.3f ms%n", operation, size, elapsedNanos / 1_000_000.0);
    }
}
