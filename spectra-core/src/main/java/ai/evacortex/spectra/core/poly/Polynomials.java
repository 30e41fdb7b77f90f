/*
 * Spectra — Radix-2 Fourier Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectra.core.poly;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public final class Polynomials {

    private Polynomials() {}

    /**
     * Renders coefficients as {@code c0 + c1X^1 + c2X^2 ...}, skipping zero terms.
     * The zero polynomial renders as an empty string.
     */
    public static String format(double[] coefficients) {
        Objects.requireNonNull(coefficients, "coefficients must not be null");
        List<String> terms = new ArrayList<>();
        for (int i = 0; i < coefficients.length; i++) {
            double c = coefficients[i];
            if (c == 0.0) continue;
            terms.add(i == 0 ? formatCoefficient(c) : formatCoefficient(c) + "X^" + i);
        }
        return String.join(" + ", terms);
    }

    public static double[] round(double[] coefficients) {
        double[] out = new double[coefficients.length];
        for (int i = 0; i < coefficients.length; i++) {
            // + 0.0 folds -0.0 into 0.0
            out[i] = Math.rint(coefficients[i]) + 0.0;
        }
        return out;
    }

    /**
     * Highest index whose coefficient exceeds {@code tolerance} in magnitude, or -1 for the zero
     * polynomial.
     */
    public static int degree(double[] coefficients, double tolerance) {
        for (int i = coefficients.length - 1; i >= 0; i--) {
            if (Math.abs(coefficients[i]) > tolerance) return i;
        }
        return -1;
    }

    private static String formatCoefficient(double c) {
        if (c == Math.rint(c) && Math.abs(c) < 1e15) {
            return Long.toString((long) c);
        }
        return Double.toString(c);
    }
}
