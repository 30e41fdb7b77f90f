/*
 * Spectra — Radix-2 Fourier Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectra.core.math;

/**
 * Immutable complex number used by the transform kernels and spectra.
 */
public final class Complex {

    public static final Complex ZERO = new Complex(0.0, 0.0);

    public final double real;
    public final double imag;

    public Complex(double real, double imag) {
        this.real = real;
        this.imag = imag;
    }

    public static Complex ofReal(double real) {
        return new Complex(real, 0.0);
    }

    /**
     * Unit phasor e^{iθ}.
     */
    public static Complex unit(double theta) {
        return new Complex(Math.cos(theta), Math.sin(theta));
    }

    public Complex add(Complex other) {
        return new Complex(this.real + other.real, this.imag + other.imag);
    }

    public Complex subtract(Complex other) {
        return new Complex(this.real - other.real, this.imag - other.imag);
    }

    public Complex multiply(Complex other) {
        double r = this.real * other.real - this.imag * other.imag;
        double i = this.real * other.imag + this.imag * other.real;
        return new Complex(r, i);
    }

    public Complex scale(double factor) {
        return new Complex(this.real * factor, this.imag * factor);
    }

    public double abs() {
        return Math.hypot(this.real, this.imag);
    }

    public double absSquared() {
        return this.real * this.real + this.imag * this.imag;
    }

    public boolean isZero() {
        return real == 0.0 && imag == 0.0;
    }

    public static Complex[] fromReal(double[] values) {
        Complex[] out = new Complex[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = ofReal(values[i]);
        }
        return out;
    }

    public static double[] realParts(Complex[] values) {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = values[i].real;
        }
        return out;
    }

    @Override
    public String toString() {
        return String.format("(%f %s %fi)", real, (imag < 0 ? "-" : "+"), Math.abs(imag));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Complex)) return false;
        Complex other = (Complex) obj;
        return Double.compare(real, other.real) == 0 && Double.compare(imag, other.imag) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(real) * 31 + Double.hashCode(imag);
    }
}
