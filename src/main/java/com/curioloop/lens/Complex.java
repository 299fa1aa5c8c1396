/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.lens;

/**
 * Immutable complex number used by the complex-plane lens formulas.
 * <p>
 * {@link #sqrt()} and {@link #log()} return principal values and respect the
 * sign of a zero imaginary part, so {@code sqrt(-4 - 0i) = -2i} while
 * {@code sqrt(-4 + 0i) = 2i}. Points lying on a branch cut therefore depend
 * on how the zero was produced; see {@link BranchCutRegularizer}.
 * </p>
 */
public final class Complex {

    /** Complex zero */
    public static final Complex ZERO = new Complex(0.0, 0.0);

    /** Imaginary unit */
    public static final Complex I = new Complex(0.0, 1.0);

    private final double re;
    private final double im;

    private Complex(double re, double im) {
        this.re = re;
        this.im = im;
    }

    /**
     * Creates a complex number from its Cartesian parts.
     * @param re Real part
     * @param im Imaginary part
     * @return Complex number
     */
    public static Complex of(double re, double im) {
        return new Complex(re, im);
    }

    /**
     * Creates a complex number from polar form {@code r * e^(i*theta)}.
     * @param r Modulus
     * @param theta Argument in radians
     * @return Complex number
     */
    public static Complex polar(double r, double theta) {
        return new Complex(r * Math.cos(theta), r * Math.sin(theta));
    }

    /**
     * Unit phasor {@code e^(i*theta)}.
     * @param theta Angle in radians
     * @return Complex number on the unit circle
     */
    public static Complex expi(double theta) {
        return new Complex(Math.cos(theta), Math.sin(theta));
    }

    public double re() {
        return re;
    }

    public double im() {
        return im;
    }

    public Complex add(Complex other) {
        return new Complex(re + other.re, im + other.im);
    }

    public Complex subtract(Complex other) {
        return new Complex(re - other.re, im - other.im);
    }

    public Complex subtract(double value) {
        return new Complex(re - value, im);
    }

    public Complex multiply(Complex other) {
        double r = re * other.re - im * other.im;
        double i = re * other.im + im * other.re;
        return new Complex(r, i);
    }

    public Complex multiply(double factor) {
        return new Complex(re * factor, im * factor);
    }

    public Complex divide(double divisor) {
        return new Complex(re / divisor, im / divisor);
    }

    public Complex square() {
        return multiply(this);
    }

    public Complex conjugate() {
        return new Complex(re, -im);
    }

    public double abs() {
        return Math.hypot(re, im);
    }

    public double arg() {
        return Math.atan2(im, re);
    }

    /**
     * Principal square root.
     * <p>
     * The result has a non-negative real part. On the negative real axis the
     * sign of the imaginary part follows the sign of {@code im}, including a
     * signed zero.
     * </p>
     * @return Principal square root
     */
    public Complex sqrt() {
        if (re == 0.0 && im == 0.0) {
            return new Complex(0.0, im);
        }
        if (Double.isNaN(re) || Double.isNaN(im)) {
            return new Complex(Double.NaN, Double.NaN);
        }
        double t = Math.sqrt((Math.abs(re) + abs()) / 2.0);
        if (re >= 0.0) {
            return new Complex(t, im / (2.0 * t));
        }
        return new Complex(Math.abs(im) / (2.0 * t), Math.copySign(t, im));
    }

    /**
     * Principal natural logarithm, with argument in {@code [-pi, pi]}.
     * @return Principal logarithm
     */
    public Complex log() {
        return new Complex(Math.log(abs()), arg());
    }

    /**
     * Sign selecting the half plane of this number.
     * <p>
     * Returns {@code +1} when {@code re > 0}, or when {@code re == 0} and
     * {@code im >= 0}; {@code -1} otherwise. Multiplying by it maps the number
     * into the closed right half plane where the principal square root is
     * continuous.
     * </p>
     * @return +1 or -1
     */
    public int branchSign() {
        if (re > 0 || (re == 0 && im >= 0)) {
            return 1;
        }
        return -1;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Complex)) return false;
        Complex other = (Complex) obj;
        return Double.compare(re, other.re) == 0 && Double.compare(im, other.im) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(re) * 31 + Double.hashCode(im);
    }

    @Override
    public String toString() {
        return "(" + re + (im < 0 || (im == 0 && 1 / im < 0) ? " - " : " + ") + Math.abs(im) + "i)";
    }
}
