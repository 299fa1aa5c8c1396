/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.lens;

import java.util.function.UnaryOperator;

/**
 * Median-of-three evaluation of complex formulas near a symmetry axis.
 * <p>
 * Formulas built on the principal square root or logarithm can land exactly
 * on a branch cut when the point lies on one of the axes of the profile. The
 * result then depends on whether a zero imaginary part came out as
 * {@code +0.0} or {@code -0.0} and may jump to the other branch. Near an axis
 * the formula is instead evaluated at the point and at the two points at the
 * same radius rotated by {@code ±perturbation}, and the real and imaginary
 * parts are each replaced by the median of the three samples.
 * </p>
 * <p>
 * A point at polar angle {@code phi} counts as near the axes of angle
 * {@code axisAngle} when {@code |sin(phi - axisAngle)| <= threshold} or
 * {@code |sin(phi - axisAngle - pi/2)| <= threshold}. Both constants are
 * absolute angles; they suit coordinates of order unity.
 * </p>
 * <p>
 * Instances are immutable and thread-safe.
 * </p>
 */
public final class BranchCutRegularizer {

    /** Default angular distance to an axis below which the median is taken */
    public static final double DEFAULT_THRESHOLD = 1e-10;

    /** Default angular offset of the two extra samples */
    public static final double DEFAULT_PERTURBATION = 1e-10;

    private static final BranchCutRegularizer DEFAULT =
            new BranchCutRegularizer(DEFAULT_THRESHOLD, DEFAULT_PERTURBATION);

    private final double threshold;
    private final double perturbation;

    /**
     * Creates a regularizer.
     * @param threshold Axis proximity threshold, non-negative
     * @param perturbation Angular offset of the extra samples, positive
     */
    public BranchCutRegularizer(double threshold, double perturbation) {
        if (!(threshold >= 0) || Double.isInfinite(threshold)) {
            throw new IllegalArgumentException("Threshold must be non-negative and finite: " + threshold);
        }
        if (!(perturbation > 0) || Double.isInfinite(perturbation)) {
            throw new IllegalArgumentException("Perturbation must be positive and finite: " + perturbation);
        }
        this.threshold = threshold;
        this.perturbation = perturbation;
    }

    /**
     * Gets the regularizer with the default constants.
     * @return Default regularizer
     */
    public static BranchCutRegularizer defaults() {
        return DEFAULT;
    }

    public double getThreshold() {
        return threshold;
    }

    public double getPerturbation() {
        return perturbation;
    }

    /**
     * Checks whether a polar angle lies on (or next to) one of the two axes.
     * @param phi Polar angle of the point
     * @param axisAngle Orientation of the major axis
     * @return true if the median evaluation applies
     */
    public boolean isNearAxis(double phi, double axisAngle) {
        return Math.abs(Math.sin(phi - axisAngle)) <= threshold
                || Math.abs(Math.sin(phi - axisAngle - Math.PI / 2.0)) <= threshold;
    }

    /**
     * Evaluates a formula of {@code z = x + iy}, regularized near the axes.
     * @param x x-coordinate relative to the profile centre
     * @param y y-coordinate relative to the profile centre
     * @param axisAngle Orientation of the major axis
     * @param formula Complex formula to evaluate
     * @return Formula value, or the componentwise median of three samples near an axis
     */
    public Complex evaluate(double x, double y, double axisAngle, UnaryOperator<Complex> formula) {
        Complex mid = formula.apply(Complex.of(x, y));
        double phi = Math.atan2(y, x);
        if (!isNearAxis(phi, axisAngle)) {
            return mid;
        }
        double r = Math.hypot(x, y);
        Complex minus = formula.apply(Complex.polar(r, phi - perturbation));
        Complex plus = formula.apply(Complex.polar(r, phi + perturbation));
        return Complex.of(
                median(minus.re(), plus.re(), mid.re()),
                median(minus.im(), plus.im(), mid.im()));
    }

    /**
     * Median of three values. A NaN argument yields NaN.
     */
    public static double median(double a, double b, double c) {
        if (Double.isNaN(a) || Double.isNaN(b) || Double.isNaN(c)) {
            return Double.NaN;
        }
        return Math.max(Math.min(a, b), Math.min(Math.max(a, b), c));
    }

    @Override
    public String toString() {
        return "BranchCutRegularizer{threshold=" + threshold + ", perturbation=" + perturbation + '}';
    }
}
