/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.lens;

import java.util.Random;

import net.jqwik.api.*;
import net.jqwik.api.constraints.*;

import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for the elliptical slice over random shapes and positions.
 */
public class EllipticalSlicePropertiesTest {

    private final EllipticalDensitySlice slice = new EllipticalDensitySlice();

    /**
     * Rotating the slice and the point together rotates the deflection and
     * leaves the potential unchanged.
     */
    @Property(tries = 200)
    @Label("Rotation covariance")
    void rotationCovariance(
            @ForAll @DoubleRange(min = 0.5, max = 2.0) double a,
            @ForAll @DoubleRange(min = 0.3, max = 0.95) double axisRatio,
            @ForAll @DoubleRange(min = -1.5, max = 1.5) double psi,
            @ForAll @DoubleRange(min = 0.5, max = 2.0) double sigma0,
            @ForAll @DoubleRange(min = 0.05, max = 4.0) double radius,
            @ForAll @DoubleRange(min = -3.1, max = 3.1) double phi,
            @ForAll @DoubleRange(min = -3.1, max = 3.1) double theta
    ) {
        double x = radius * a * Math.cos(phi);
        double y = radius * a * Math.sin(phi);
        double c = Math.cos(theta);
        double s = Math.sin(theta);

        EllipticalDensitySlice.Parameters p = new EllipticalDensitySlice.Parameters(a, axisRatio * a, psi, sigma0);
        EllipticalDensitySlice.Parameters rotated = new EllipticalDensitySlice.Parameters(a, axisRatio * a, psi + theta, sigma0);

        double[] alpha = slice.deflection(x, y, p);
        double[] alphaRotated = slice.deflection(c * x - s * y, s * x + c * y, rotated);

        double tolerance = 1e-9 * sigma0 * a;
        assertThat(alphaRotated[0]).isCloseTo(c * alpha[0] - s * alpha[1], within(tolerance));
        assertThat(alphaRotated[1]).isCloseTo(s * alpha[0] + c * alpha[1], within(tolerance));
        assertThat(slice.potential(c * x - s * y, s * x + c * y, rotated))
            .isCloseTo(slice.potential(x, y, p), within(tolerance * a));
    }

    /**
     * Outside the slice the deflection is the gradient of the potential.
     */
    @Property(tries = 200)
    @Label("Deflection matches the potential gradient outside")
    void deflectionIsGradient(
            @ForAll @DoubleRange(min = 0.5, max = 2.0) double a,
            @ForAll @DoubleRange(min = 0.3, max = 0.95) double axisRatio,
            @ForAll @DoubleRange(min = -1.5, max = 1.5) double psi,
            @ForAll @DoubleRange(min = 0.5, max = 2.0) double sigma0,
            @ForAll @DoubleRange(min = 1.2, max = 4.0) double radius,
            @ForAll @DoubleRange(min = -3.1, max = 3.1) double phi
    ) {
        EllipticalDensitySlice.Parameters p = new EllipticalDensitySlice.Parameters(a, axisRatio * a, psi, sigma0);
        double x = radius * a * Math.cos(phi);
        double y = radius * a * Math.sin(phi);
        double h = 1e-5;

        double gx = (slice.potential(x + h, y, p) - slice.potential(x - h, y, p)) / (2 * h);
        double gy = (slice.potential(x, y + h, p) - slice.potential(x, y - h, p)) / (2 * h);
        double[] alpha = slice.deflection(x, y, p);

        assertThat(alpha[0]).isCloseTo(gx, within(1e-5));
        assertThat(alpha[1]).isCloseTo(gy, within(1e-5));
    }

    /**
     * Potential and deflection agree on both sides of the boundary.
     */
    @Property(tries = 200)
    @Label("Continuity across the boundary")
    void boundaryContinuity(
            @ForAll @DoubleRange(min = 0.5, max = 2.0) double a,
            @ForAll @DoubleRange(min = 0.3, max = 0.95) double axisRatio,
            @ForAll @DoubleRange(min = -1.5, max = 1.5) double psi,
            @ForAll @DoubleRange(min = 0.5, max = 2.0) double sigma0,
            @ForAll @DoubleRange(min = 0.0, max = 6.28) double t
    ) {
        double b = axisRatio * a;
        EllipticalDensitySlice.Parameters p = new EllipticalDensitySlice.Parameters(a, b, psi, sigma0);
        double xr = a * Math.cos(t);
        double yr = b * Math.sin(t);
        double x = xr * Math.cos(psi) - yr * Math.sin(psi);
        double y = xr * Math.sin(psi) + yr * Math.cos(psi);

        double[] alphaIn = slice.deflection(x * (1 - 1e-9), y * (1 - 1e-9), p);
        double[] alphaOut = slice.deflection(x * (1 + 1e-9), y * (1 + 1e-9), p);

        assertThat(alphaIn[0]).isCloseTo(alphaOut[0], within(1e-6));
        assertThat(alphaIn[1]).isCloseTo(alphaOut[1], within(1e-6));
        assertThat(slice.potential(x * (1 - 1e-9), y * (1 - 1e-9), p))
            .isCloseTo(slice.potential(x * (1 + 1e-9), y * (1 + 1e-9), p), within(1e-6));
    }

    /**
     * Batch results have the input length and match point-wise evaluation.
     */
    @Property(tries = 50)
    @Label("Batch evaluation preserves shape and order")
    void batchMatchesScalar(
            @ForAll @IntRange(min = 0, max = 20) int n,
            @ForAll long seed
    ) {
        Random random = new Random(seed);
        double[] x = new double[n];
        double[] y = new double[n];
        for (int i = 0; i < n; i++) {
            x[i] = 6.0 * random.nextDouble() - 3.0;
            y[i] = 6.0 * random.nextDouble() - 3.0;
        }
        EllipticalDensitySlice.Parameters p = new EllipticalDensitySlice.Parameters(1.2, 0.7, 0.4, 1.1, 0.1, -0.2);

        double[] f = slice.potential(x, y, p);
        Deflection alpha = slice.deflection(x, y, p);

        assertThat(f).hasSize(x.length);
        assertThat(alpha.size()).isEqualTo(x.length);
        for (int i = 0; i < x.length; i++) {
            assertThat(f[i]).isEqualTo(slice.potential(x[i], y[i], p));
            assertThat(alpha.at(i)).containsExactly(slice.deflection(x[i], y[i], p));
        }
    }
}
