/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.lens;

import net.jqwik.api.*;
import net.jqwik.api.constraints.*;

import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for the truncated isothermal sphere.
 */
public class TruncatedIsothermalSpherePropertiesTest {

    private final TruncatedIsothermalSphere sis = new TruncatedIsothermalSphere();

    @Property(tries = 200)
    @Label("Potential is radial, non-decreasing and capped at 1.5 theta_E r_trunc")
    void potentialShape(
            @ForAll @DoubleRange(min = 0.1, max = 5.0) double thetaE,
            @ForAll @DoubleRange(min = 0.1, max = 5.0) double rTrunc,
            @ForAll @DoubleRange(min = 0.0, max = 15.0) double r1,
            @ForAll @DoubleRange(min = 0.0, max = 15.0) double r2,
            @ForAll @DoubleRange(min = -3.1, max = 3.1) double phi
    ) {
        TruncatedIsothermalSphere.Parameters p = new TruncatedIsothermalSphere.Parameters(thetaE, rTrunc, 0.3, -0.4);
        double cap = 1.5 * thetaE * rTrunc;

        double f1 = sis.potential(0.3 + r1 * Math.cos(phi), -0.4 + r1 * Math.sin(phi), p);
        double f2 = sis.potential(0.3 + r2, -0.4, p);

        assertThat(f1).isBetween(0.0, cap * (1 + 1e-12));
        assertThat(f1).isCloseTo(sis.potential(0.3 + r1, -0.4, p), within(1e-12 * cap));
        if (r1 <= r2) {
            assertThat(f1).isLessThanOrEqualTo(f2 + 1e-12 * cap);
        }
    }

    @Property(tries = 200)
    @Label("Deflection is radial with the magnitude of the radial derivative")
    void deflectionIsRadial(
            @ForAll @DoubleRange(min = 0.1, max = 5.0) double thetaE,
            @ForAll @DoubleRange(min = 0.1, max = 5.0) double rTrunc,
            @ForAll @DoubleRange(min = 0.01, max = 15.0) double r,
            @ForAll @DoubleRange(min = -3.1, max = 3.1) double phi
    ) {
        TruncatedIsothermalSphere.Parameters p = new TruncatedIsothermalSphere.Parameters(thetaE, rTrunc);
        double[] alpha = sis.deflection(r * Math.cos(phi), r * Math.sin(phi), p);
        double magnitude = TruncatedIsothermalSphere.radialDerivative(r, thetaE, rTrunc);

        assertThat(Math.hypot(alpha[0], alpha[1])).isCloseTo(magnitude, within(1e-12 * thetaE));
        assertThat(alpha[0] * Math.sin(phi) - alpha[1] * Math.cos(phi)).isCloseTo(0.0, within(1e-12 * thetaE));
    }

    @Property(tries = 200)
    @Label("Hessian is exactly symmetric and agrees with array evaluation")
    void hessianSymmetric(
            @ForAll @DoubleRange(min = 0.1, max = 5.0) double thetaE,
            @ForAll @DoubleRange(min = 0.1, max = 5.0) double rTrunc,
            @ForAll @DoubleRange(min = -10.0, max = 10.0) double x,
            @ForAll @DoubleRange(min = -10.0, max = 10.0) double y
    ) {
        TruncatedIsothermalSphere.Parameters p = new TruncatedIsothermalSphere.Parameters(thetaE, rTrunc);
        Hessian h = sis.hessian(new double[]{x, 0.0}, new double[]{y, 0.5}, p);

        assertThat(h.fxy(0)).isEqualTo(h.fyx(0));
        assertThat(h.at(0)).containsExactly(sis.hessian(x, y, p));
        assertThat(h.at(1)).containsExactly(sis.hessian(0.0, 0.5, p));
    }
}
