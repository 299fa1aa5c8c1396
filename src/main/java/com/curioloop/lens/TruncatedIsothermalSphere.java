/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.lens;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Truncated singular isothermal sphere.
 * <p>
 * A radially symmetric potential in {@code r = |(x, y) - centre|}:
 * </p>
 * <pre>
 *   f(r) = theta_E r                                                    r &lt; r_trunc
 *   f(r) = theta_E r_trunc + (1/2) theta_E (3 - r/r_trunc)(r - r_trunc)   r_trunc &lt;= r &lt; 2 r_trunc
 *   f(r) = (3/2) theta_E r_trunc                                        r &gt;= 2 r_trunc
 * </pre>
 * <p>
 * The deflection grows as {@code theta_E} inside {@code r_trunc}, falls
 * linearly to zero at {@code 2 r_trunc} and vanishes beyond. Deflection and
 * Hessian are exact and follow from the radial derivatives by the chain rule;
 * {@code fxy} and {@code fyx} are identical.
 * </p>
 * <p>
 * At the centre the deflection and the {@code dr/dx} factors are defined as
 * zero so that no division by zero occurs.
 * </p>
 */
public final class TruncatedIsothermalSphere extends AbstractLensProfile<TruncatedIsothermalSphere.Parameters> {

    /** Model name */
    public static final String NAME = "SIS_TRUNCATED";

    private static final List<String> PARAM_NAMES = List.of("theta_E", "r_trunc", "center_x", "center_y");

    public TruncatedIsothermalSphere() {
        super(NAME, defaultBounds());
    }

    private static LinkedHashMap<String, Bound> defaultBounds() {
        LinkedHashMap<String, Bound> bounds = new LinkedHashMap<>();
        bounds.put("theta_E", Bound.between(0, 100));
        bounds.put("r_trunc", Bound.between(0, 100));
        bounds.put("center_x", Bound.symmetric(100));
        bounds.put("center_y", Bound.symmetric(100));
        return bounds;
    }

    @Override
    protected Parameters create(double[] values) {
        return new Parameters(values[0], values[1], values[2], values[3]);
    }

    @Override
    protected double potentialAt(double x, double y, Parameters p) {
        double r = Math.hypot(x - p.centerX, y - p.centerY);
        double thetaE = p.thetaE;
        double rTrunc = p.rTrunc;
        if (r < rTrunc) {
            return thetaE * r;
        } else if (r < 2 * rTrunc) {
            return thetaE * rTrunc + 0.5 * thetaE * (3 - r / rTrunc) * (r - rTrunc);
        } else {
            return 1.5 * thetaE * rTrunc;
        }
    }

    @Override
    protected void deflectionAt(double x, double y, Parameters p, double[] out) {
        double dx = x - p.centerX;
        double dy = y - p.centerY;
        double r = Math.hypot(dx, dy);
        double dPhi = radialDerivative(r, p.thetaE, p.rTrunc);
        double rSafe = r == 0 ? 1 : r;
        out[0] = dPhi * dx / rSafe;
        out[1] = dPhi * dy / rSafe;
    }

    @Override
    public Hessian hessian(double[] x, double[] y, Parameters p) {
        int n = Coordinates.checkShape(x, y);
        Objects.requireNonNull(p, "params");
        double[] fxx = new double[n];
        double[] fxy = new double[n];
        double[] fyy = new double[n];
        for (int i = 0; i < n; i++) {
            double dx = x[i] - p.centerX;
            double dy = y[i] - p.centerY;
            double r = Math.hypot(dx, dy);
            double dPhi = radialDerivative(r, p.thetaE, p.rTrunc);
            double d2Phi = secondRadialDerivative(r, p.thetaE, p.rTrunc);

            double rSafe = r == 0 ? 1 : r;
            double drdx = dx / rSafe;
            double drdy = dy / rSafe;
            double r3 = rSafe * rSafe * rSafe;
            double d2rdx2 = dy * dy / r3;
            double d2rdy2 = dx * dx / r3;
            double d2rdxdy = -dx * dy / r3;

            fxx[i] = d2rdx2 * dPhi + drdx * drdx * d2Phi;
            fyy[i] = d2rdy2 * dPhi + drdy * drdy * d2Phi;
            fxy[i] = d2rdxdy * dPhi + drdx * drdy * d2Phi;
        }
        return new Hessian(fxx, fxy, fxy.clone(), fyy);
    }

    /**
     * First radial derivative {@code df/dr}; zero at the centre.
     * @param r Radius from the centre
     * @param thetaE Einstein radius
     * @param rTrunc Truncation radius
     * @return df/dr
     */
    static double radialDerivative(double r, double thetaE, double rTrunc) {
        if (r == 0) {
            return 0;
        } else if (r < rTrunc) {
            return thetaE;
        } else if (r < 2 * rTrunc) {
            return thetaE * (2 - r / rTrunc);
        } else {
            return 0;
        }
    }

    /**
     * Second radial derivative {@code d2f/dr2}.
     * @param r Radius from the centre
     * @param thetaE Einstein radius
     * @param rTrunc Truncation radius
     * @return d2f/dr2
     */
    static double secondRadialDerivative(double r, double thetaE, double rTrunc) {
        if (r < rTrunc) {
            return 0;
        } else if (r < 2 * rTrunc) {
            return -thetaE / rTrunc;
        } else {
            return 0;
        }
    }

    /**
     * Parameters of a truncated isothermal sphere.
     */
    public static final class Parameters implements LensParameters {

        private final double thetaE;
        private final double rTrunc;
        private final double centerX;
        private final double centerY;

        /**
         * Creates parameters.
         * @param thetaE Einstein radius (arcsec)
         * @param rTrunc Truncation radius (arcsec)
         * @param centerX Profile centre x
         * @param centerY Profile centre y
         */
        public Parameters(double thetaE, double rTrunc, double centerX, double centerY) {
            this.thetaE = thetaE;
            this.rTrunc = rTrunc;
            this.centerX = centerX;
            this.centerY = centerY;
        }

        /**
         * Creates parameters for a profile centred on the origin.
         */
        public Parameters(double thetaE, double rTrunc) {
            this(thetaE, rTrunc, 0.0, 0.0);
        }

        public double getThetaE() {
            return thetaE;
        }

        public double getRTrunc() {
            return rTrunc;
        }

        public double getCenterX() {
            return centerX;
        }

        public double getCenterY() {
            return centerY;
        }

        @Override
        public double[] toArray() {
            return new double[]{thetaE, rTrunc, centerX, centerY};
        }

        @Override
        public Map<String, Double> toMap() {
            return namedValues(PARAM_NAMES, toArray());
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) return true;
            if (!(obj instanceof Parameters)) return false;
            return Arrays.equals(toArray(), ((Parameters) obj).toArray());
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(toArray());
        }

        @Override
        public String toString() {
            return NAME + toMap();
        }
    }
}
