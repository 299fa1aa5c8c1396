/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.lens;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.UnaryOperator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Elliptical slice of constant surface density (Schramm 1994).
 * <p>
 * The convergence is {@code sigma_0} inside the ellipse of semi-axes
 * {@code a >= b}, centred on {@code (center_x, center_y)} and rotated by
 * {@code psi}, and zero outside:
 * </p>
 * <pre>
 *   x_rot =  x_c cos(psi) + y_c sin(psi)
 *   y_rot = -x_c sin(psi) + y_c cos(psi)
 *   inside  &lt;=&gt;  x_rot^2 / a^2 + y_rot^2 / b^2 &lt;= 1
 * </pre>
 * <p>
 * With {@code z = x_c + i y_c}, {@code e = (a - b) / (a + b)} and
 * {@code f2 = a^2 - b^2}, the deflection {@code alpha = f_x + i f_y} is
 * </p>
 * <pre>
 *   inside:  sigma_0 (z - e conj(z) e^(2i psi))
 *   outside: sigma_0 2ab/f2 (conj(z) e^(2i psi) - e^(i psi) s(conj(z) e^(i psi)) sqrt(conj(z)^2 e^(2i psi) - f2))
 * </pre>
 * <p>
 * where {@code s} is {@link Complex#branchSign()}. The outside potential uses
 * the matching complex logarithm and the inside potential carries the
 * constant that makes it continuous across the boundary.
 * </p>
 * <p>
 * A circular slice ({@code a == b}) uses the point-mass form
 * {@code sigma_0 a^2 (x_c, y_c) / r^2} outside, where the general formula
 * divides by zero. Points on the major or minor axis are evaluated through
 * {@link BranchCutRegularizer}. The Hessian has no closed form and is
 * obtained by differencing the analytic deflection, see {@link NumericalHessian}.
 * </p>
 */
public final class EllipticalDensitySlice extends AbstractLensProfile<EllipticalDensitySlice.Parameters> {

    private static final Logger log = LoggerFactory.getLogger(EllipticalDensitySlice.class);

    /** Model name */
    public static final String NAME = "ElliSLICE";

    private static final List<String> PARAM_NAMES = List.of("a", "b", "psi", "sigma_0", "center_x", "center_y");

    private final NumericalSettings settings;
    private final BranchCutRegularizer regularizer;

    /**
     * Creates a slice profile with the default numerical settings.
     */
    public EllipticalDensitySlice() {
        this(NumericalSettings.defaults());
    }

    /**
     * Creates a slice profile.
     * @param settings Finite-difference and axis regularization settings
     */
    public EllipticalDensitySlice(NumericalSettings settings) {
        super(NAME, defaultBounds());
        this.settings = Objects.requireNonNull(settings, "settings");
        this.regularizer = settings.regularizer();
        if (!settings.isDefault()) {
            log.debug("Elliptical slice created with {}", settings);
        }
    }

    private static LinkedHashMap<String, Bound> defaultBounds() {
        LinkedHashMap<String, Bound> bounds = new LinkedHashMap<>();
        bounds.put("a", Bound.between(0, 100));
        bounds.put("b", Bound.between(0, 100));
        bounds.put("psi", Bound.symmetric(Math.PI / 2));
        bounds.put("sigma_0", Bound.between(0, 100));
        bounds.put("center_x", Bound.symmetric(100));
        bounds.put("center_y", Bound.symmetric(100));
        return bounds;
    }

    public NumericalSettings getSettings() {
        return settings;
    }

    @Override
    protected Parameters create(double[] values) {
        return new Parameters(values[0], values[1], values[2], values[3], values[4], values[5]);
    }

    /**
     * Checks whether a point lies inside the slice, boundary included.
     * @param x x-coordinate
     * @param y y-coordinate
     * @param p Slice parameters
     * @return true inside or on the ellipse
     */
    public boolean isInside(double x, double y, Parameters p) {
        double[] rot = Coordinates.rotate(x - p.centerX, y - p.centerY, p.psi);
        return rot[0] * rot[0] / (p.a * p.a) + rot[1] * rot[1] / (p.b * p.b) <= 1;
    }

    @Override
    protected double potentialAt(double x, double y, Parameters p) {
        double dx = x - p.centerX;
        double dy = y - p.centerY;
        return isInside(x, y, p) ? potentialInside(dx, dy, p) : potentialOutside(dx, dy, p);
    }

    @Override
    protected void deflectionAt(double x, double y, Parameters p, double[] out) {
        double dx = x - p.centerX;
        double dy = y - p.centerY;
        Complex alpha = isInside(x, y, p) ? deflectionInside(dx, dy, p) : deflectionOutside(dx, dy, p);
        out[0] = alpha.re();
        out[1] = alpha.im();
    }

    /**
     * Differentiates the analytic deflection with the configured scheme and step.
     * Accurate to the truncation order of the scheme, not to machine precision.
     */
    @Override
    public Hessian hessian(double[] x, double[] y, Parameters p) {
        Coordinates.checkShape(x, y);
        Objects.requireNonNull(p, "params");
        DeflectionField field = (xs, ys) -> deflection(xs, ys, p);
        return settings.getHessianMethod().differentiate(field, x, y, settings.getDifferenceStep());
    }

    static double potentialInside(double dx, double dy, Parameters p) {
        double e = p.eccentricity();
        double rE = (p.a + p.b) / 2.0;
        double[] rot = Coordinates.rotate(dx, dy, p.psi);
        double quadratic = 0.5 * ((1 - e) * rot[0] * rot[0] + (1 + e) * rot[1] * rot[1]) * p.sigma0;
        return quadratic + p.sigma0 * rE * rE * (1 - e * e) * Math.log(rE);
    }

    double potentialOutside(double dx, double dy, Parameters p) {
        if (p.a == p.b) {
            // e -> 0 limit of the general formula
            return p.sigma0 * p.a * p.a * (Math.log(Math.hypot(dx, dy)) + 0.5);
        }
        double e = p.eccentricity();
        double f2 = p.a * p.a - p.b * p.b;
        double prefactor = (1 - e * e) / (4 * e) * p.sigma0;
        Complex emipsi = Complex.expi(-p.psi);
        Complex em2ipsi = Complex.expi(-2 * p.psi);
        UnaryOperator<Complex> formula = z -> {
            Complex w = z.multiply(emipsi);
            Complex sw = w.multiply(w.branchSign());
            Complex z2 = z.square().multiply(em2ipsi);
            Complex root = z2.subtract(f2).sqrt();
            return sw.add(root).divide(2.0).log().multiply(f2)
                    .subtract(sw.multiply(root))
                    .add(z2)
                    .multiply(prefactor);
        };
        return regularizer.evaluate(dx, dy, p.psi, formula).re();
    }

    static Complex deflectionInside(double dx, double dy, Parameters p) {
        Complex z = Complex.of(dx, dy);
        Complex e2ipsi = Complex.expi(2 * p.psi);
        return z.subtract(z.conjugate().multiply(e2ipsi).multiply(p.eccentricity())).multiply(p.sigma0);
    }

    Complex deflectionOutside(double dx, double dy, Parameters p) {
        if (p.a == p.b) {
            double scale = p.sigma0 * p.a * p.a / (dx * dx + dy * dy);
            return Complex.of(scale * dx, scale * dy);
        }
        double f2 = p.a * p.a - p.b * p.b;
        double prefactor = 2 * p.a * p.b / f2 * p.sigma0;
        Complex eipsi = Complex.expi(p.psi);
        Complex e2ipsi = Complex.expi(2 * p.psi);
        UnaryOperator<Complex> formula = z -> {
            Complex zb = z.conjugate();
            int s = zb.multiply(eipsi).branchSign();
            Complex root = zb.square().multiply(e2ipsi).subtract(f2).sqrt();
            return zb.multiply(e2ipsi).subtract(eipsi.multiply(root).multiply(s)).multiply(prefactor);
        };
        return regularizer.evaluate(dx, dy, p.psi, formula);
    }

    /**
     * Parameters of an elliptical slice.
     */
    public static final class Parameters implements LensParameters {

        private final double a;
        private final double b;
        private final double psi;
        private final double sigma0;
        private final double centerX;
        private final double centerY;

        /**
         * Creates parameters.
         * @param a Semi-major axis, positive
         * @param b Semi-minor axis, positive and not larger than {@code a}
         * @param psi Orientation of the major axis in radians
         * @param sigma0 Surface mass density
         * @param centerX Centre x
         * @param centerY Centre y
         */
        public Parameters(double a, double b, double psi, double sigma0, double centerX, double centerY) {
            this.a = a;
            this.b = b;
            this.psi = psi;
            this.sigma0 = sigma0;
            this.centerX = centerX;
            this.centerY = centerY;
        }

        /**
         * Creates parameters for a slice centred on the origin.
         */
        public Parameters(double a, double b, double psi, double sigma0) {
            this(a, b, psi, sigma0, 0.0, 0.0);
        }

        public double getA() {
            return a;
        }

        public double getB() {
            return b;
        }

        public double getPsi() {
            return psi;
        }

        public double getSigma0() {
            return sigma0;
        }

        public double getCenterX() {
            return centerX;
        }

        public double getCenterY() {
            return centerY;
        }

        /**
         * Shape parameter {@code e = (a - b) / (a + b)}.
         * @return Eccentricity
         */
        public double eccentricity() {
            return (a - b) / (a + b);
        }

        @Override
        public double[] toArray() {
            return new double[]{a, b, psi, sigma0, centerX, centerY};
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
