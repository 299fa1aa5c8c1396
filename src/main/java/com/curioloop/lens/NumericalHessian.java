/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.lens;

/**
 * Finite-difference Hessians of a deflection field.
 * <p>
 * Used by profiles whose second derivatives have no closed form. Each scheme
 * differentiates both deflection components along x and along y with an
 * absolute step {@code h}:
 * </p>
 * <pre>
 *   fxx = d(alphaX)/dx   fxy = d(alphaX)/dy
 *   fyx = d(alphaY)/dx   fyy = d(alphaY)/dy
 * </pre>
 * <p>
 * The truncation error is {@code O(h^p)} with {@code p} given by
 * {@link #getAccuracyOrder()}, plus a rounding error of roughly
 * {@code ulp(alpha) / h}. {@code fxy} and {@code fyx} are therefore only
 * approximately symmetric. Differencing across a density discontinuity (an
 * elliptical slice boundary) does not converge there.
 * </p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * DeflectionField field = (x, y) -> slice.deflection(x, y, params);
 * Hessian h = NumericalHessian.FORWARD.differentiate(field, x, y, 1e-9);
 * }</pre>
 *
 * @see DeflectionField
 */
public enum NumericalHessian {

    /**
     * Forward difference.
     * <p>
     * f' ≈ (alpha(x + h) - alpha(x)) / h
     * </p>
     * Three field evaluations, first order.
     */
    FORWARD(1) {
        @Override
        public Hessian differentiate(DeflectionField field, double[] x, double[] y, double step) {
            int n = checkArguments(x, y, step);
            Deflection base = field.evaluate(x, y);

            double[] xs = shift(x, step);
            double[] ys = shift(y, step);
            Deflection dx = field.evaluate(xs, y);
            Deflection dy = field.evaluate(x, ys);

            double[][] h = new double[4][n];
            for (int i = 0; i < n; i++) {
                // Steps actually taken after rounding of x + h
                double hx = xs[i] - x[i];
                double hy = ys[i] - y[i];
                store(h, i,
                        (dx.alphaX(i) - base.alphaX(i)) / hx,
                        (dy.alphaX(i) - base.alphaX(i)) / hy,
                        (dx.alphaY(i) - base.alphaY(i)) / hx,
                        (dy.alphaY(i) - base.alphaY(i)) / hy);
            }
            return new Hessian(h[0], h[1], h[2], h[3]);
        }
    },

    /**
     * Backward difference.
     * <p>
     * f' ≈ (alpha(x) - alpha(x - h)) / h
     * </p>
     * Same cost and order as forward difference.
     */
    BACKWARD(1) {
        @Override
        public Hessian differentiate(DeflectionField field, double[] x, double[] y, double step) {
            int n = checkArguments(x, y, step);
            Deflection base = field.evaluate(x, y);

            double[] xs = shift(x, -step);
            double[] ys = shift(y, -step);
            Deflection dx = field.evaluate(xs, y);
            Deflection dy = field.evaluate(x, ys);

            double[][] h = new double[4][n];
            for (int i = 0; i < n; i++) {
                double hx = x[i] - xs[i];
                double hy = y[i] - ys[i];
                store(h, i,
                        (base.alphaX(i) - dx.alphaX(i)) / hx,
                        (base.alphaX(i) - dy.alphaX(i)) / hy,
                        (base.alphaY(i) - dx.alphaY(i)) / hx,
                        (base.alphaY(i) - dy.alphaY(i)) / hy);
            }
            return new Hessian(h[0], h[1], h[2], h[3]);
        }
    },

    /**
     * Central difference.
     * <p>
     * f' ≈ (alpha(x + h) - alpha(x - h)) / (2h)
     * </p>
     * Four field evaluations, second order.
     */
    CENTRAL(2) {
        @Override
        public Hessian differentiate(DeflectionField field, double[] x, double[] y, double step) {
            int n = checkArguments(x, y, step);

            double[] xp = shift(x, step);
            double[] xm = shift(x, -step);
            double[] yp = shift(y, step);
            double[] ym = shift(y, -step);
            Deflection dxp = field.evaluate(xp, y);
            Deflection dxm = field.evaluate(xm, y);
            Deflection dyp = field.evaluate(x, yp);
            Deflection dym = field.evaluate(x, ym);

            double[][] h = new double[4][n];
            for (int i = 0; i < n; i++) {
                double hx = xp[i] - xm[i];
                double hy = yp[i] - ym[i];
                store(h, i,
                        (dxp.alphaX(i) - dxm.alphaX(i)) / hx,
                        (dyp.alphaX(i) - dym.alphaX(i)) / hy,
                        (dxp.alphaY(i) - dxm.alphaY(i)) / hx,
                        (dyp.alphaY(i) - dym.alphaY(i)) / hy);
            }
            return new Hessian(h[0], h[1], h[2], h[3]);
        }
    },

    /**
     * Five-point stencil.
     * <p>
     * f' ≈ (-alpha(x+2h) + 8 alpha(x+h) - 8 alpha(x-h) + alpha(x-2h)) / (12h)
     * </p>
     * Eight field evaluations, fourth order. Only pays off with a step much
     * larger than the default.
     */
    FIVE_POINT(4) {
        @Override
        public Hessian differentiate(DeflectionField field, double[] x, double[] y, double step) {
            int n = checkArguments(x, y, step);

            double[][] xs = new double[4][];
            double[][] ys = new double[4][];
            Deflection[] alongX = new Deflection[4];
            Deflection[] alongY = new Deflection[4];
            for (int k = 0; k < 4; k++) {
                xs[k] = shift(x, STENCIL[k] * step);
                ys[k] = shift(y, STENCIL[k] * step);
                alongX[k] = field.evaluate(xs[k], y);
                alongY[k] = field.evaluate(x, ys[k]);
            }

            double[][] h = new double[4][n];
            for (int i = 0; i < n; i++) {
                // 12h from the span actually taken between x - h and x + h
                double hx = 6.0 * (xs[1][i] - xs[2][i]);
                double hy = 6.0 * (ys[1][i] - ys[2][i]);
                store(h, i,
                        (-alongX[0].alphaX(i) + 8 * alongX[1].alphaX(i)
                                - 8 * alongX[2].alphaX(i) + alongX[3].alphaX(i)) / hx,
                        (-alongY[0].alphaX(i) + 8 * alongY[1].alphaX(i)
                                - 8 * alongY[2].alphaX(i) + alongY[3].alphaX(i)) / hy,
                        (-alongX[0].alphaY(i) + 8 * alongX[1].alphaY(i)
                                - 8 * alongX[2].alphaY(i) + alongX[3].alphaY(i)) / hx,
                        (-alongY[0].alphaY(i) + 8 * alongY[1].alphaY(i)
                                - 8 * alongY[2].alphaY(i) + alongY[3].alphaY(i)) / hy);
            }
            return new Hessian(h[0], h[1], h[2], h[3]);
        }
    };

    /** Offsets, in steps, of the five-point stencil samples */
    private static final double[] STENCIL = {2.0, 1.0, -1.0, -2.0};

    private final int accuracyOrder;

    NumericalHessian(int accuracyOrder) {
        this.accuracyOrder = accuracyOrder;
    }

    /**
     * Differentiates a deflection field at each point.
     * @param field Deflection field
     * @param x x-coordinates (not modified)
     * @param y y-coordinates (not modified)
     * @param step Absolute difference step, positive and finite
     * @return Hessian with one entry per point
     * @throws ShapeMismatchException if the coordinate arrays differ in length
     * @throws IllegalArgumentException if the step is not positive and finite
     */
    public abstract Hessian differentiate(DeflectionField field, double[] x, double[] y, double step);

    /**
     * Gets the order {@code p} of the truncation error {@code O(h^p)}.
     * @return Accuracy order
     */
    public int getAccuracyOrder() {
        return accuracyOrder;
    }

    private static int checkArguments(double[] x, double[] y, double step) {
        if (!(step > 0) || Double.isInfinite(step)) {
            throw new IllegalArgumentException("Difference step must be positive and finite: " + step);
        }
        return Coordinates.checkShape(x, y);
    }

    private static double[] shift(double[] values, double offset) {
        double[] shifted = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            shifted[i] = values[i] + offset;
        }
        return shifted;
    }

    private static void store(double[][] h, int i, double fxx, double fxy, double fyx, double fyy) {
        h[0][i] = fxx;
        h[1][i] = fxy;
        h[2][i] = fyx;
        h[3][i] = fyy;
    }
}
