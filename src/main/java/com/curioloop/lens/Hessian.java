/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.lens;

/**
 * Second derivatives of the lensing potential evaluated at a batch of points.
 * <p>
 * Components follow the convention {@code fxy = d(alphaX)/dy} and
 * {@code fyx = d(alphaY)/dx}. They are equal for closed-form Hessians and
 * only approximately equal when obtained by {@link NumericalHessian}.
 * </p>
 * <p>
 * The derived quantities divide by zero on critical curves and return
 * infinite values there.
 * </p>
 */
public final class Hessian {

    private final double[] fxx;
    private final double[] fxy;
    private final double[] fyx;
    private final double[] fyy;

    /**
     * Creates a Hessian result. The arrays are taken over, not copied.
     */
    public Hessian(double[] fxx, double[] fxy, double[] fyx, double[] fyy) {
        Coordinates.checkShape(fxx, fxy);
        Coordinates.checkShape(fxx, fyx);
        Coordinates.checkShape(fxx, fyy);
        this.fxx = fxx;
        this.fxy = fxy;
        this.fyx = fyx;
        this.fyy = fyy;
    }

    public int size() {
        return fxx.length;
    }

    public double fxx(int i) {
        return fxx[i];
    }

    public double fxy(int i) {
        return fxy[i];
    }

    public double fyx(int i) {
        return fyx[i];
    }

    public double fyy(int i) {
        return fyy[i];
    }

    public double[] getFxx() {
        return fxx.clone();
    }

    public double[] getFxy() {
        return fxy.clone();
    }

    public double[] getFyx() {
        return fyx.clone();
    }

    public double[] getFyy() {
        return fyy.clone();
    }

    /**
     * Gets the Hessian at one point.
     * @param i Point index
     * @return {@code {fxx, fxy, fyx, fyy}}
     */
    public double[] at(int i) {
        return new double[]{fxx[i], fxy[i], fyx[i], fyy[i]};
    }

    /**
     * Convergence {@code kappa = (fxx + fyy) / 2}.
     * @return Convergence per point
     */
    public double[] convergence() {
        double[] kappa = new double[fxx.length];
        for (int i = 0; i < kappa.length; i++) {
            kappa[i] = 0.5 * (fxx[i] + fyy[i]);
        }
        return kappa;
    }

    /**
     * Shear modulus {@code sqrt(gamma1^2 + gamma2^2)} with
     * {@code gamma1 = (fxx - fyy) / 2} and {@code gamma2 = fxy}.
     * @return Shear per point
     */
    public double[] shear() {
        double[] gamma = new double[fxx.length];
        for (int i = 0; i < gamma.length; i++) {
            double gamma1 = 0.5 * (fxx[i] - fyy[i]);
            gamma[i] = Math.hypot(gamma1, fxy[i]);
        }
        return gamma;
    }

    /**
     * Signed magnification {@code 1 / det(A)} of the lens mapping
     * {@code A = I - H}.
     * @return Magnification per point
     */
    public double[] magnification() {
        double[] mu = new double[fxx.length];
        for (int i = 0; i < mu.length; i++) {
            double det = (1.0 - fxx[i]) * (1.0 - fyy[i]) - fxy[i] * fyx[i];
            mu[i] = 1.0 / det;
        }
        return mu;
    }

    @Override
    public String toString() {
        return "Hessian{size=" + size() + "}";
    }
}
