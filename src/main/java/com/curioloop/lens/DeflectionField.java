/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.lens;

/**
 * A deflection field evaluated over a batch of points.
 * <p>
 * This is the input of {@link NumericalHessian}: profiles without a closed-form
 * Hessian expose their analytic deflection through it and differentiate numerically.
 * </p>
 * <pre>{@code
 * DeflectionField field = (x, y) -> profile.deflection(x, y, params);
 * Hessian h = NumericalHessian.FORWARD.differentiate(field, x, y, 1e-9);
 * }</pre>
 *
 * @see NumericalHessian
 */
@FunctionalInterface
public interface DeflectionField {

    /**
     * Evaluates the deflection at each point.
     * <p>
     * Implementations must not modify the coordinate arrays.
     * </p>
     *
     * @param x x-coordinates
     * @param y y-coordinates, same length as {@code x}
     * @return Deflection with one entry per point
     */
    Deflection evaluate(double[] x, double[] y);
}
