/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.lens;

import java.util.List;
import java.util.Map;

/**
 * Analytic lens mass profile.
 * <p>
 * A profile evaluates the lensing potential {@code f}, its gradient (the
 * deflection angle) and its second derivatives at sky-plane positions. All
 * operations are pure functions of the coordinates and parameters: profiles
 * hold no evaluation state and may be shared between threads.
 * </p>
 * <p>
 * Array operations return one value per input point, in input order, and
 * select the branch of the profile independently for each point. Scalar
 * operations are conveniences that evaluate a single point the same way.
 * </p>
 * <p>
 * Parameters outside the published bounds are neither rejected nor clamped.
 * Degenerate inputs produce NaN or infinite values instead of exceptions, so
 * that batch evaluation is never interrupted; only mismatched coordinate
 * arrays throw ({@link ShapeMismatchException}).
 * </p>
 *
 * <h2>Example usage</h2>
 * <pre>{@code
 * TruncatedIsothermalSphere sis = new TruncatedIsothermalSphere();
 * TruncatedIsothermalSphere.Parameters params = sis.parameters(Map.of("theta_E", 1.0, "r_trunc", 2.0));
 *
 * double f = sis.potential(0.5, 0.0, params);
 * Deflection alpha = sis.deflection(new double[]{0.5, 1.5}, new double[]{0.0, 0.0}, params);
 * }</pre>
 *
 * @param <P> Parameter type of the profile
 */
public interface LensProfile<P extends LensParameters> {

    /**
     * Gets the model name under which the profile is registered.
     * @return Model name
     * @see LensProfileType
     */
    String getName();

    /**
     * Gets the parameter names in canonical order.
     * @return Unmodifiable list of names
     */
    List<String> getParamNames();

    /**
     * Gets the default admissible range of each parameter.
     * @return Unmodifiable map in parameter order
     */
    Map<String, Bound> getDefaultBounds();

    /**
     * Gets the default lower limit of each parameter.
     * @return Unmodifiable map in parameter order
     */
    Map<String, Double> getLowerLimitDefault();

    /**
     * Gets the default upper limit of each parameter.
     * @return Unmodifiable map in parameter order
     */
    Map<String, Double> getUpperLimitDefault();

    /**
     * Decodes parameters from a name-to-value map. Centre coordinates default to zero.
     * @param values Parameter values by name
     * @return Parameters
     * @throws IllegalArgumentException if a required name is missing or a name is unknown
     */
    P parameters(Map<String, Double> values);

    /**
     * Decodes parameters from an array in {@link #getParamNames()} order.
     * @param values Parameter values
     * @return Parameters
     * @throws IllegalArgumentException if the array length does not match
     */
    P parameters(double[] values);

    /**
     * Evaluates the lensing potential.
     * @param x x-coordinates
     * @param y y-coordinates
     * @param params Profile parameters
     * @return Potential per point
     * @throws ShapeMismatchException if the coordinate arrays differ in length
     */
    double[] potential(double[] x, double[] y, P params);

    /**
     * Evaluates the deflection angle, the gradient of the potential.
     * @param x x-coordinates
     * @param y y-coordinates
     * @param params Profile parameters
     * @return Deflection per point
     * @throws ShapeMismatchException if the coordinate arrays differ in length
     */
    Deflection deflection(double[] x, double[] y, P params);

    /**
     * Evaluates the second derivatives of the potential.
     * @param x x-coordinates
     * @param y y-coordinates
     * @param params Profile parameters
     * @return Hessian per point
     * @throws ShapeMismatchException if the coordinate arrays differ in length
     */
    Hessian hessian(double[] x, double[] y, P params);

    /**
     * Evaluates the lensing potential at one point.
     * @return Potential
     */
    default double potential(double x, double y, P params) {
        return potential(new double[]{x}, new double[]{y}, params)[0];
    }

    /**
     * Evaluates the deflection angle at one point.
     * @return {@code {f_x, f_y}}
     */
    default double[] deflection(double x, double y, P params) {
        return deflection(new double[]{x}, new double[]{y}, params).at(0);
    }

    /**
     * Evaluates the second derivatives at one point.
     * @return {@code {f_xx, f_xy, f_yx, f_yy}}
     */
    default double[] hessian(double x, double y, P params) {
        return hessian(new double[]{x}, new double[]{y}, params).at(0);
    }

    /**
     * Evaluates the potential with parameters given by name.
     * <p>Useful when the profile is only known as {@code LensProfile<?>}.</p>
     */
    default double[] potential(double[] x, double[] y, Map<String, Double> values) {
        return potential(x, y, parameters(values));
    }

    /**
     * Evaluates the deflection with parameters given by name.
     */
    default Deflection deflection(double[] x, double[] y, Map<String, Double> values) {
        return deflection(x, y, parameters(values));
    }

    /**
     * Evaluates the Hessian with parameters given by name.
     */
    default Hessian hessian(double[] x, double[] y, Map<String, Double> values) {
        return hessian(x, y, parameters(values));
    }
}
