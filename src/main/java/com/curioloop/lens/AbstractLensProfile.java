/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.lens;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Base class handling profile metadata, parameter decoding and the batch loop.
 * <p>
 * Subclasses provide the per-point potential and deflection kernels and the
 * batch Hessian. Kernels receive raw sky-plane coordinates and apply the
 * profile centre themselves.
 * </p>
 *
 * @param <P> Parameter type of the profile
 */
public abstract class AbstractLensProfile<P extends LensParameters> implements LensProfile<P> {

    /** Parameter names that default to zero when absent from a map */
    protected static final Set<String> CENTER_NAMES = Set.of("center_x", "center_y");

    private final String name;
    private final List<String> paramNames;
    private final Map<String, Bound> defaultBounds;
    private final Map<String, Double> lowerLimits;
    private final Map<String, Double> upperLimits;

    /**
     * Creates a profile.
     * @param name Model name
     * @param defaultBounds Default range of every parameter, in canonical parameter order
     */
    protected AbstractLensProfile(String name, LinkedHashMap<String, Bound> defaultBounds) {
        this.name = Objects.requireNonNull(name, "name");
        this.paramNames = Collections.unmodifiableList(new ArrayList<>(defaultBounds.keySet()));
        this.defaultBounds = Collections.unmodifiableMap(new LinkedHashMap<>(defaultBounds));
        Map<String, Double> lower = new LinkedHashMap<>();
        Map<String, Double> upper = new LinkedHashMap<>();
        for (Map.Entry<String, Bound> entry : defaultBounds.entrySet()) {
            lower.put(entry.getKey(), entry.getValue().getLower());
            upper.put(entry.getKey(), entry.getValue().getUpper());
        }
        this.lowerLimits = Collections.unmodifiableMap(lower);
        this.upperLimits = Collections.unmodifiableMap(upper);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public List<String> getParamNames() {
        return paramNames;
    }

    @Override
    public Map<String, Bound> getDefaultBounds() {
        return defaultBounds;
    }

    @Override
    public Map<String, Double> getLowerLimitDefault() {
        return lowerLimits;
    }

    @Override
    public Map<String, Double> getUpperLimitDefault() {
        return upperLimits;
    }

    @Override
    public P parameters(Map<String, Double> values) {
        if (values == null) {
            throw new IllegalArgumentException("Parameter map must not be null");
        }
        for (String key : values.keySet()) {
            if (!paramNames.contains(key)) {
                throw new IllegalArgumentException("Unknown parameter '" + key + "' for " + name
                        + ", expected one of " + paramNames);
            }
        }
        double[] ordered = new double[paramNames.size()];
        for (int i = 0; i < ordered.length; i++) {
            String param = paramNames.get(i);
            Double value = values.get(param);
            if (value != null) {
                ordered[i] = value;
            } else if (!CENTER_NAMES.contains(param)) {
                throw new IllegalArgumentException("Missing parameter '" + param + "' for " + name);
            }
        }
        return parameters(ordered);
    }

    @Override
    public P parameters(double[] values) {
        if (values == null || values.length != paramNames.size()) {
            throw new IllegalArgumentException(name + " expects " + paramNames.size()
                    + " parameter values " + paramNames);
        }
        return create(values);
    }

    /**
     * Creates parameters from values in canonical order; the length is already checked.
     */
    protected abstract P create(double[] values);

    @Override
    public double[] potential(double[] x, double[] y, P params) {
        int n = Coordinates.checkShape(x, y);
        Objects.requireNonNull(params, "params");
        double[] f = new double[n];
        for (int i = 0; i < n; i++) {
            f[i] = potentialAt(x[i], y[i], params);
        }
        return f;
    }

    @Override
    public Deflection deflection(double[] x, double[] y, P params) {
        int n = Coordinates.checkShape(x, y);
        Objects.requireNonNull(params, "params");
        double[] alphaX = new double[n];
        double[] alphaY = new double[n];
        double[] out = new double[2];
        for (int i = 0; i < n; i++) {
            deflectionAt(x[i], y[i], params, out);
            alphaX[i] = out[0];
            alphaY[i] = out[1];
        }
        return new Deflection(alphaX, alphaY);
    }

    /**
     * Potential at a single point.
     */
    protected abstract double potentialAt(double x, double y, P params);

    /**
     * Deflection at a single point.
     * @param out Receives {@code {f_x, f_y}}
     */
    protected abstract void deflectionAt(double x, double y, P params, double[] out);

    /**
     * Joins a parameter array with the profile's names.
     */
    protected static Map<String, Double> namedValues(List<String> names, double[] values) {
        Map<String, Double> map = new LinkedHashMap<>();
        for (int i = 0; i < values.length; i++) {
            map.put(names.get(i), values[i]);
        }
        return Collections.unmodifiableMap(map);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{name=" + name + ", params=" + paramNames + '}';
    }
}
