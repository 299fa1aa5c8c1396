/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.lens;

import java.util.Locale;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Numerical constants used where a profile has no exact closed form.
 * <ul>
 *   <li>differenceStep: absolute step of the finite-difference Hessian</li>
 *   <li>axisTolerance / axisPerturbation: see {@link BranchCutRegularizer}</li>
 *   <li>hessianMethod: finite-difference scheme</li>
 * </ul>
 * <p>
 * The defaults assume coordinates of order unity (arcseconds). Lenses
 * evaluated on very different scales should scale them accordingly.
 * </p>
 */
public final class NumericalSettings {

    private static final Logger log = LoggerFactory.getLogger(NumericalSettings.class);

    /** System property overriding the difference step */
    public static final String DIFFERENCE_STEP_PROPERTY = "lens4j.difference.step";

    /** System property overriding the axis tolerance */
    public static final String AXIS_TOLERANCE_PROPERTY = "lens4j.axis.tolerance";

    /** System property overriding the axis perturbation */
    public static final String AXIS_PERTURBATION_PROPERTY = "lens4j.axis.perturbation";

    /** System property overriding the Hessian scheme */
    public static final String HESSIAN_METHOD_PROPERTY = "lens4j.hessian.method";

    private static final NumericalSettings DEFAULTS = builder().build();

    private final double differenceStep;
    private final double axisTolerance;
    private final double axisPerturbation;
    private final NumericalHessian hessianMethod;

    private NumericalSettings(Builder builder) {
        this.differenceStep = builder.differenceStep;
        this.axisTolerance = builder.axisTolerance;
        this.axisPerturbation = builder.axisPerturbation;
        this.hessianMethod = builder.hessianMethod;
    }

    /**
     * Creates a new builder initialised with the defaults.
     * @return New builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Gets the default settings.
     * @return Default settings
     */
    public static NumericalSettings defaults() {
        return DEFAULTS;
    }

    /**
     * Creates settings from {@code lens4j.*} system properties, using the
     * defaults for properties that are not set.
     * @return Settings
     * @throws IllegalArgumentException if a property is set to an invalid value
     */
    public static NumericalSettings fromSystemProperties() {
        Builder builder = builder();
        String step = property(DIFFERENCE_STEP_PROPERTY);
        if (step != null) {
            builder.differenceStep(parse(DIFFERENCE_STEP_PROPERTY, step, Double::parseDouble));
        }
        String tolerance = property(AXIS_TOLERANCE_PROPERTY);
        if (tolerance != null) {
            builder.axisTolerance(parse(AXIS_TOLERANCE_PROPERTY, tolerance, Double::parseDouble));
        }
        String perturbation = property(AXIS_PERTURBATION_PROPERTY);
        if (perturbation != null) {
            builder.axisPerturbation(parse(AXIS_PERTURBATION_PROPERTY, perturbation, Double::parseDouble));
        }
        String method = property(HESSIAN_METHOD_PROPERTY);
        if (method != null) {
            builder.hessianMethod(parse(HESSIAN_METHOD_PROPERTY, method,
                    v -> NumericalHessian.valueOf(v.toUpperCase(Locale.ROOT))));
        }
        NumericalSettings settings = builder.build();
        log.debug("Resolved numerical settings from system properties: {}", settings);
        return settings;
    }

    private static String property(String name) {
        String value = System.getProperty(name);
        return value == null || value.trim().isEmpty() ? null : value.trim();
    }

    private static <T> T parse(String name, String value, Function<String, T> parser) {
        try {
            return parser.apply(value);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid value for system property " + name + ": " + value, e);
        }
    }

    public double getDifferenceStep() {
        return differenceStep;
    }

    public double getAxisTolerance() {
        return axisTolerance;
    }

    public double getAxisPerturbation() {
        return axisPerturbation;
    }

    public NumericalHessian getHessianMethod() {
        return hessianMethod;
    }

    /**
     * Creates the branch-cut regularizer described by these settings.
     * @return Regularizer
     */
    public BranchCutRegularizer regularizer() {
        if (axisTolerance == BranchCutRegularizer.DEFAULT_THRESHOLD
                && axisPerturbation == BranchCutRegularizer.DEFAULT_PERTURBATION) {
            return BranchCutRegularizer.defaults();
        }
        return new BranchCutRegularizer(axisTolerance, axisPerturbation);
    }

    /**
     * Checks whether all values equal the defaults.
     * @return true for default settings
     */
    public boolean isDefault() {
        return equals(DEFAULTS);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof NumericalSettings)) return false;
        NumericalSettings other = (NumericalSettings) obj;
        return Double.compare(differenceStep, other.differenceStep) == 0
                && Double.compare(axisTolerance, other.axisTolerance) == 0
                && Double.compare(axisPerturbation, other.axisPerturbation) == 0
                && hessianMethod == other.hessianMethod;
    }

    @Override
    public int hashCode() {
        int result = Double.hashCode(differenceStep);
        result = 31 * result + Double.hashCode(axisTolerance);
        result = 31 * result + Double.hashCode(axisPerturbation);
        return 31 * result + hessianMethod.hashCode();
    }

    /**
     * Builder for NumericalSettings.
     */
    public static final class Builder {
        private double differenceStep = 1e-9;
        private double axisTolerance = BranchCutRegularizer.DEFAULT_THRESHOLD;
        private double axisPerturbation = BranchCutRegularizer.DEFAULT_PERTURBATION;
        private NumericalHessian hessianMethod = NumericalHessian.FORWARD;

        private Builder() {}

        /**
         * Sets the finite-difference step.
         * @param value Step (must be positive and finite)
         * @return This builder
         */
        public Builder differenceStep(double value) {
            if (!(value > 0) || Double.isInfinite(value)) {
                throw new IllegalArgumentException("Difference step must be positive");
            }
            this.differenceStep = value;
            return this;
        }

        /**
         * Sets the axis proximity threshold.
         * @param value Threshold (must be non-negative and finite)
         * @return This builder
         */
        public Builder axisTolerance(double value) {
            if (!(value >= 0) || Double.isInfinite(value)) {
                throw new IllegalArgumentException("Axis tolerance must be non-negative");
            }
            this.axisTolerance = value;
            return this;
        }

        /**
         * Sets the angular offset of the extra samples taken near an axis.
         * @param value Perturbation (must be positive and finite)
         * @return This builder
         */
        public Builder axisPerturbation(double value) {
            if (!(value > 0) || Double.isInfinite(value)) {
                throw new IllegalArgumentException("Axis perturbation must be positive");
            }
            this.axisPerturbation = value;
            return this;
        }

        /**
         * Sets the finite-difference scheme.
         * @param value Scheme
         * @return This builder
         */
        public Builder hessianMethod(NumericalHessian value) {
            if (value == null) {
                throw new IllegalArgumentException("Hessian method must not be null");
            }
            this.hessianMethod = value;
            return this;
        }

        /**
         * Builds the settings.
         * @return Settings
         */
        public NumericalSettings build() {
            return new NumericalSettings(this);
        }
    }

    @Override
    public String toString() {
        return "NumericalSettings{" +
                "differenceStep=" + differenceStep +
                ", axisTolerance=" + axisTolerance +
                ", axisPerturbation=" + axisPerturbation +
                ", hessianMethod=" + hessianMethod +
                '}';
    }
}
