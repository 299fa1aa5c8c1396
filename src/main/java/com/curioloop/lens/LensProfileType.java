/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.lens;

/**
 * Registry of the available lens profiles, keyed by model name.
 * <p>
 * Model lists built by fitting code refer to profiles by these names.
 * Every call to {@code create} returns a new, stateless profile.
 * </p>
 * <pre>{@code
 * LensProfile<?> profile = LensProfileType.fromName("SIS_TRUNCATED").create();
 * double[] f = profile.potential(x, y, Map.of("theta_E", 1.0, "r_trunc", 2.0));
 * }</pre>
 */
public enum LensProfileType {

    /** {@link TruncatedIsothermalSphere} */
    SIS_TRUNCATED(TruncatedIsothermalSphere.NAME) {
        @Override
        public LensProfile<?> create(NumericalSettings settings) {
            return new TruncatedIsothermalSphere();
        }
    },

    /** {@link EllipticalDensitySlice} */
    ELLI_SLICE(EllipticalDensitySlice.NAME) {
        @Override
        public LensProfile<?> create(NumericalSettings settings) {
            return new EllipticalDensitySlice(settings);
        }
    };

    private final String modelName;

    LensProfileType(String modelName) {
        this.modelName = modelName;
    }

    /**
     * Gets the model name.
     * @return Model name
     */
    public String getModelName() {
        return modelName;
    }

    /**
     * Creates a profile with the default numerical settings.
     * @return New profile
     */
    public LensProfile<?> create() {
        return create(NumericalSettings.defaults());
    }

    /**
     * Creates a profile. Profiles with exact formulas ignore the settings.
     * @param settings Numerical settings
     * @return New profile
     */
    public abstract LensProfile<?> create(NumericalSettings settings);

    /**
     * Looks up a profile type by model name or enum constant name, ignoring case.
     * @param name Model name such as {@code "SIS_TRUNCATED"} or {@code "ElliSLICE"}
     * @return Profile type
     * @throws IllegalArgumentException if no profile has that name
     */
    public static LensProfileType fromName(String name) {
        if (name != null) {
            for (LensProfileType type : values()) {
                if (type.modelName.equalsIgnoreCase(name) || type.name().equalsIgnoreCase(name)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown lens model: " + name);
    }

    @Override
    public String toString() {
        return name() + "(" + modelName + ")";
    }
}
