/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.lens;

/**
 * Default admissible range of a lens parameter.
 * <p>
 * Profiles publish one bound per parameter for external fitting code. The
 * profiles themselves never clamp or reject values outside the range.
 * </p>
 */
public final class Bound {

    private final double lower;
    private final double upper;

    /**
     * Creates a closed range {@code [lower, upper]}.
     * @param lower Lower limit
     * @param upper Upper limit
     */
    public Bound(double lower, double upper) {
        if (Double.isNaN(lower) || Double.isNaN(upper)) {
            throw new IllegalArgumentException("Bound limits must not be NaN");
        }
        if (lower > upper) {
            throw new IllegalArgumentException("Lower bound must not exceed upper bound");
        }
        this.lower = lower;
        this.upper = upper;
    }

    /**
     * Creates a closed range {@code [lower, upper]}.
     * @param lower Lower limit
     * @param upper Upper limit
     * @return Bound
     */
    public static Bound between(double lower, double upper) {
        return new Bound(lower, upper);
    }

    /**
     * Creates a range symmetric around zero, {@code [-limit, limit]}.
     * @param limit Non-negative half width
     * @return Bound
     */
    public static Bound symmetric(double limit) {
        return new Bound(-limit, limit);
    }

    public double getLower() {
        return lower;
    }

    public double getUpper() {
        return upper;
    }

    /**
     * Checks whether a value lies inside the range, limits included.
     * @param value Value to test
     * @return true if {@code lower <= value <= upper}
     */
    public boolean contains(double value) {
        return value >= lower && value <= upper;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Bound)) return false;
        Bound other = (Bound) obj;
        return Double.compare(lower, other.lower) == 0 && Double.compare(upper, other.upper) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(lower) * 31 + Double.hashCode(upper);
    }

    @Override
    public String toString() {
        return "[" + lower + ", " + upper + "]";
    }
}
