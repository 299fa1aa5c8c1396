/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.lens;

/**
 * Deflection angles evaluated at a batch of points.
 * <p>
 * Element {@code i} belongs to the {@code i}-th input coordinate.
 * </p>
 */
public final class Deflection {

    private final double[] alphaX;
    private final double[] alphaY;

    /**
     * Creates a deflection result. The arrays are taken over, not copied.
     * @param alphaX x-components (df/dx)
     * @param alphaY y-components (df/dy)
     */
    public Deflection(double[] alphaX, double[] alphaY) {
        Coordinates.checkShape(alphaX, alphaY);
        this.alphaX = alphaX;
        this.alphaY = alphaY;
    }

    /**
     * Gets the number of evaluated points.
     * @return Point count
     */
    public int size() {
        return alphaX.length;
    }

    public double alphaX(int i) {
        return alphaX[i];
    }

    public double alphaY(int i) {
        return alphaY[i];
    }

    /**
     * Gets the x-components.
     * @return Copy of the x-components
     */
    public double[] getAlphaX() {
        return alphaX.clone();
    }

    /**
     * Gets the y-components.
     * @return Copy of the y-components
     */
    public double[] getAlphaY() {
        return alphaY.clone();
    }

    /**
     * Gets the deflection at one point.
     * @param i Point index
     * @return {@code {alphaX, alphaY}}
     */
    public double[] at(int i) {
        return new double[]{alphaX[i], alphaY[i]};
    }

    @Override
    public String toString() {
        return "Deflection{size=" + size() + "}";
    }
}
